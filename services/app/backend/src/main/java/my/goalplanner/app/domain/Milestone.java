package my.goalplanner.app.domain;

import java.math.BigDecimal;

public record Milestone(int percentage, BigDecimal targetValue, int monthsRequired, int year) {
}
