package my.goalplanner.app.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import my.goalplanner.app.domain.Goal;
import my.goalplanner.app.domain.Priority;

import java.math.BigDecimal;

public record GoalRequest(
		@NotBlank String id,
		@NotBlank String title,
		@NotNull @PositiveOrZero BigDecimal targetAmount,
		@NotNull @Min(Goal.MIN_TARGET_YEAR) @Max(Goal.MAX_TARGET_YEAR) Integer targetYear,
		@NotNull Priority priority
) {
	public Goal toGoal() {
		return new Goal(id, title, targetAmount, targetYear, priority);
	}
}
