package my.goalplanner.app.domain;

import java.math.BigDecimal;
import java.util.List;

public record ConflictWarning(ConflictType type,
							  List<String> goalIds,
							  int fromYear,
							  int toYear,
							  BigDecimal combinedMonthlySIP,
							  BigDecimal availableSurplus,
							  BigDecimal shortfall) {
}
