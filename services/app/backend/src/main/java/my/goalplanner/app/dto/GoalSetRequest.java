package my.goalplanner.app.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import my.goalplanner.app.domain.Goal;
import my.goalplanner.app.domain.RiskTolerance;

import java.math.BigDecimal;
import java.util.List;

public record GoalSetRequest(
		@NotNull RiskTolerance riskTolerance,
		@NotNull @PositiveOrZero BigDecimal availableSurplus,
		@NotNull List<@Valid @NotNull GoalRequest> goals
) {
	public List<Goal> toGoals() {
		return goals.stream().map(GoalRequest::toGoal).toList();
	}
}
