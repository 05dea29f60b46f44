package my.goalplanner.app.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import my.goalplanner.app.domain.Goal;

import java.util.List;

public record PlanRequest(
		@NotNull @Valid ClientProfileRequest profile,
		@NotNull List<@Valid @NotNull GoalRequest> goals
) {
	public List<Goal> toGoals() {
		return goals.stream().map(GoalRequest::toGoal).toList();
	}
}
