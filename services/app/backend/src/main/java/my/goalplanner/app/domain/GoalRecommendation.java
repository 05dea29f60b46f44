package my.goalplanner.app.domain;

import java.util.List;

/**
 * Everything computed for one client and goal set: the cached payload.
 */
public record GoalRecommendation(String clientId,
								 int planningYear,
								 List<ProjectedGoal> goals,
								 List<ConflictWarning> conflicts,
								 AllocationPlan allocation,
								 AdvisoryRecommendation advice) {
}
