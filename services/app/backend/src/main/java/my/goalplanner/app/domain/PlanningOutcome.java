package my.goalplanner.app.domain;

/**
 * A plan as returned to the caller. {@code advice} inside the recommendation is null when the
 * advisory source was unavailable; {@code adviceError} then says why.
 */
public record PlanningOutcome(
		GoalRecommendation recommendation,
		boolean fromCache,
		long ageMinutes,
		boolean stale,
		boolean adviceAvailable,
		String adviceError,
		boolean adviceRetryable
) {
}
