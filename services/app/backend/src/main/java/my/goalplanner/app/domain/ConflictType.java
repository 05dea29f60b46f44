package my.goalplanner.app.domain;

public enum ConflictType {
	/** Several near-term goals compete for the same surplus. */
	TIMELINE_CLUSTER,
	/** One goal alone needs more than the whole surplus. */
	SELF
}
