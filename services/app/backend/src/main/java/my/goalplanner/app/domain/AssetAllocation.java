package my.goalplanner.app.domain;

/**
 * Percentage split of a goal's contributions across asset classes. Always sums to 100.
 */
public record AssetAllocation(int equityPct, int debtPct, int goldPct) {
	public AssetAllocation {
		if (equityPct < 0 || debtPct < 0 || goldPct < 0) {
			throw new IllegalArgumentException("Allocation percentages must not be negative");
		}
		if (equityPct + debtPct + goldPct != 100) {
			throw new IllegalArgumentException("Allocation percentages must sum to 100 but were "
					+ (equityPct + debtPct + goldPct));
		}
	}
}
