package my.goalplanner.app.model;

import lombok.AllArgsConstructor;
import lombok.Getter;
import my.goalplanner.app.domain.AssetAllocation;
import my.goalplanner.app.domain.RiskTolerance;

import java.util.Map;

@Getter
@AllArgsConstructor
public class HorizonBucket {
	private final String name;
	/** Inclusive upper bound in years; {@code null} for the open-ended last bucket. */
	private final Integer maxYears;
	private final Map<RiskTolerance, AssetAllocation> allocations;

	public boolean covers(int timeInYears) {
		return maxYears == null || timeInYears <= maxYears;
	}
}
