package my.goalplanner.app.model;

import lombok.AllArgsConstructor;
import lombok.Getter;
import my.goalplanner.app.domain.AssetAllocation;
import my.goalplanner.app.domain.RiskTolerance;

import java.util.List;
import java.util.Map;

/**
 * Lookup table from (horizon bucket, risk tolerance) to an asset allocation, plus the expected
 * annual return of each asset class. Buckets are ordered by ascending {@code maxYears}; the last
 * one is open-ended.
 */
@Getter
@AllArgsConstructor
public class AllocationPolicy {
	private final Map<AssetClass, Double> assetClassReturns;
	private final List<HorizonBucket> horizonBuckets;

	public HorizonBucket bucketFor(int timeInYears) {
		for (HorizonBucket bucket : horizonBuckets) {
			if (bucket.covers(timeInYears)) {
				return bucket;
			}
		}
		throw new IllegalStateException("Allocation policy has no bucket for " + timeInYears + " years");
	}

	public AssetAllocation allocationFor(int timeInYears, RiskTolerance riskTolerance) {
		return bucketFor(timeInYears).getAllocations().get(riskTolerance);
	}

	public double blendedReturn(AssetAllocation allocation) {
		return (allocation.equityPct() * assetClassReturns.get(AssetClass.EQUITY)
				+ allocation.debtPct() * assetClassReturns.get(AssetClass.DEBT)
				+ allocation.goldPct() * assetClassReturns.get(AssetClass.GOLD)) / 100.0;
	}
}
