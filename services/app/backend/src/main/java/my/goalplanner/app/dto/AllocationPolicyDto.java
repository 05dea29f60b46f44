package my.goalplanner.app.dto;

import my.goalplanner.app.domain.AssetAllocation;
import my.goalplanner.app.domain.RiskTolerance;
import my.goalplanner.app.model.AllocationPolicy;
import my.goalplanner.app.model.AssetClass;

import java.util.List;
import java.util.Map;

public record AllocationPolicyDto(
		Map<AssetClass, Double> assetClassReturns,
		List<HorizonBucketDto> horizonBuckets
) {
	public static AllocationPolicyDto from(AllocationPolicy policy) {
		List<HorizonBucketDto> buckets = policy.getHorizonBuckets().stream()
				.map(bucket -> new HorizonBucketDto(bucket.getName(), bucket.getMaxYears(), bucket.getAllocations()))
				.toList();
		return new AllocationPolicyDto(policy.getAssetClassReturns(), buckets);
	}

	public record HorizonBucketDto(
			String name,
			Integer maxYears,
			Map<RiskTolerance, AssetAllocation> allocations
	) {
	}
}
