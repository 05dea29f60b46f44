package my.goalplanner.app.dto;

import my.goalplanner.app.domain.AssetAllocation;
import my.goalplanner.app.domain.Milestone;

import java.math.BigDecimal;
import java.util.List;

public record ProjectionResponseDto(
		BigDecimal targetAmount,
		int timeInYears,
		String horizonBucket,
		AssetAllocation assetAllocation,
		double expectedReturn,
		BigDecimal monthlySIP,
		boolean immediate,
		List<Milestone> milestones
) {
}
