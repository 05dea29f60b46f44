package my.goalplanner.app.domain;

import java.math.BigDecimal;

/**
 * Monthly funding granted to one goal.
 *
 * @param fundingRatio fraction of {@code requiredAmount} covered by {@code fundedAmount}, 0.0 to 1.0
 */
public record AllocationResult(String goalId,
							   BigDecimal requiredAmount,
							   BigDecimal fundedAmount,
							   double fundingRatio,
							   BigDecimal shortfall) {
}
