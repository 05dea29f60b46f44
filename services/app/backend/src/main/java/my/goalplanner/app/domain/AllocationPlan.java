package my.goalplanner.app.domain;

import java.math.BigDecimal;
import java.util.List;

/**
 * Per-goal funding in the order goals were funded.
 *
 * @param feasible true when the surplus covers every goal's required contribution
 */
public record AllocationPlan(List<AllocationResult> results,
							 boolean feasible,
							 BigDecimal availableSurplus,
							 BigDecimal totalRequired,
							 BigDecimal totalFunded,
							 BigDecimal unallocatedSurplus) {
}
