package my.goalplanner.app.domain;

import java.math.BigDecimal;

/**
 * Output of a single goal projection.
 *
 * @param expectedReturn annualized blended return of {@code allocation}, as a fraction (0.10 = 10%)
 * @param horizonBucket  name of the policy bucket the horizon fell into
 * @param immediate      true when the goal is due now or overdue and must be funded at once
 */
public record ProjectionResult(double expectedReturn,
							   AssetAllocation allocation,
							   BigDecimal monthlySIP,
							   boolean immediate,
							   String horizonBucket) {
}
