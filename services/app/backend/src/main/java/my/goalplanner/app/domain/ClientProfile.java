package my.goalplanner.app.domain;

import java.math.BigDecimal;

/**
 * Household inputs for funding math. Treated as an immutable snapshot for one planning call.
 */
public record ClientProfile(String clientId,
							RiskTolerance riskTolerance,
							BigDecimal totalMonthlyIncome,
							BigDecimal totalMonthlyExpenses,
							BigDecimal monthlyEMI) {
	public ClientProfile {
		if (clientId == null || clientId.isBlank()) {
			throw new IllegalArgumentException("Client id is required");
		}
		if (riskTolerance == null) {
			throw new IllegalArgumentException("Risk tolerance is required");
		}
		requireNonNegative(totalMonthlyIncome, "totalMonthlyIncome");
		requireNonNegative(totalMonthlyExpenses, "totalMonthlyExpenses");
		requireNonNegative(monthlyEMI, "monthlyEMI");
	}

	/**
	 * Income left after expenses and debt service. May be negative.
	 */
	public BigDecimal monthlySurplus() {
		return totalMonthlyIncome.subtract(totalMonthlyExpenses).subtract(monthlyEMI);
	}

	private static void requireNonNegative(BigDecimal value, String field) {
		if (value == null) {
			throw new IllegalArgumentException(field + " is required");
		}
		if (value.signum() < 0) {
			throw new IllegalArgumentException(field + " must not be negative");
		}
	}
}
