package my.goalplanner.app.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import my.goalplanner.app.domain.ClientProfile;
import my.goalplanner.app.domain.RiskTolerance;

import java.math.BigDecimal;

public record ClientProfileRequest(
		@NotBlank String clientId,
		@NotNull RiskTolerance riskTolerance,
		@NotNull @PositiveOrZero BigDecimal totalMonthlyIncome,
		@NotNull @PositiveOrZero BigDecimal totalMonthlyExpenses,
		@NotNull @PositiveOrZero BigDecimal monthlyEMI
) {
	public ClientProfile toProfile() {
		return new ClientProfile(clientId, riskTolerance, totalMonthlyIncome, totalMonthlyExpenses, monthlyEMI);
	}
}
