package my.goalplanner.app.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import my.goalplanner.app.domain.RiskTolerance;
import my.goalplanner.app.service.ProjectionEngine;

import java.math.BigDecimal;

/**
 * {@code inflationRate} is optional; when present the amount is treated as today's cost and
 * grown to the target year before projecting.
 */
public record ProjectionRequest(
		@NotNull @PositiveOrZero BigDecimal targetAmount,
		@NotNull @Max(ProjectionEngine.MAX_HORIZON_YEARS) Integer timeInYears,
		@NotNull RiskTolerance riskTolerance,
		Double inflationRate
) {
}
