package my.goalplanner.app.service;

import my.goalplanner.app.domain.AdvisoryRecommendation;
import my.goalplanner.app.domain.AllocationPlan;
import my.goalplanner.app.domain.ClientProfile;
import my.goalplanner.app.domain.ConflictWarning;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Rule-based advice from the client's cash-flow ratios, used when no LLM is configured.
 */
@Service
public class FallbackRecommendationGenerator {
	static final String SOURCE = "fallback";
	private static final BigDecimal HIGH_EMI_RATIO = new BigDecimal("0.40");
	private static final BigDecimal MODERATE_EMI_RATIO = new BigDecimal("0.30");
	private static final BigDecimal EXCELLENT_SAVINGS_RATE = new BigDecimal("0.20");
	private static final BigDecimal GOOD_SAVINGS_RATE = new BigDecimal("0.10");
	private static final BigDecimal EMERGENCY_FUND_MONTHS = BigDecimal.valueOf(6);

	public AdvisoryRecommendation generate(ClientProfile profile, AllocationPlan plan, List<ConflictWarning> conflicts) {
		List<String> riskWarnings = new ArrayList<>();
		List<String> opportunities = new ArrayList<>();
		BigDecimal income = profile.totalMonthlyIncome();
		BigDecimal surplus = profile.monthlySurplus();

		String debtStrategy;
		if (profile.monthlyEMI().signum() == 0) {
			debtStrategy = "No existing debt obligations. Surplus can go entirely to goal funding.";
			opportunities.add("Debt-free cash flow allows a growth-oriented investment strategy");
		} else {
			BigDecimal emiRatio = ratio(profile.monthlyEMI(), income);
			if (emiRatio.compareTo(HIGH_EMI_RATIO) > 0) {
				debtStrategy = "EMI ratio is " + percent(emiRatio) + ", above the 40% safe limit. Prioritise debt reduction.";
				riskWarnings.add("High debt burden - immediate action required");
			} else if (emiRatio.compareTo(MODERATE_EMI_RATIO) > 0) {
				debtStrategy = "EMI ratio is " + percent(emiRatio) + ". Consider prepaying high-interest loans.";
				riskWarnings.add("Moderate debt burden - monitor carefully");
			} else {
				debtStrategy = "Healthy EMI ratio of " + percent(emiRatio) + ".";
			}
		}

		BigDecimal emergencyTarget = profile.totalMonthlyExpenses().add(profile.monthlyEMI())
				.multiply(EMERGENCY_FUND_MONTHS);
		String emergencyFundAnalysis = "Keep an emergency fund of six months of outgoings ("
				+ amount(emergencyTarget) + ") in liquid instruments before long-horizon goals.";

		String investmentAnalysis;
		BigDecimal savingsRate = ratio(surplus, income);
		if (savingsRate.compareTo(EXCELLENT_SAVINGS_RATE) > 0) {
			investmentAnalysis = "Excellent savings rate of " + percent(savingsRate) + ". Focus on a diversified portfolio.";
			opportunities.add("High savings rate supports funding several goals in parallel");
		} else if (savingsRate.compareTo(GOOD_SAVINGS_RATE) > 0) {
			investmentAnalysis = "Good savings rate of " + percent(savingsRate) + ". A gradual investment approach fits.";
		} else {
			investmentAnalysis = "Low savings rate of " + percent(savingsRate) + ". Optimise expenses first.";
			riskWarnings.add("Low savings rate limits investment capacity");
		}

		String cashFlowOptimization;
		if (surplus.signum() > 0) {
			cashFlowOptimization = "Monthly surplus of " + amount(surplus) + " is available for systematic investment.";
		} else {
			cashFlowOptimization = "Negative cash flow requires an immediate budget review.";
			riskWarnings.add("Negative cash flow - urgent budget review needed");
		}

		if (plan != null && !plan.feasible()) {
			BigDecimal gap = plan.totalRequired().subtract(plan.totalFunded());
			riskWarnings.add("Goals need " + amount(gap) + " per month more than the available surplus");
		}
		if (conflicts != null && !conflicts.isEmpty()) {
			riskWarnings.add(conflicts.size() + " goal timeline conflict(s) detected");
		}
		return new AdvisoryRecommendation(debtStrategy, emergencyFundAnalysis, investmentAnalysis,
				cashFlowOptimization, List.copyOf(riskWarnings), List.copyOf(opportunities), SOURCE);
	}

	private BigDecimal ratio(BigDecimal value, BigDecimal income) {
		if (income.signum() == 0) {
			return value.signum() > 0 ? BigDecimal.ONE : BigDecimal.ZERO;
		}
		return value.divide(income, 4, RoundingMode.HALF_UP);
	}

	private String percent(BigDecimal ratio) {
		return String.format(Locale.ROOT, "%.1f%%", ratio.doubleValue() * 100.0);
	}

	private String amount(BigDecimal value) {
		return value.setScale(0, RoundingMode.HALF_UP).toPlainString();
	}
}
