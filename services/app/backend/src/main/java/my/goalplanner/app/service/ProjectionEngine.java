package my.goalplanner.app.service;

import my.goalplanner.app.domain.AssetAllocation;
import my.goalplanner.app.domain.Goal;
import my.goalplanner.app.domain.Milestone;
import my.goalplanner.app.domain.ProjectionResult;
import my.goalplanner.app.domain.RiskTolerance;
import my.goalplanner.app.model.AllocationPolicy;
import my.goalplanner.app.model.HorizonBucket;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns a goal's target and horizon into an asset allocation and the level monthly contribution
 * (SIP) that reaches the target under monthly compounding. Stateless apart from the policy table.
 */
@Service
public class ProjectionEngine {
	public static final int MAX_HORIZON_YEARS = 100;

	private static final int MONEY_SCALE = 2;
	private static final double RATE_EPSILON = 1e-12;
	private static final int[] MILESTONE_PERCENTAGES = {25, 50, 75, 100};

	private final AllocationPolicyService policyService;

	public ProjectionEngine(AllocationPolicyService policyService) {
		this.policyService = policyService;
	}

	public ProjectionResult project(BigDecimal targetAmount, int timeInYears, RiskTolerance riskTolerance) {
		if (targetAmount == null) {
			throw new IllegalArgumentException("Target amount is required");
		}
		if (targetAmount.signum() < 0) {
			throw new IllegalArgumentException("Target amount must not be negative");
		}
		if (riskTolerance == null) {
			throw new IllegalArgumentException("Risk tolerance is required");
		}
		requireHorizon(timeInYears);
		AllocationPolicy policy = policyService.getPolicy();
		HorizonBucket bucket = policy.bucketFor(timeInYears);
		AssetAllocation allocation = bucket.getAllocations().get(riskTolerance);
		double expectedReturn = policy.blendedReturn(allocation);
		if (timeInYears <= 0) {
			return new ProjectionResult(expectedReturn, allocation, money(targetAmount), true, bucket.getName());
		}
		BigDecimal monthlySIP = requiredMonthlyContribution(targetAmount, Math.multiplyExact(timeInYears, 12),
				expectedReturn);
		return new ProjectionResult(expectedReturn, allocation, monthlySIP, false, bucket.getName());
	}

	/**
	 * Projects the goal against {@code currentYear} and writes the derived fields back onto it.
	 */
	public ProjectionResult projectGoal(Goal goal, int currentYear, RiskTolerance riskTolerance) {
		int timeInYears = goal.getTargetYear() - currentYear;
		ProjectionResult result = project(goal.getTargetAmount(), timeInYears, riskTolerance);
		goal.applyProjection(timeInYears, result);
		return result;
	}

	public BigDecimal inflationAdjustedAmount(BigDecimal currentCost, int years, double inflationRate) {
		if (currentCost == null) {
			throw new IllegalArgumentException("Current cost is required");
		}
		if (inflationRate <= -1.0) {
			throw new IllegalArgumentException("Inflation rate must be greater than -100%");
		}
		requireHorizon(years);
		if (years <= 0 || inflationRate == 0.0) {
			return currentCost;
		}
		double factor = finite(Math.pow(1.0 + inflationRate, years), "Inflation-adjusted amount");
		return money(currentCost.multiply(BigDecimal.valueOf(factor)));
	}

	/**
	 * Months at which the accumulated contributions reach 25/50/75/100% of the target. Checkpoints
	 * not reached within the horizon are left out.
	 */
	public List<Milestone> milestones(BigDecimal targetAmount,
									  int years,
									  BigDecimal monthlySIP,
									  double annualReturn,
									  int currentYear) {
		if (targetAmount == null || monthlySIP == null) {
			throw new IllegalArgumentException("Target amount and monthly SIP are required");
		}
		requireHorizon(years);
		if (years <= 0 || monthlySIP.signum() <= 0 || targetAmount.signum() <= 0) {
			return List.of();
		}
		double monthlyRate = monthlyRate(annualReturn);
		int totalMonths = Math.multiplyExact(years, 12);
		double sip = monthlySIP.doubleValue();
		// a SIP rounded to cents may undershoot by half a cent per accumulated unit
		double tolerance = 0.005 * accumulationFactor(monthlyRate, totalMonths);
		List<Milestone> milestones = new ArrayList<>();
		int month = 0;
		for (int percentage : MILESTONE_PERCENTAGES) {
			double checkpoint = targetAmount.doubleValue() * percentage / 100.0;
			while (month < totalMonths && sip * accumulationFactor(monthlyRate, month) + tolerance < checkpoint) {
				month++;
			}
			if (sip * accumulationFactor(monthlyRate, month) + tolerance < checkpoint) {
				break;
			}
			milestones.add(new Milestone(percentage, money(BigDecimal.valueOf(checkpoint)), month,
					currentYear + month / 12));
		}
		return List.copyOf(milestones);
	}

	/**
	 * Whole years a fixed monthly contribution needs to reach the target.
	 */
	public int yearsToReach(BigDecimal targetAmount, BigDecimal monthlySIP, double annualReturn) {
		if (targetAmount == null || targetAmount.signum() < 0) {
			throw new IllegalArgumentException("Target amount must be zero or positive");
		}
		if (monthlySIP == null || monthlySIP.signum() <= 0) {
			throw new IllegalArgumentException("Monthly SIP must be positive");
		}
		if (targetAmount.signum() == 0) {
			return 0;
		}
		double monthlyRate = monthlyRate(annualReturn);
		double months;
		if (Math.abs(monthlyRate) < RATE_EPSILON) {
			months = targetAmount.doubleValue() / monthlySIP.doubleValue();
		} else {
			double growth = 1.0 + targetAmount.doubleValue() * monthlyRate / monthlySIP.doubleValue();
			if (growth <= 0.0) {
				throw new IllegalArgumentException("Target is unreachable with the given contribution and return");
			}
			months = Math.log(growth) / Math.log(1.0 + monthlyRate);
		}
		return (int) Math.ceil(months / 12.0);
	}

	private BigDecimal requiredMonthlyContribution(BigDecimal targetAmount, int months, double annualReturn) {
		double monthlyRate = monthlyRate(annualReturn);
		if (Math.abs(monthlyRate) < RATE_EPSILON) {
			return targetAmount.divide(BigDecimal.valueOf(months), MONEY_SCALE, RoundingMode.HALF_UP);
		}
		double sip = targetAmount.doubleValue() * monthlyRate / (Math.pow(1.0 + monthlyRate, months) - 1.0);
		if (finite(sip, "Monthly SIP") < 0.0) {
			throw new IllegalArgumentException("Monthly SIP must not be negative");
		}
		return money(BigDecimal.valueOf(sip));
	}

	private static void requireHorizon(int years) {
		if (years > MAX_HORIZON_YEARS) {
			throw new IllegalArgumentException("Horizon must not exceed " + MAX_HORIZON_YEARS + " years, got " + years);
		}
	}

	private static double finite(double value, String label) {
		if (!Double.isFinite(value)) {
			throw new IllegalArgumentException(label + " is out of range");
		}
		return value;
	}

	static double monthlyRate(double annualReturn) {
		return Math.pow(1.0 + annualReturn, 1.0 / 12.0) - 1.0;
	}

	private static double accumulationFactor(double monthlyRate, int months) {
		if (Math.abs(monthlyRate) < RATE_EPSILON) {
			return months;
		}
		return (Math.pow(1.0 + monthlyRate, months) - 1.0) / monthlyRate;
	}

	private static BigDecimal money(BigDecimal value) {
		return value.setScale(MONEY_SCALE, RoundingMode.HALF_UP);
	}
}
