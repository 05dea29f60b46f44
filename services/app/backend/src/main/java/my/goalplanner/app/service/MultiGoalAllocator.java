package my.goalplanner.app.service;

import my.goalplanner.app.domain.AllocationPlan;
import my.goalplanner.app.domain.AllocationResult;
import my.goalplanner.app.domain.Goal;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Splits a monthly surplus across goals greedily: highest priority first, sooner deadline first
 * within a priority. Each goal is funded in full while the balance lasts; the first goal that
 * cannot be covered takes what is left and every later goal gets nothing.
 * <p>
 * This is deliberately not a proportional split. Conflict and shortfall messaging rely on a few
 * goals being fully funded under scarcity.
 */
@Service
public class MultiGoalAllocator {
	static final Comparator<Goal> FUNDING_ORDER = Comparator.comparing(Goal::getPriority)
			.thenComparingInt(Goal::getTargetYear)
			.thenComparing(Goal::getId);

	public AllocationPlan optimize(List<Goal> goals, BigDecimal availableSurplus) {
		if (availableSurplus == null) {
			throw new IllegalArgumentException("Available surplus is required");
		}
		BigDecimal surplus = availableSurplus.signum() < 0 ? BigDecimal.ZERO : availableSurplus;
		if (goals == null || goals.isEmpty()) {
			return new AllocationPlan(List.of(), true, surplus, BigDecimal.ZERO, BigDecimal.ZERO, surplus);
		}
		for (Goal goal : goals) {
			TimelineConflictDetector.requireProjected(goal);
		}
		List<Goal> ordered = new ArrayList<>(goals);
		ordered.sort(FUNDING_ORDER);

		List<AllocationResult> results = new ArrayList<>();
		BigDecimal balance = surplus;
		BigDecimal totalRequired = BigDecimal.ZERO;
		BigDecimal totalFunded = BigDecimal.ZERO;
		for (Goal goal : ordered) {
			BigDecimal required = goal.getMonthlySIP();
			if (required.signum() < 0) {
				throw new IllegalArgumentException("Monthly SIP must not be negative for goal " + goal.getId());
			}
			BigDecimal funded = required.min(balance);
			balance = balance.subtract(funded);
			totalRequired = totalRequired.add(required);
			totalFunded = totalFunded.add(funded);
			results.add(new AllocationResult(goal.getId(), required, funded, fundingRatio(funded, required),
					required.subtract(funded)));
		}
		boolean feasible = surplus.compareTo(totalRequired) >= 0;
		return new AllocationPlan(List.copyOf(results), feasible, surplus, totalRequired, totalFunded, balance);
	}

	private double fundingRatio(BigDecimal funded, BigDecimal required) {
		if (required.signum() == 0) {
			return 1.0;
		}
		return funded.divide(required, 6, RoundingMode.HALF_UP).doubleValue();
	}
}
