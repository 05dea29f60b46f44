package my.goalplanner.app.service;

import my.goalplanner.app.config.AppProperties;
import my.goalplanner.app.domain.ConflictType;
import my.goalplanner.app.domain.ConflictWarning;
import my.goalplanner.app.domain.Goal;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Year;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Flags near-term goals that cluster around the same years and together need more than the
 * household surplus can provide. Advisory only: goals are never modified.
 */
@Service
public class TimelineConflictDetector {
	private static final int DEFAULT_NEAR_TERM_YEARS = 5;
	private static final int DEFAULT_CLUSTER_WINDOW_YEARS = 2;
	private static final BigDecimal DEFAULT_SURPLUS_FRACTION = BigDecimal.ONE;

	private final Clock clock;
	private final int nearTermYears;
	private final int clusterWindowYears;
	private final BigDecimal surplusFraction;

	public TimelineConflictDetector(AppProperties properties, Clock clock) {
		AppProperties.Planning planning = properties == null ? null : properties.planning();
		this.clock = clock;
		this.nearTermYears = planning == null || planning.nearTermYears() == null
				? DEFAULT_NEAR_TERM_YEARS
				: planning.nearTermYears();
		this.clusterWindowYears = planning == null || planning.clusterWindowYears() == null
				? DEFAULT_CLUSTER_WINDOW_YEARS
				: planning.clusterWindowYears();
		this.surplusFraction = planning == null || planning.conflictSurplusFraction() == null
				? DEFAULT_SURPLUS_FRACTION
				: BigDecimal.valueOf(planning.conflictSurplusFraction());
	}

	public List<ConflictWarning> detectConflicts(List<Goal> goals, BigDecimal availableSurplus) {
		if (availableSurplus == null) {
			throw new IllegalArgumentException("Available surplus is required");
		}
		if (goals == null || goals.isEmpty()) {
			return List.of();
		}
		for (Goal goal : goals) {
			requireProjected(goal);
		}
		BigDecimal surplus = availableSurplus.signum() < 0 ? BigDecimal.ZERO : availableSurplus;
		BigDecimal threshold = surplus.multiply(surplusFraction);
		int currentYear = Year.now(clock).getValue();

		List<Goal> nearTerm = goals.stream()
				.filter(goal -> goal.getTargetYear() - currentYear <= nearTermYears)
				.sorted(Comparator.comparingInt(Goal::getTargetYear).thenComparing(Goal::getId))
				.toList();

		List<ConflictWarning> warnings = new ArrayList<>();
		Set<String> covered = new HashSet<>();
		int evaluatedEnd = 0;
		for (int start = 0; start < nearTerm.size(); start++) {
			int startYear = nearTerm.get(start).getTargetYear();
			int end = start;
			while (end < nearTerm.size() && nearTerm.get(end).getTargetYear() - startYear <= clusterWindowYears) {
				end++;
			}
			// a window ending where the previous one ended is a subset of it
			if (end - start < 2 || end <= evaluatedEnd) {
				continue;
			}
			evaluatedEnd = end;
			List<Goal> cluster = nearTerm.subList(start, end);
			BigDecimal combined = sumMonthlySIP(cluster);
			if (combined.compareTo(threshold) > 0) {
				warnings.add(warning(ConflictType.TIMELINE_CLUSTER, cluster, combined, surplus));
				cluster.forEach(goal -> covered.add(goal.getId()));
			}
		}

		for (Goal goal : goals) {
			if (!covered.contains(goal.getId()) && goal.getMonthlySIP().compareTo(surplus) > 0) {
				warnings.add(warning(ConflictType.SELF, List.of(goal), goal.getMonthlySIP(), surplus));
			}
		}
		return List.copyOf(warnings);
	}

	private ConflictWarning warning(ConflictType type, List<Goal> goals, BigDecimal combined, BigDecimal surplus) {
		BigDecimal shortfall = combined.subtract(surplus);
		if (shortfall.signum() < 0) {
			shortfall = BigDecimal.ZERO;
		}
		int fromYear = goals.stream().mapToInt(Goal::getTargetYear).min().orElseThrow();
		int toYear = goals.stream().mapToInt(Goal::getTargetYear).max().orElseThrow();
		return new ConflictWarning(type,
				goals.stream().map(Goal::getId).toList(),
				fromYear,
				toYear,
				combined,
				surplus,
				shortfall);
	}

	private BigDecimal sumMonthlySIP(List<Goal> goals) {
		BigDecimal sum = BigDecimal.ZERO;
		for (Goal goal : goals) {
			sum = sum.add(goal.getMonthlySIP());
		}
		return sum;
	}

	static void requireProjected(Goal goal) {
		if (goal == null) {
			throw new IllegalArgumentException("Goal list must not contain null entries");
		}
		if (!goal.isProjected()) {
			throw new IllegalArgumentException("Goal " + goal.getId() + " has not been projected");
		}
	}
}
