package my.goalplanner.app.service;

import my.goalplanner.app.cache.CachedRecommendation;
import my.goalplanner.app.cache.RecommendationCache;
import my.goalplanner.app.cache.RecommendationCacheException;
import my.goalplanner.app.domain.AdvisoryRecommendation;
import my.goalplanner.app.domain.AllocationPlan;
import my.goalplanner.app.domain.ClientProfile;
import my.goalplanner.app.domain.ConflictWarning;
import my.goalplanner.app.domain.Goal;
import my.goalplanner.app.domain.GoalRecommendation;
import my.goalplanner.app.domain.Milestone;
import my.goalplanner.app.domain.PlanningOutcome;
import my.goalplanner.app.domain.ProjectedGoal;
import my.goalplanner.app.domain.RiskTolerance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

@Service
public class GoalPlanningService {
	private static final Logger logger = LoggerFactory.getLogger(GoalPlanningService.class);

	private final ProjectionEngine projectionEngine;
	private final TimelineConflictDetector conflictDetector;
	private final MultiGoalAllocator allocator;
	private final RecommendationCache cache;
	private final AdvisoryRecommendationService advisoryService;
	private final Clock clock;

	public GoalPlanningService(ProjectionEngine projectionEngine,
							   TimelineConflictDetector conflictDetector,
							   MultiGoalAllocator allocator,
							   RecommendationCache cache,
							   AdvisoryRecommendationService advisoryService,
							   Clock clock) {
		this.projectionEngine = projectionEngine;
		this.conflictDetector = conflictDetector;
		this.allocator = allocator;
		this.cache = cache;
		this.advisoryService = advisoryService;
		this.clock = clock;
	}

	public PlanningOutcome plan(ClientProfile profile, List<Goal> goals, boolean forceRefresh) {
		if (profile == null) {
			throw new IllegalArgumentException("Client profile is required");
		}
		List<Goal> requestGoals = goals == null ? List.of() : goals;
		requireUniqueIds(requestGoals);

		if (forceRefresh) {
			try {
				cache.forceRefresh(requestGoals, profile);
			} catch (RecommendationCacheException ex) {
				logger.warn("Force refresh failed for client {}: {}", profile.clientId(), ex.getMessage());
			}
		} else {
			Optional<CachedRecommendation> cached = lookup(requestGoals, profile);
			if (cached.isPresent()) {
				CachedRecommendation hit = cached.get();
				return new PlanningOutcome(hit.payload(), true, hit.ageMinutes(), hit.stale(),
						hit.payload().advice() != null, null, false);
			}
		}

		GoalRecommendation computed = compute(profile, requestGoals);
		AdvisoryRecommendation advice;
		try {
			advice = advisoryService.recommend(profile, computed.goals(), computed.allocation(), computed.conflicts());
		} catch (AdvisoryUnavailableException ex) {
			logger.warn("Recommendations unavailable for client {}: {}", profile.clientId(), ex.getMessage());
			return new PlanningOutcome(computed, false, 0, false, false, ex.getMessage(), ex.isRetryable());
		}
		GoalRecommendation payload = new GoalRecommendation(computed.clientId(), computed.planningYear(),
				computed.goals(), computed.conflicts(), computed.allocation(), advice);
		try {
			cache.store(requestGoals, profile, payload);
		} catch (RecommendationCacheException ex) {
			logger.warn("Could not cache recommendation for client {}: {}", profile.clientId(), ex.getMessage());
		}
		return new PlanningOutcome(payload, false, 0, false, true, null, false);
	}

	/**
	 * Projection, conflict detection and allocation without advice or caching.
	 */
	public GoalRecommendation compute(ClientProfile profile, List<Goal> goals) {
		int currentYear = LocalDate.now(clock).getYear();
		List<ProjectedGoal> projected = new ArrayList<>();
		for (Goal goal : goals) {
			projectionEngine.projectGoal(goal, currentYear, profile.riskTolerance());
			projected.add(toProjectedGoal(goal, currentYear));
		}
		BigDecimal surplus = availableSurplus(profile);
		List<ConflictWarning> conflicts = conflictDetector.detectConflicts(goals, surplus);
		AllocationPlan allocation = allocator.optimize(goals, surplus);
		logger.info("Computed plan for client {} (goals={}, conflicts={}, feasible={}).",
				profile.clientId(), goals.size(), conflicts.size(), allocation.feasible());
		return new GoalRecommendation(profile.clientId(), currentYear, List.copyOf(projected),
				conflicts, allocation, null);
	}

	public List<ConflictWarning> detectConflicts(List<Goal> goals, RiskTolerance riskTolerance, BigDecimal availableSurplus) {
		projectAll(goals, riskTolerance);
		return conflictDetector.detectConflicts(goals, availableSurplus);
	}

	public AllocationPlan allocate(List<Goal> goals, RiskTolerance riskTolerance, BigDecimal availableSurplus) {
		projectAll(goals, riskTolerance);
		return allocator.optimize(goals, availableSurplus);
	}

	private void projectAll(List<Goal> goals, RiskTolerance riskTolerance) {
		if (goals == null) {
			throw new IllegalArgumentException("Goals are required");
		}
		requireUniqueIds(goals);
		int currentYear = LocalDate.now(clock).getYear();
		for (Goal goal : goals) {
			projectionEngine.projectGoal(goal, currentYear, riskTolerance);
		}
	}

	static BigDecimal availableSurplus(ClientProfile profile) {
		BigDecimal surplus = profile.monthlySurplus();
		return surplus.signum() < 0 ? BigDecimal.ZERO : surplus;
	}

	private Optional<CachedRecommendation> lookup(List<Goal> goals, ClientProfile profile) {
		try {
			return cache.lookup(goals, profile);
		} catch (RecommendationCacheException ex) {
			logger.warn("Cache lookup failed for client {}, recomputing: {}", profile.clientId(), ex.getMessage());
			return Optional.empty();
		}
	}

	private ProjectedGoal toProjectedGoal(Goal goal, int currentYear) {
		List<Milestone> milestones = goal.isImmediate()
				? List.of()
				: projectionEngine.milestones(goal.getTargetAmount(), goal.getTimeInYears(),
						goal.getMonthlySIP(), goal.getExpectedReturn(), currentYear);
		return new ProjectedGoal(goal.getId(), goal.getTitle(), goal.getTargetAmount(), goal.getTargetYear(),
				goal.getPriority(), goal.getTimeInYears(), goal.getAssetAllocation(), goal.getExpectedReturn(),
				goal.getMonthlySIP(), goal.isImmediate(), milestones);
	}

	private void requireUniqueIds(List<Goal> goals) {
		Set<String> seen = new HashSet<>();
		for (Goal goal : goals) {
			if (goal == null) {
				throw new IllegalArgumentException("Goal entries must not be null");
			}
			if (!seen.add(goal.getId())) {
				throw new IllegalArgumentException("Duplicate goal id: " + goal.getId());
			}
		}
	}
}
