package my.goalplanner.app.service;

import my.goalplanner.app.cache.InMemoryRecommendationStore;
import my.goalplanner.app.cache.RecommendationCache;
import my.goalplanner.app.cache.RecommendationCacheException;
import my.goalplanner.app.cache.RecommendationStore;
import my.goalplanner.app.domain.AdvisoryRecommendation;
import my.goalplanner.app.domain.ClientProfile;
import my.goalplanner.app.domain.Goal;
import my.goalplanner.app.domain.GoalRecommendation;
import my.goalplanner.app.domain.PlanningOutcome;
import my.goalplanner.app.domain.Priority;
import my.goalplanner.app.domain.RiskTolerance;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.io.DefaultResourceLoader;
import tools.jackson.databind.json.JsonMapper;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class GoalPlanningServiceTest {
	private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-06-01T10:00:00Z"), ZoneOffset.UTC);
	private static final ClientProfile PROFILE = new ClientProfile("client-1", RiskTolerance.MODERATE,
			new BigDecimal("150000"), new BigDecimal("60000"), new BigDecimal("20000"));
	private static final AdvisoryRecommendation ADVICE = new AdvisoryRecommendation("Prepay", "Covered", "On track",
			"Fine", List.of(), List.of("Step up SIPs"), "openai");

	@Mock
	private AdvisoryRecommendationService advisoryService;

	private InMemoryRecommendationStore store;

	@BeforeEach
	void setUp() {
		store = new InMemoryRecommendationStore();
	}

	@Test
	void secondIdenticalRequestIsServedFromCache() {
		when(advisoryService.recommend(any(), anyList(), any(), anyList())).thenReturn(ADVICE);
		GoalPlanningService service = service(store);

		PlanningOutcome first = service.plan(PROFILE, goals(), false);
		PlanningOutcome second = service.plan(PROFILE, goals(), false);

		assertThat(first.fromCache()).isFalse();
		assertThat(first.adviceAvailable()).isTrue();
		assertThat(first.recommendation().advice()).isEqualTo(ADVICE);
		assertThat(second.fromCache()).isTrue();
		assertThat(second.stale()).isFalse();
		assertThat(second.recommendation()).isEqualTo(first.recommendation());
		verify(advisoryService, times(1)).recommend(any(), anyList(), any(), anyList());
	}

	@Test
	void computedPlanCarriesProjectionConflictsAndAllocation() {
		when(advisoryService.recommend(any(), anyList(), any(), anyList())).thenReturn(ADVICE);

		GoalRecommendation recommendation = service(store).plan(PROFILE, goals(), false).recommendation();

		assertThat(recommendation.clientId()).isEqualTo("client-1");
		assertThat(recommendation.planningYear()).isEqualTo(2025);
		assertThat(recommendation.goals()).hasSize(2);
		assertThat(recommendation.goals().get(0).goalId()).isEqualTo("house");
		assertThat(recommendation.goals().get(0).monthlySIP()).isBetween(new BigDecimal("5800"), new BigDecimal("6200"));
		assertThat(recommendation.goals().get(0).milestones()).hasSize(4);
		assertThat(recommendation.allocation().availableSurplus()).isEqualByComparingTo("70000");
		assertThat(recommendation.allocation().feasible()).isTrue();
		assertThat(recommendation.conflicts()).isEmpty();
	}

	@Test
	void editedGoalIsRecomputed() {
		when(advisoryService.recommend(any(), anyList(), any(), anyList())).thenReturn(ADVICE);
		GoalPlanningService service = service(store);
		service.plan(PROFILE, goals(), false);
		List<Goal> edited = goals();
		edited.get(1).setTargetYear(2028);

		PlanningOutcome outcome = service.plan(PROFILE, edited, false);

		assertThat(outcome.fromCache()).isFalse();
		verify(advisoryService, times(2)).recommend(any(), anyList(), any(), anyList());
	}

	@Test
	void forceRefreshBypassesTheCache() {
		when(advisoryService.recommend(any(), anyList(), any(), anyList())).thenReturn(ADVICE);
		GoalPlanningService service = service(store);
		service.plan(PROFILE, goals(), false);

		PlanningOutcome refreshed = service.plan(PROFILE, goals(), true);

		assertThat(refreshed.fromCache()).isFalse();
		assertThat(store.findAll()).hasSize(1);
		verify(advisoryService, times(2)).recommend(any(), anyList(), any(), anyList());
	}

	@Test
	void unavailableAdviceReturnsPlanWithoutCaching() {
		when(advisoryService.recommend(any(), anyList(), any(), anyList()))
				.thenThrow(new AdvisoryUnavailableException("Recommendation source timed out", true, null));

		PlanningOutcome outcome = service(store).plan(PROFILE, goals(), false);

		assertThat(outcome.adviceAvailable()).isFalse();
		assertThat(outcome.adviceRetryable()).isTrue();
		assertThat(outcome.adviceError()).contains("timed out");
		assertThat(outcome.recommendation().advice()).isNull();
		assertThat(outcome.recommendation().goals()).hasSize(2);
		assertThat(store.findAll()).isEmpty();
	}

	@Test
	void cacheFailuresDoNotFailThePlan() {
		when(advisoryService.recommend(any(), anyList(), any(), anyList())).thenReturn(ADVICE);
		RecommendationStore broken = mock(RecommendationStore.class);
		when(broken.find(anyString())).thenThrow(new RecommendationCacheException("down", null));
		doThrow(new RecommendationCacheException("down", null)).when(broken).save(any());

		PlanningOutcome outcome = service(broken).plan(PROFILE, goals(), false);

		assertThat(outcome.adviceAvailable()).isTrue();
		assertThat(outcome.fromCache()).isFalse();
	}

	@Test
	void negativeSurplusIsTreatedAsZero() {
		ClientProfile overspending = new ClientProfile("client-2", RiskTolerance.CONSERVATIVE,
				new BigDecimal("50000"), new BigDecimal("45000"), new BigDecimal("10000"));
		GoalPlanningService service = service(store);

		GoalRecommendation recommendation = service.compute(overspending, goals());

		assertThat(recommendation.allocation().availableSurplus()).isEqualByComparingTo("0");
		assertThat(recommendation.allocation().feasible()).isFalse();
		assertThat(recommendation.allocation().totalFunded()).isEqualByComparingTo("0");
		verify(advisoryService, never()).recommend(any(), anyList(), any(), anyList());
	}

	@Test
	void duplicateGoalIdsAreRejected() {
		List<Goal> duplicated = List.of(
				new Goal("g", "One", new BigDecimal("1000"), 2030, Priority.LOW),
				new Goal("g", "Two", new BigDecimal("2000"), 2031, Priority.LOW));

		assertThatThrownBy(() -> service(store).plan(PROFILE, duplicated, false))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("Duplicate");
	}

	@Test
	void conflictsAndAllocationsProjectGoalsFirst() {
		GoalPlanningService service = service(store);
		List<Goal> goals = List.of(
				new Goal("car", "Car", new BigDecimal("300000"), 2027, Priority.HIGH),
				new Goal("bike", "Bike", new BigDecimal("300000"), 2028, Priority.MEDIUM));

		assertThat(service.detectConflicts(goals, RiskTolerance.MODERATE, new BigDecimal("5000"))).hasSize(1);
		assertThat(goals).allMatch(Goal::isProjected);
		assertThat(service.allocate(goals, RiskTolerance.MODERATE, new BigDecimal("5000")).feasible()).isFalse();
	}

	private GoalPlanningService service(RecommendationStore recommendationStore) {
		AllocationPolicyService policyService = new AllocationPolicyService(new DefaultResourceLoader(), null);
		RecommendationCache cache = new RecommendationCache(recommendationStore, JsonMapper.builder().build(), CLOCK, null);
		return new GoalPlanningService(new ProjectionEngine(policyService), new TimelineConflictDetector(null, CLOCK),
				new MultiGoalAllocator(), cache, advisoryService, CLOCK);
	}

	private static List<Goal> goals() {
		return new ArrayList<>(List.of(
				new Goal("house", "House", new BigDecimal("1200000"), 2035, Priority.HIGH),
				new Goal("trip", "Trip", new BigDecimal("300000"), 2027, Priority.LOW)));
	}
}
