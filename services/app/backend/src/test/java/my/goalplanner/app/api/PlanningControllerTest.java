package my.goalplanner.app.api;

import my.goalplanner.app.domain.AllocationPlan;
import my.goalplanner.app.domain.RiskTolerance;
import my.goalplanner.app.service.AllocationPolicyService;
import my.goalplanner.app.service.GoalPlanningService;
import my.goalplanner.app.service.ProjectionEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class PlanningControllerTest {
	private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-06-01T00:00:00Z"), ZoneOffset.UTC);

	@Mock
	private GoalPlanningService planningService;

	private MockMvc mockMvc;

	@BeforeEach
	void setUp() {
		AllocationPolicyService policyService = new AllocationPolicyService(new DefaultResourceLoader(), null);
		PlanningController controller = new PlanningController(new ProjectionEngine(policyService), planningService,
				policyService, CLOCK);
		mockMvc = MockMvcBuilders.standaloneSetup(controller)
				.setControllerAdvice(new RestExceptionHandler())
				.build();
	}

	@Test
	void projectsSingleTarget() throws Exception {
		mockMvc.perform(post("/api/planning/projections")
						.contentType(MediaType.APPLICATION_JSON)
						.content("""
								{"targetAmount": 1200000, "timeInYears": 10, "riskTolerance": "moderate"}
								"""))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.horizonBucket").value("long"))
				.andExpect(jsonPath("$.assetAllocation.equityPct").value(60))
				.andExpect(jsonPath("$.immediate").value(false))
				.andExpect(jsonPath("$.milestones.length()").value(4))
				.andExpect(jsonPath("$.milestones[3].year").value(2035));
	}

	@Test
	void inflationRateGrowsTheTarget() throws Exception {
		mockMvc.perform(post("/api/planning/projections")
						.contentType(MediaType.APPLICATION_JSON)
						.content("""
								{"targetAmount": 100000, "timeInYears": 10, "riskTolerance": "MODERATE", "inflationRate": 0.06}
								"""))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.targetAmount").value(179084.77));
	}

	@Test
	void dueTargetIsImmediate() throws Exception {
		mockMvc.perform(post("/api/planning/projections")
						.contentType(MediaType.APPLICATION_JSON)
						.content("""
								{"targetAmount": 50000, "timeInYears": 0, "riskTolerance": "CONSERVATIVE"}
								"""))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.immediate").value(true))
				.andExpect(jsonPath("$.monthlySIP").value(50000.00))
				.andExpect(jsonPath("$.milestones").isEmpty());
	}

	@Test
	void missingFieldsAreRejected() throws Exception {
		mockMvc.perform(post("/api/planning/projections")
						.contentType(MediaType.APPLICATION_JSON)
						.content("{\"targetAmount\": -5, \"timeInYears\": 3}"))
				.andExpect(status().isBadRequest())
				.andExpect(jsonPath("$.title").value("Validation failed"))
				.andExpect(jsonPath("$.errors").isArray());
	}

	@Test
	void horizonAboveLimitIsRejected() throws Exception {
		mockMvc.perform(post("/api/planning/projections")
						.contentType(MediaType.APPLICATION_JSON)
						.content("""
								{"targetAmount": 1000, "timeInYears": 20000, "riskTolerance": "MODERATE", "inflationRate": 0.07}
								"""))
				.andExpect(status().isBadRequest())
				.andExpect(jsonPath("$.title").value("Validation failed"));
	}

	@Test
	void unknownPriorityIsBadRequest() throws Exception {
		mockMvc.perform(post("/api/planning/allocations")
						.contentType(MediaType.APPLICATION_JSON)
						.content("""
								{"riskTolerance": "MODERATE", "availableSurplus": 5000,
								 "goals": [{"id": "g", "title": "Car", "targetAmount": 1000, "targetYear": 2027, "priority": "urgent"}]}
								"""))
				.andExpect(status().isBadRequest());
	}

	@Test
	void serviceArgumentErrorsMapToBadRequest() throws Exception {
		when(planningService.allocate(anyList(), eq(RiskTolerance.MODERATE), eq(new BigDecimal("5000"))))
				.thenThrow(new IllegalArgumentException("Duplicate goal id: g"));

		mockMvc.perform(post("/api/planning/allocations")
						.contentType(MediaType.APPLICATION_JSON)
						.content("""
								{"riskTolerance": "MODERATE", "availableSurplus": 5000,
								 "goals": [{"id": "g", "title": "Car", "targetAmount": 1000, "targetYear": 2027, "priority": "HIGH"}]}
								"""))
				.andExpect(status().isBadRequest())
				.andExpect(jsonPath("$.detail").value("Duplicate goal id: g"));
	}

	@Test
	void allocationsDelegateToPlanningService() throws Exception {
		when(planningService.allocate(anyList(), eq(RiskTolerance.MODERATE), eq(new BigDecimal("5000"))))
				.thenReturn(new AllocationPlan(List.of(), true, new BigDecimal("5000"), BigDecimal.ZERO,
						BigDecimal.ZERO, new BigDecimal("5000")));

		mockMvc.perform(post("/api/planning/allocations")
						.contentType(MediaType.APPLICATION_JSON)
						.content("""
								{"riskTolerance": "MODERATE", "availableSurplus": 5000, "goals": []}
								"""))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.feasible").value(true))
				.andExpect(jsonPath("$.unallocatedSurplus").value(5000));
	}

	@Test
	void exposesAllocationPolicy() throws Exception {
		mockMvc.perform(get("/api/planning/allocation-policy"))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.assetClassReturns.EQUITY").value(0.12))
				.andExpect(jsonPath("$.horizonBuckets.length()").value(3))
				.andExpect(jsonPath("$.horizonBuckets[0].maxYears").value(3))
				.andExpect(jsonPath("$.horizonBuckets[1].allocations.MODERATE.equityPct").value(45));
	}
}
