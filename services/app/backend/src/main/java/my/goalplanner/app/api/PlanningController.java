package my.goalplanner.app.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import my.goalplanner.app.domain.AllocationPlan;
import my.goalplanner.app.domain.ConflictWarning;
import my.goalplanner.app.domain.Milestone;
import my.goalplanner.app.domain.PlanningOutcome;
import my.goalplanner.app.domain.ProjectionResult;
import my.goalplanner.app.dto.AllocationPolicyDto;
import my.goalplanner.app.dto.GoalSetRequest;
import my.goalplanner.app.dto.PlanRequest;
import my.goalplanner.app.dto.ProjectionRequest;
import my.goalplanner.app.dto.ProjectionResponseDto;
import my.goalplanner.app.service.AllocationPolicyService;
import my.goalplanner.app.service.GoalPlanningService;
import my.goalplanner.app.service.ProjectionEngine;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/api/planning")
@Tag(name = "Goal Planning")
public class PlanningController {
	private final ProjectionEngine projectionEngine;
	private final GoalPlanningService planningService;
	private final AllocationPolicyService policyService;
	private final Clock clock;

	public PlanningController(ProjectionEngine projectionEngine,
							  GoalPlanningService planningService,
							  AllocationPolicyService policyService,
							  Clock clock) {
		this.projectionEngine = projectionEngine;
		this.planningService = planningService;
		this.policyService = policyService;
		this.clock = clock;
	}

	@PostMapping("/projections")
	@Operation(summary = "Project the monthly SIP and asset mix for a single target")
	public ProjectionResponseDto project(@Valid @RequestBody ProjectionRequest request) {
		BigDecimal target = request.targetAmount();
		if (request.inflationRate() != null) {
			target = projectionEngine.inflationAdjustedAmount(target, request.timeInYears(), request.inflationRate());
		}
		ProjectionResult result = projectionEngine.project(target, request.timeInYears(), request.riskTolerance());
		List<Milestone> milestones = result.immediate()
				? List.of()
				: projectionEngine.milestones(target, request.timeInYears(), result.monthlySIP(),
						result.expectedReturn(), LocalDate.now(clock).getYear());
		return new ProjectionResponseDto(target, request.timeInYears(), result.horizonBucket(), result.allocation(),
				result.expectedReturn(), result.monthlySIP(), result.immediate(), milestones);
	}

	@PostMapping("/conflicts")
	@Operation(summary = "Detect near-term goals whose combined SIP exceeds the surplus")
	public List<ConflictWarning> conflicts(@Valid @RequestBody GoalSetRequest request) {
		return planningService.detectConflicts(request.toGoals(), request.riskTolerance(), request.availableSurplus());
	}

	@PostMapping("/allocations")
	@Operation(summary = "Allocate the surplus across goals by priority")
	public AllocationPlan allocations(@Valid @RequestBody GoalSetRequest request) {
		return planningService.allocate(request.toGoals(), request.riskTolerance(), request.availableSurplus());
	}

	@PostMapping("/plans")
	@Operation(summary = "Build the full goal plan with recommendations, served from cache when unchanged")
	public PlanningOutcome plan(@Valid @RequestBody PlanRequest request,
								@RequestParam(name = "forceRefresh", defaultValue = "false") boolean forceRefresh) {
		return planningService.plan(request.profile().toProfile(), request.toGoals(), forceRefresh);
	}

	@GetMapping("/allocation-policy")
	@Operation(summary = "Get the effective allocation policy")
	public AllocationPolicyDto allocationPolicy() {
		return AllocationPolicyDto.from(policyService.getPolicy());
	}
}
