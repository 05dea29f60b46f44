package my.goalplanner.app.service;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.annotation.PreDestroy;
import my.goalplanner.app.config.AppProperties;
import my.goalplanner.app.domain.AdvisoryRecommendation;
import my.goalplanner.app.domain.AllocationPlan;
import my.goalplanner.app.domain.AllocationResult;
import my.goalplanner.app.domain.ClientProfile;
import my.goalplanner.app.domain.ConflictWarning;
import my.goalplanner.app.domain.ProjectedGoal;
import my.goalplanner.app.llm.LlmClient;
import my.goalplanner.app.llm.LlmRequestException;
import my.goalplanner.app.llm.LlmSuggestion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fetches narrative advice for a computed plan from the configured LLM, bounded by a timeout.
 * Without an LLM the rule-based {@link FallbackRecommendationGenerator} answers instead.
 */
@Service
public class AdvisoryRecommendationService {
	private static final Logger logger = LoggerFactory.getLogger(AdvisoryRecommendationService.class);
	private static final int DEFAULT_TIMEOUT_SECONDS = 60;

	private final LlmClient llmClient;
	private final LlmPromptPolicy promptPolicy;
	private final FallbackRecommendationGenerator fallbackGenerator;
	private final ObjectMapper objectMapper;
	private final Duration defaultTimeout;
	private final ExecutorService executor;

	public AdvisoryRecommendationService(LlmClient llmClient,
										 LlmPromptPolicy promptPolicy,
										 FallbackRecommendationGenerator fallbackGenerator,
										 ObjectMapper objectMapper,
										 AppProperties properties) {
		this.llmClient = llmClient;
		this.promptPolicy = promptPolicy;
		this.fallbackGenerator = fallbackGenerator;
		this.objectMapper = objectMapper;
		Integer timeoutSeconds = properties == null || properties.llm() == null
				? null
				: properties.llm().recommendationTimeoutSeconds();
		this.defaultTimeout = Duration.ofSeconds(timeoutSeconds == null || timeoutSeconds <= 0
				? DEFAULT_TIMEOUT_SECONDS
				: timeoutSeconds);
		AtomicInteger threadCounter = new AtomicInteger();
		this.executor = Executors.newCachedThreadPool(runnable -> {
			Thread thread = new Thread(runnable, "advisory-llm-" + threadCounter.incrementAndGet());
			thread.setDaemon(true);
			return thread;
		});
	}

	public Duration getDefaultTimeout() {
		return defaultTimeout;
	}

	public AdvisoryRecommendation recommend(ClientProfile profile,
											List<ProjectedGoal> goals,
											AllocationPlan plan,
											List<ConflictWarning> conflicts) {
		return recommend(profile, goals, plan, conflicts, defaultTimeout);
	}

	/**
	 * @throws AdvisoryUnavailableException when the LLM fails, returns unusable output or does not
	 *                                      answer within {@code timeout}
	 */
	public AdvisoryRecommendation recommend(ClientProfile profile,
											List<ProjectedGoal> goals,
											AllocationPlan plan,
											List<ConflictWarning> conflicts,
											Duration timeout) {
		if (!llmClient.isEnabled()) {
			return fallbackGenerator.generate(profile, plan, conflicts);
		}
		String prompt = promptPolicy.validatePrompt(buildPrompt(profile, goals, plan, conflicts));
		if (prompt == null) {
			throw new AdvisoryUnavailableException("Recommendation prompt blocked by policy", false, null);
		}
		Duration effectiveTimeout = timeout == null || timeout.isNegative() || timeout.isZero() ? defaultTimeout : timeout;
		logger.info("Sending goal recommendation request to LLM (goals={}, promptChars={}).", goals.size(), prompt.length());
		logger.debug("Goal recommendation prompt: {}", prompt);
		Future<LlmSuggestion> future = executor.submit(() -> llmClient.suggestGoalRecommendations(prompt));
		LlmSuggestion suggestion;
		try {
			suggestion = future.get(effectiveTimeout.toMillis(), TimeUnit.MILLISECONDS);
		} catch (TimeoutException ex) {
			future.cancel(true);
			logger.warn("Goal recommendation request timed out after {} ms.", effectiveTimeout.toMillis());
			throw new AdvisoryUnavailableException("Recommendation source timed out", true, ex);
		} catch (InterruptedException ex) {
			future.cancel(true);
			Thread.currentThread().interrupt();
			throw new AdvisoryUnavailableException("Recommendation request was cancelled", true, ex);
		} catch (ExecutionException ex) {
			Throwable cause = ex.getCause() == null ? ex : ex.getCause();
			boolean retryable = !(cause instanceof LlmRequestException request) || request.isRetryable();
			logger.warn("Goal recommendation request failed: {}", cause.getMessage());
			throw new AdvisoryUnavailableException("Recommendation source failed: " + cause.getMessage(), retryable, cause);
		}
		AdvisoryRecommendation recommendation = parse(suggestion);
		logger.info("LLM returned goal recommendations ({} warnings, {} opportunities).",
				recommendation.riskWarnings().size(), recommendation.opportunities().size());
		return recommendation;
	}

	private AdvisoryRecommendation parse(LlmSuggestion suggestion) {
		if (suggestion == null || suggestion.suggestion() == null || suggestion.suggestion().isBlank()) {
			String reason = suggestion == null ? "no response" : suggestion.rationale();
			throw new AdvisoryUnavailableException("Recommendation source returned no content (" + reason + ")", true, null);
		}
		String json = stripCodeFences(suggestion.suggestion().trim());
		RecommendationDraft draft;
		try {
			draft = objectMapper.readValue(json, RecommendationDraft.class);
		} catch (JacksonException ex) {
			logger.debug("Unparseable goal recommendation output: {}", json);
			throw new AdvisoryUnavailableException("Recommendation source returned invalid JSON", true, ex);
		}
		if (draft == null) {
			throw new AdvisoryUnavailableException("Recommendation source returned an empty document", true, null);
		}
		return new AdvisoryRecommendation(
				trimToEmpty(draft.debtStrategy()),
				trimToEmpty(draft.emergencyFundAnalysis()),
				trimToEmpty(draft.investmentAnalysis()),
				trimToEmpty(draft.cashFlowOptimization()),
				draft.riskWarnings() == null ? List.of() : List.copyOf(draft.riskWarnings()),
				draft.opportunities() == null ? List.of() : List.copyOf(draft.opportunities()),
				suggestion.rationale());
	}

	String buildPrompt(ClientProfile profile,
					   List<ProjectedGoal> goals,
					   AllocationPlan plan,
					   List<ConflictWarning> conflicts) {
		StringBuilder prompt = new StringBuilder();
		prompt.append("Household cash flow (monthly):\n")
				.append("- income: ").append(profile.totalMonthlyIncome().toPlainString()).append('\n')
				.append("- expenses: ").append(profile.totalMonthlyExpenses().toPlainString()).append('\n')
				.append("- debt EMIs: ").append(profile.monthlyEMI().toPlainString()).append('\n')
				.append("- surplus: ").append(profile.monthlySurplus().toPlainString()).append('\n')
				.append("- risk tolerance: ").append(profile.riskTolerance().name().toLowerCase(Locale.ROOT)).append("\n\n");
		prompt.append("Goals:\n");
		for (ProjectedGoal goal : goals) {
			AllocationResult allocation = findAllocation(plan, goal.goalId());
			prompt.append("- ").append(goal.title())
					.append(": target ").append(goal.targetAmount().toPlainString())
					.append(" by ").append(goal.targetYear())
					.append(", priority ").append(goal.priority().name().toLowerCase(Locale.ROOT))
					.append(", required SIP ").append(goal.monthlySIP().toPlainString())
					.append(", allocation equity/debt/gold ")
					.append(goal.assetAllocation().equityPct()).append('/')
					.append(goal.assetAllocation().debtPct()).append('/')
					.append(goal.assetAllocation().goldPct());
			if (allocation != null) {
				prompt.append(", funded ").append(allocation.fundedAmount().toPlainString());
			}
			prompt.append('\n');
		}
		if (plan != null) {
			prompt.append("\nAll goals fundable from surplus: ").append(plan.feasible() ? "yes" : "no").append('\n');
		}
		if (conflicts != null && !conflicts.isEmpty()) {
			prompt.append("Timeline conflicts: ").append(conflicts.size()).append('\n');
		}
		prompt.append("\nGive debt strategy, emergency fund analysis, investment analysis, cash flow optimisation, "
				+ "risk warnings and opportunities for this household.");
		return prompt.toString();
	}

	@PreDestroy
	public void shutdown() {
		executor.shutdownNow();
	}

	private AllocationResult findAllocation(AllocationPlan plan, String goalId) {
		if (plan == null) {
			return null;
		}
		for (AllocationResult result : plan.results()) {
			if (result.goalId().equals(goalId)) {
				return result;
			}
		}
		return null;
	}

	private String stripCodeFences(String text) {
		if (!text.startsWith("```")) {
			return text;
		}
		int firstNewline = text.indexOf('\n');
		int lastFence = text.lastIndexOf("```");
		if (firstNewline < 0 || lastFence <= firstNewline) {
			return text;
		}
		return text.substring(firstNewline + 1, lastFence).trim();
	}

	private String trimToEmpty(String value) {
		return value == null ? "" : value.trim();
	}

	@JsonIgnoreProperties(ignoreUnknown = true)
	record RecommendationDraft(String debtStrategy,
							   String emergencyFundAnalysis,
							   String investmentAnalysis,
							   String cashFlowOptimization,
							   List<String> riskWarnings,
							   List<String> opportunities) {
	}
}
