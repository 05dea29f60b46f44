package my.goalplanner.app.domain;

import java.util.List;

/**
 * Narrative advice from the advisory source. Stored opaquely alongside the computed plan.
 *
 * @param source which source produced the advice, e.g. the LLM model name or {@code fallback}
 */
public record AdvisoryRecommendation(String debtStrategy,
									 String emergencyFundAnalysis,
									 String investmentAnalysis,
									 String cashFlowOptimization,
									 List<String> riskWarnings,
									 List<String> opportunities,
									 String source) {
}
