package my.goalplanner.app.llm;

public interface LlmClient {
	/**
	 * Asks for goal-plan advice as a JSON document.
	 *
	 * @throws LlmRequestException when the provider cannot be reached or rejects the request
	 */
	LlmSuggestion suggestGoalRecommendations(String context);

	default boolean isEnabled() {
		return true;
	}
}
