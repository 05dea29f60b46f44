package my.goalplanner.app.llm;

public class NoopLlmClient implements LlmClient {
	@Override
	public LlmSuggestion suggestGoalRecommendations(String context) {
		return new LlmSuggestion("", "LLM disabled");
	}

	@Override
	public boolean isEnabled() {
		return false;
	}
}
