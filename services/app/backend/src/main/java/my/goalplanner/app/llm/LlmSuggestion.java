package my.goalplanner.app.llm;

public record LlmSuggestion(String suggestion, String rationale) {
}
