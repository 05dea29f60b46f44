package my.goalplanner.app.llm;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.time.Duration;
import java.util.List;
import java.util.Map;

public class OpenAiLlmClient implements LlmClient {
	private static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(30);
	private static final Duration DEFAULT_READ_TIMEOUT = Duration.ofMinutes(2);
	private static final String SYSTEM_PROMPT = """
			You are a financial planning assistant for an advisor. Respond in JSON only, without Markdown \
			code fences, using exactly these keys: debtStrategy, emergencyFundAnalysis, investmentAnalysis, \
			cashFlowOptimization (strings), riskWarnings, opportunities (arrays of strings).""";

	private final RestClient restClient;
	private final String model;

	public OpenAiLlmClient(String baseUrl, String apiKey, String model) {
		this(baseUrl, apiKey, model, DEFAULT_CONNECT_TIMEOUT, DEFAULT_READ_TIMEOUT);
	}

	public OpenAiLlmClient(String baseUrl, String apiKey, String model, Duration connectTimeout, Duration readTimeout) {
		SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
		requestFactory.setConnectTimeout(connectTimeout == null ? DEFAULT_CONNECT_TIMEOUT : connectTimeout);
		requestFactory.setReadTimeout(readTimeout == null ? DEFAULT_READ_TIMEOUT : readTimeout);
		this.restClient = RestClient.builder()
				.baseUrl(baseUrl)
				.requestFactory(requestFactory)
				.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
				.defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
				.build();
		this.model = model;
	}

	@Override
	public LlmSuggestion suggestGoalRecommendations(String context) {
		Map<String, Object> request = Map.of(
				"model", model,
				"response_format", Map.of("type", "json_object"),
				"messages", List.of(
						Map.of("role", "system", "content", SYSTEM_PROMPT),
						Map.of("role", "user", "content", context)));
		Map<?, ?> response;
		try {
			response = restClient.post().uri("/chat/completions").body(request).retrieve().body(Map.class);
		} catch (RestClientResponseException ex) {
			throw new LlmRequestException(safeMessage(ex), ex.getStatusCode().value(),
					isRetryable(ex.getStatusCode()), ex);
		} catch (ResourceAccessException ex) {
			throw new LlmRequestException(safeMessage(ex), null, true, ex);
		} catch (RestClientException ex) {
			throw new LlmRequestException(safeMessage(ex), null, false, ex);
		}
		return toSuggestion(response);
	}

	private LlmSuggestion toSuggestion(Map<?, ?> response) {
		if (response == null || response.get("choices") == null) {
			return new LlmSuggestion("", "No response");
		}
		Object choices = response.get("choices");
		if (!(choices instanceof List<?> list) || list.isEmpty()) {
			return new LlmSuggestion("", "No choices");
		}
		Object first = list.get(0);
		if (!(first instanceof Map<?, ?> map)) {
			return new LlmSuggestion("", "Invalid response");
		}
		Object message = map.get("message");
		if (!(message instanceof Map<?, ?> msgMap)) {
			return new LlmSuggestion("", "Invalid message");
		}
		Object content = msgMap.get("content");
		return new LlmSuggestion(content == null ? "" : content.toString(), "openai(model=" + model + ")");
	}

	private boolean isRetryable(HttpStatusCode status) {
		return status.value() == 429 || status.is5xxServerError();
	}

	private String safeMessage(Exception ex) {
		String message = ex.getMessage();
		if (message == null || message.isBlank()) {
			return ex.getClass().getSimpleName();
		}
		return message.length() > 300 ? message.substring(0, 300) : message;
	}
}
