package my.goalplanner.app.config;

import my.goalplanner.app.llm.LlmClient;
import my.goalplanner.app.llm.NoopLlmClient;
import my.goalplanner.app.llm.OpenAiLlmClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class LlmConfig {
	private static final Logger logger = LoggerFactory.getLogger(LlmConfig.class);
	private static final String DEFAULT_MODEL = "gpt-4o-mini";
	private static final String DEFAULT_BASE_URL = "https://api.openai.com/v1";

	@Bean
	@ConditionalOnProperty(name = "app.llm.provider", havingValue = "openai")
	public OpenAiLlmClient openAiLlmClient(AppProperties properties) {
		AppProperties.Llm.OpenAi openai = properties.llm().openai();
		if (openai == null || openai.apiKey() == null || openai.apiKey().isBlank()) {
			throw new IllegalStateException("app.llm.openai.api-key is required when app.llm.provider=openai");
		}
		String model = openai.model();
		if (model == null || model.isBlank()) {
			model = DEFAULT_MODEL;
		}
		String baseUrl = openai.baseUrl() == null || openai.baseUrl().isBlank() ? DEFAULT_BASE_URL : openai.baseUrl();
		int connectTimeout = openai.connectTimeoutSeconds() == null ? 30 : Math.max(1, openai.connectTimeoutSeconds());
		int readTimeout = openai.readTimeoutSeconds() == null ? 120 : Math.max(1, openai.readTimeoutSeconds());
		logger.info("LLM client enabled (provider=openai, model={}).", model);
		return new OpenAiLlmClient(baseUrl, openai.apiKey(), model,
				Duration.ofSeconds(connectTimeout),
				Duration.ofSeconds(readTimeout));
	}

	@Bean
	@ConditionalOnMissingBean(LlmClient.class)
	public NoopLlmClient noopLlmClient() {
		logger.info("LLM client disabled (provider=noop), using rule-based recommendations.");
		return new NoopLlmClient();
	}
}
