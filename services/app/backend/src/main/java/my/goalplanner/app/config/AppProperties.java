package my.goalplanner.app.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app")
public record AppProperties(
		Planning planning,
		Cache cache,
		Llm llm
) {
	public record Planning(
			String allocationPolicyLocation,
			Integer nearTermYears,
			Integer clusterWindowYears,
			Double conflictSurplusFraction
	) {
	}

	public record Cache(
			@NotBlank String store,
			Long staleAfterMinutes
	) {
	}

	public record Llm(
			@NotBlank String provider,
			OpenAi openai,
			Boolean externalProvider,
			Integer recommendationTimeoutSeconds
	) {
		public record OpenAi(
				String apiKey,
				String baseUrl,
				String model,
				Integer connectTimeoutSeconds,
				Integer readTimeoutSeconds
		) {
		}
	}
}
