package my.goalplanner.app.service;

import my.goalplanner.app.config.AppProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Keeps identifying client data out of prompts sent to an LLM hosted outside the network.
 */
@Service
public class LlmPromptPolicy {
	private static final Logger logger = LoggerFactory.getLogger(LlmPromptPolicy.class);
	private static final List<Pattern> SENSITIVE_MARKERS = List.of(
			Pattern.compile("\\bclient_?id\\b", Pattern.CASE_INSENSITIVE),
			Pattern.compile("\\bpan\\s*(no|number)?\\s*[:=]", Pattern.CASE_INSENSITIVE),
			Pattern.compile("\\baadhaar\\b", Pattern.CASE_INSENSITIVE),
			Pattern.compile("\\b[A-Z]{5}[0-9]{4}[A-Z]\\b"),
			Pattern.compile("\\biban\\b", Pattern.CASE_INSENSITIVE),
			Pattern.compile("\\baccount\\s*(no|number)\\b", Pattern.CASE_INSENSITIVE),
			Pattern.compile("\\bemail\\b", Pattern.CASE_INSENSITIVE),
			Pattern.compile("[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}"),
			Pattern.compile("\\bphone\\b", Pattern.CASE_INSENSITIVE),
			Pattern.compile("\\bpassword\\b", Pattern.CASE_INSENSITIVE),
			Pattern.compile("\\btoken\\b", Pattern.CASE_INSENSITIVE)
	);
	private static final List<String> LOCAL_HOSTS = List.of("localhost", "127.0.0.1", "::1", "0.0.0.0");

	private final AppProperties properties;

	public LlmPromptPolicy(AppProperties properties) {
		this.properties = properties;
	}

	/**
	 * @return the prompt unchanged, or {@code null} when it must not leave the network
	 */
	public String validatePrompt(String prompt) {
		if (!isExternalProvider() || prompt == null || prompt.isBlank()) {
			return prompt;
		}
		List<String> violations = new ArrayList<>();
		for (Pattern pattern : SENSITIVE_MARKERS) {
			if (pattern.matcher(prompt).find()) {
				violations.add(pattern.pattern());
			}
		}
		if (!violations.isEmpty()) {
			logger.warn("Blocked goal recommendation prompt due to sensitive markers: {}", String.join(", ", violations));
			return null;
		}
		return prompt;
	}

	public boolean isExternalProvider() {
		if (properties == null || properties.llm() == null) {
			return false;
		}
		if (Boolean.TRUE.equals(properties.llm().externalProvider())) {
			return true;
		}
		String provider = safeLower(properties.llm().provider());
		if (provider.isBlank() || provider.equals("none") || provider.equals("noop") || provider.equals("disabled")) {
			return false;
		}
		String baseUrl = properties.llm().openai() == null ? null : properties.llm().openai().baseUrl();
		return !isLocalBaseUrl(baseUrl);
	}

	private boolean isLocalBaseUrl(String baseUrl) {
		if (baseUrl == null || baseUrl.isBlank()) {
			return false;
		}
		try {
			String host = URI.create(baseUrl).getHost();
			if (host == null || host.isBlank()) {
				return false;
			}
			String normalized = host.toLowerCase(Locale.ROOT);
			return LOCAL_HOSTS.contains(normalized) || normalized.endsWith(".local");
		} catch (IllegalArgumentException ex) {
			logger.debug("Unparseable LLM base URL {}: {}", baseUrl, ex.getMessage());
			return false;
		}
	}

	private String safeLower(String value) {
		return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
	}
}
