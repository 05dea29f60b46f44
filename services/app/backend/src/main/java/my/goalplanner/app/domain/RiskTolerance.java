package my.goalplanner.app.domain;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

public enum RiskTolerance {
	CONSERVATIVE,
	MODERATE,
	AGGRESSIVE;

	@JsonCreator
	public static RiskTolerance fromValue(String value) {
		if (value == null || value.isBlank()) {
			throw new IllegalArgumentException("Risk tolerance is required");
		}
		try {
			return RiskTolerance.valueOf(value.trim().toUpperCase(Locale.ROOT));
		} catch (IllegalArgumentException ex) {
			throw new IllegalArgumentException("Unknown risk tolerance: " + value, ex);
		}
	}
}
