package my.goalplanner.app.domain;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

/**
 * Goal priority. Declaration order is funding order: HIGH goals are funded first.
 */
public enum Priority {
	HIGH,
	MEDIUM,
	LOW;

	@JsonCreator
	public static Priority fromValue(String value) {
		if (value == null || value.isBlank()) {
			throw new IllegalArgumentException("Priority is required");
		}
		try {
			return Priority.valueOf(value.trim().toUpperCase(Locale.ROOT));
		} catch (IllegalArgumentException ex) {
			throw new IllegalArgumentException("Unknown priority: " + value, ex);
		}
	}
}
