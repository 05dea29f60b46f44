package my.goalplanner.app.service;

/**
 * The advisory source failed, timed out or was cancelled. Nothing is cached for the attempt.
 */
public class AdvisoryUnavailableException extends RuntimeException {
	private final boolean retryable;

	public AdvisoryUnavailableException(String message, boolean retryable, Throwable cause) {
		super(message, cause);
		this.retryable = retryable;
	}

	public boolean isRetryable() {
		return retryable;
	}
}
