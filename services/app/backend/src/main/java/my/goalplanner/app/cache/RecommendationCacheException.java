package my.goalplanner.app.cache;

public class RecommendationCacheException extends RuntimeException {
	public RecommendationCacheException(String message, Throwable cause) {
		super(message, cause);
	}
}
