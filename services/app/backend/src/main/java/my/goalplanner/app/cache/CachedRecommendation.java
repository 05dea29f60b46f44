package my.goalplanner.app.cache;

import my.goalplanner.app.domain.GoalRecommendation;

import java.time.Instant;

/**
 * A cache hit. {@code stale} only reports that the entry is older than the configured threshold;
 * the cache still serves it.
 */
public record CachedRecommendation(GoalRecommendation payload,
								   String fingerprint,
								   Instant createdAt,
								   long ageMinutes,
								   boolean stale) {
}
