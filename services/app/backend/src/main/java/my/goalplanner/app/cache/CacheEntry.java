package my.goalplanner.app.cache;

import java.time.Instant;

/**
 * One memoized recommendation as held by a {@link RecommendationStore}. The payload is already
 * serialized so every store keeps exactly the same bytes.
 */
public record CacheEntry(String clientId,
						 String fingerprint,
						 String payloadJson,
						 int goalsCount,
						 Instant createdAt) {
}
