package my.goalplanner.app.cache;

import my.goalplanner.app.config.AppProperties;
import my.goalplanner.app.domain.ClientProfile;
import my.goalplanner.app.domain.Goal;
import my.goalplanner.app.domain.GoalRecommendation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Fingerprint-keyed memo of goal recommendations, one live entry per client.
 * <p>
 * A lookup hits only when the stored fingerprint equals the fingerprint of the current inputs,
 * so a plan is never served for a goal set or planning year it was not computed for. Entries
 * never expire; their age is reported and callers decide what is acceptable. {@code lookup}
 * followed by {@code store} is not atomic: concurrent stores for one client are last-write-wins.
 */
@Service
public class RecommendationCache {
	private static final Logger logger = LoggerFactory.getLogger(RecommendationCache.class);
	private static final long DEFAULT_STALE_AFTER_MINUTES = 24 * 60;

	private final RecommendationStore store;
	private final ObjectMapper objectMapper;
	private final Clock clock;
	private final long staleAfterMinutes;

	public RecommendationCache(RecommendationStore store, ObjectMapper objectMapper, Clock clock,
							   AppProperties properties) {
		this.store = store;
		this.objectMapper = objectMapper;
		this.clock = clock;
		this.staleAfterMinutes = properties == null || properties.cache() == null
				|| properties.cache().staleAfterMinutes() == null
				? DEFAULT_STALE_AFTER_MINUTES
				: properties.cache().staleAfterMinutes();
	}

	public Optional<CachedRecommendation> lookup(List<Goal> goals, ClientProfile profile) {
		String fingerprint = RecommendationFingerprint.compute(goals, profile, planningYear());
		Optional<CacheEntry> stored = store.find(profile.clientId());
		if (stored.isEmpty()) {
			logger.debug("Cache miss for client {}: no entry.", profile.clientId());
			return Optional.empty();
		}
		CacheEntry entry = stored.get();
		if (!fingerprint.equals(entry.fingerprint())) {
			logger.debug("Cache miss for client {}: fingerprint {} does not match stored {}.",
					profile.clientId(), abbreviate(fingerprint), abbreviate(entry.fingerprint()));
			return Optional.empty();
		}
		GoalRecommendation payload;
		try {
			payload = objectMapper.readValue(entry.payloadJson(), GoalRecommendation.class);
		} catch (JacksonException ex) {
			logger.warn("Discarding unreadable cache entry for client {}: {}", profile.clientId(), ex.getMessage());
			store.delete(profile.clientId());
			return Optional.empty();
		}
		long ageMinutes = ageMinutes(entry.createdAt());
		logger.debug("Cache hit for client {} (fingerprint={}, ageMinutes={}).",
				profile.clientId(), abbreviate(fingerprint), ageMinutes);
		return Optional.of(new CachedRecommendation(payload, fingerprint, entry.createdAt(), ageMinutes,
				ageMinutes >= staleAfterMinutes));
	}

	public void store(List<Goal> goals, ClientProfile profile, GoalRecommendation payload) {
		if (payload == null) {
			throw new IllegalArgumentException("Payload is required");
		}
		String fingerprint = RecommendationFingerprint.compute(goals, profile, planningYear());
		String json = objectMapper.writeValueAsString(payload);
		store.save(new CacheEntry(profile.clientId(), fingerprint, json, goals.size(), clock.instant()));
		logger.info("Cached recommendation for client {} (fingerprint={}, goals={}).",
				profile.clientId(), abbreviate(fingerprint), goals.size());
	}

	/**
	 * Drops the client's entry so the next lookup misses.
	 *
	 * @return whether an entry was removed
	 */
	public boolean forceRefresh(List<Goal> goals, ClientProfile profile) {
		boolean removed = store.delete(profile.clientId());
		logger.info("Force refresh for client {} (goals={}, removed={}).",
				profile.clientId(), goals == null ? 0 : goals.size(), removed);
		return removed;
	}

	public int clearAll() {
		int removed = store.deleteAll();
		logger.info("Cleared recommendation cache ({} entries).", removed);
		return removed;
	}

	public CacheStats stats() {
		List<CacheEntry> entries = store.findAll();
		int stale = 0;
		long bytes = 0;
		for (CacheEntry entry : entries) {
			if (ageMinutes(entry.createdAt()) >= staleAfterMinutes) {
				stale++;
			}
			bytes += entry.payloadJson() == null ? 0 : entry.payloadJson().getBytes(StandardCharsets.UTF_8).length;
		}
		return new CacheStats(entries.size(), stale, entries.size() - stale, bytes);
	}

	public long getStaleAfterMinutes() {
		return staleAfterMinutes;
	}

	private int planningYear() {
		return LocalDate.now(clock).getYear();
	}

	private long ageMinutes(Instant createdAt) {
		long minutes = Duration.between(createdAt, clock.instant()).toMinutes();
		return Math.max(0, minutes);
	}

	private static String abbreviate(String fingerprint) {
		return fingerprint == null || fingerprint.length() <= 12 ? fingerprint : fingerprint.substring(0, 12);
	}
}
