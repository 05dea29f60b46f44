package my.goalplanner.app.cache;

import java.util.List;
import java.util.Optional;

/**
 * Key-value surface behind the recommendation cache, keyed by client id. Implementations hold at
 * most one entry per client and signal storage failures with {@link RecommendationCacheException}.
 */
public interface RecommendationStore {
	Optional<CacheEntry> find(String clientId);

	/**
	 * Writes the entry, replacing whatever the client had before.
	 */
	void save(CacheEntry entry);

	boolean delete(String clientId);

	int deleteAll();

	List<CacheEntry> findAll();
}
