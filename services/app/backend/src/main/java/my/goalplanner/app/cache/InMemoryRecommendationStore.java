package my.goalplanner.app.cache;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryRecommendationStore implements RecommendationStore {
	private final Map<String, CacheEntry> entries = new ConcurrentHashMap<>();

	@Override
	public Optional<CacheEntry> find(String clientId) {
		return Optional.ofNullable(entries.get(clientId));
	}

	@Override
	public void save(CacheEntry entry) {
		entries.put(entry.clientId(), entry);
	}

	@Override
	public boolean delete(String clientId) {
		return entries.remove(clientId) != null;
	}

	@Override
	public int deleteAll() {
		int removed = 0;
		for (String clientId : List.copyOf(entries.keySet())) {
			if (entries.remove(clientId) != null) {
				removed++;
			}
		}
		return removed;
	}

	@Override
	public List<CacheEntry> findAll() {
		return List.copyOf(entries.values());
	}
}
