package my.goalplanner.app.cache;

import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;

/**
 * Stores cache entries in the {@code recommendation_cache} table.
 */
public class JdbcRecommendationStore implements RecommendationStore {
	private static final RowMapper<CacheEntry> ROW_MAPPER = (rs, rowNum) -> new CacheEntry(
			rs.getString("client_id"),
			rs.getString("fingerprint"),
			rs.getString("payload_json"),
			rs.getInt("goals_count"),
			rs.getTimestamp("created_at").toInstant());

	private final JdbcTemplate jdbcTemplate;
	private final TransactionTemplate transactionTemplate;

	public JdbcRecommendationStore(JdbcTemplate jdbcTemplate, TransactionTemplate transactionTemplate) {
		this.jdbcTemplate = jdbcTemplate;
		this.transactionTemplate = transactionTemplate;
	}

	@Override
	public Optional<CacheEntry> find(String clientId) {
		try {
			List<CacheEntry> rows = jdbcTemplate.query("""
					select client_id, fingerprint, payload_json, goals_count, created_at
					from recommendation_cache
					where client_id = ?
					""", ROW_MAPPER, clientId);
			return rows.stream().findFirst();
		} catch (DataAccessException ex) {
			throw new RecommendationCacheException("Failed to read cache entry for client " + clientId, ex);
		}
	}

	@Override
	public void save(CacheEntry entry) {
		try {
			transactionTemplate.executeWithoutResult(status -> {
				jdbcTemplate.update("delete from recommendation_cache where client_id = ?", entry.clientId());
				jdbcTemplate.update("""
								insert into recommendation_cache (client_id, fingerprint, payload_json, goals_count, created_at)
								values (?, ?, ?, ?, ?)
								""",
						entry.clientId(),
						entry.fingerprint(),
						entry.payloadJson(),
						entry.goalsCount(),
						Timestamp.from(entry.createdAt()));
			});
		} catch (DataAccessException ex) {
			throw new RecommendationCacheException("Failed to write cache entry for client " + entry.clientId(), ex);
		}
	}

	@Override
	public boolean delete(String clientId) {
		try {
			return jdbcTemplate.update("delete from recommendation_cache where client_id = ?", clientId) > 0;
		} catch (DataAccessException ex) {
			throw new RecommendationCacheException("Failed to delete cache entry for client " + clientId, ex);
		}
	}

	@Override
	public int deleteAll() {
		try {
			return jdbcTemplate.update("delete from recommendation_cache");
		} catch (DataAccessException ex) {
			throw new RecommendationCacheException("Failed to clear recommendation cache", ex);
		}
	}

	@Override
	public List<CacheEntry> findAll() {
		try {
			return jdbcTemplate.query("""
					select client_id, fingerprint, payload_json, goals_count, created_at
					from recommendation_cache
					order by created_at
					""", ROW_MAPPER);
		} catch (DataAccessException ex) {
			throw new RecommendationCacheException("Failed to list cache entries", ex);
		}
	}
}
