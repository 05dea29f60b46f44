package my.goalplanner.app.cache;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JdbcRecommendationStoreTest {
	private EmbeddedDatabase database;
	private JdbcTemplate jdbcTemplate;
	private JdbcRecommendationStore store;

	@BeforeEach
	void setUp() {
		database = new EmbeddedDatabaseBuilder()
				.generateUniqueName(true)
				.setType(EmbeddedDatabaseType.H2)
				.addScript("schema.sql")
				.build();
		jdbcTemplate = new JdbcTemplate(database);
		store = new JdbcRecommendationStore(jdbcTemplate,
				new TransactionTemplate(new DataSourceTransactionManager(database)));
	}

	@AfterEach
	void tearDown() {
		database.shutdown();
	}

	@Test
	void saveThenFindRoundTripsEntry() {
		Instant createdAt = Instant.parse("2025-06-01T10:15:30Z");
		store.save(new CacheEntry("client-1", "abc", "{\"clientId\":\"client-1\"}", 2, createdAt));

		CacheEntry entry = store.find("client-1").orElseThrow();

		assertThat(entry.fingerprint()).isEqualTo("abc");
		assertThat(entry.payloadJson()).isEqualTo("{\"clientId\":\"client-1\"}");
		assertThat(entry.goalsCount()).isEqualTo(2);
		assertThat(entry.createdAt()).isEqualTo(createdAt);
	}

	@Test
	void saveReplacesExistingEntryForClient() {
		store.save(new CacheEntry("client-1", "old", "{}", 1, Instant.parse("2025-06-01T10:00:00Z")));
		store.save(new CacheEntry("client-1", "new", "{}", 3, Instant.parse("2025-06-02T10:00:00Z")));

		assertThat(store.find("client-1").orElseThrow().fingerprint()).isEqualTo("new");
		assertThat(jdbcTemplate.queryForObject("select count(*) from recommendation_cache", Integer.class)).isEqualTo(1);
	}

	@Test
	void deleteAndDeleteAllReportWhatWasRemoved() {
		store.save(new CacheEntry("client-1", "a", "{}", 1, Instant.parse("2025-06-01T10:00:00Z")));
		store.save(new CacheEntry("client-2", "b", "{}", 1, Instant.parse("2025-06-01T11:00:00Z")));
		store.save(new CacheEntry("client-3", "c", "{}", 1, Instant.parse("2025-06-01T12:00:00Z")));

		assertThat(store.delete("client-1")).isTrue();
		assertThat(store.delete("client-1")).isFalse();
		assertThat(store.findAll()).extracting(CacheEntry::clientId).containsExactly("client-2", "client-3");
		assertThat(store.deleteAll()).isEqualTo(2);
		assertThat(store.find("client-2")).isEmpty();
	}

	@Test
	void storageFailureIsWrapped() {
		jdbcTemplate.execute("drop table recommendation_cache");

		assertThatThrownBy(() -> store.find("client-1"))
				.isInstanceOf(RecommendationCacheException.class)
				.hasMessageContaining("client-1");
	}
}
