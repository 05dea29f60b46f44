package my.goalplanner.app.config;

import my.goalplanner.app.cache.InMemoryRecommendationStore;
import my.goalplanner.app.cache.JdbcRecommendationStore;
import my.goalplanner.app.cache.RecommendationStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.time.Clock;

@Configuration
public class CacheConfig {
	private static final Logger logger = LoggerFactory.getLogger(CacheConfig.class);

	@Bean
	@ConditionalOnMissingBean(Clock.class)
	public Clock clock() {
		return Clock.systemUTC();
	}

	@Bean
	@ConditionalOnProperty(name = "app.cache.store", havingValue = "jdbc")
	public RecommendationStore jdbcRecommendationStore(JdbcTemplate jdbcTemplate, DataSource dataSource) {
		logger.info("Recommendation cache backed by JDBC table recommendation_cache.");
		return new JdbcRecommendationStore(jdbcTemplate,
				new TransactionTemplate(new DataSourceTransactionManager(dataSource)));
	}

	@Bean
	@ConditionalOnMissingBean(RecommendationStore.class)
	public RecommendationStore inMemoryRecommendationStore() {
		logger.info("Recommendation cache held in memory.");
		return new InMemoryRecommendationStore();
	}
}
