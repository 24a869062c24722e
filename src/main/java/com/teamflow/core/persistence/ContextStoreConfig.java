package com.teamflow.core.persistence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.sql.SQLException;
import java.time.Clock;

/**
 * Provides the {@link ContextStore} bean.
 * <p>
 * With {@code teamflow.store.type=jdbc} (the {@code postgres} profile) entries
 * go to PostgreSQL through {@link JdbcContextStore}. Otherwise an in-memory
 * store is used, which does not survive restarts.
 */
@Configuration
public class ContextStoreConfig {

    private static final Logger log = LoggerFactory.getLogger(ContextStoreConfig.class);

    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnProperty(prefix = "teamflow.store", name = "type", havingValue = "jdbc")
    public ContextStore jdbcContextStore(DataSource dataSource, Clock clock) throws SQLException {
        log.info("Configuring JDBC context store (PostgreSQL)");
        var store = new JdbcContextStore(dataSource, clock);
        store.createTables();
        return store;
    }

    @Bean
    @ConditionalOnMissingBean(ContextStore.class)
    public ContextStore memoryContextStore(Clock clock) {
        log.info("Using in-memory context store (state will not persist across restarts)");
        return new InMemoryContextStore(clock);
    }
}
