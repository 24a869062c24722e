package com.teamflow.core.persistence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * JDBC-backed {@link ContextStore} persisting entries to a PostgreSQL table.
 * <p>
 * Each entry is one row keyed by {@code (namespace, entry_key)}. Expired rows
 * are filtered out on read and purged lazily by {@link #purgeExpired()}.
 * The table {@code teamflow_context} is created by {@link #createTables()}.
 */
public class JdbcContextStore implements ContextStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcContextStore.class);

    private static final String TABLE_NAME = "teamflow_context";

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                namespace   VARCHAR(255) NOT NULL,
                entry_key   VARCHAR(255) NOT NULL,
                value       TEXT NOT NULL,
                expires_at  TIMESTAMP,
                updated_at  TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                PRIMARY KEY (namespace, entry_key)
            )
            """.formatted(TABLE_NAME);

    private static final String UPSERT_SQL = """
            INSERT INTO %s (namespace, entry_key, value, expires_at)
            VALUES (?, ?, ?, ?)
            ON CONFLICT (namespace, entry_key)
            DO UPDATE SET value = EXCLUDED.value,
                          expires_at = EXCLUDED.expires_at,
                          updated_at = CURRENT_TIMESTAMP
            """.formatted(TABLE_NAME);

    private static final String SELECT_SQL = """
            SELECT value FROM %s
            WHERE namespace = ? AND entry_key = ?
              AND (expires_at IS NULL OR expires_at > ?)
            """.formatted(TABLE_NAME);

    private static final String SELECT_KEYS_SQL = """
            SELECT entry_key FROM %s
            WHERE namespace = ? AND (expires_at IS NULL OR expires_at > ?)
            ORDER BY entry_key ASC
            """.formatted(TABLE_NAME);

    private static final String DELETE_SQL = """
            DELETE FROM %s WHERE namespace = ? AND entry_key = ?
            """.formatted(TABLE_NAME);

    private static final String DELETE_NAMESPACE_SQL = """
            DELETE FROM %s WHERE namespace = ?
            """.formatted(TABLE_NAME);

    private static final String PURGE_SQL = """
            DELETE FROM %s WHERE expires_at IS NOT NULL AND expires_at <= ?
            """.formatted(TABLE_NAME);

    private final DataSource dataSource;
    private final Clock clock;

    public JdbcContextStore(DataSource dataSource, Clock clock) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.clock = clock;
    }

    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(CREATE_TABLE_SQL)) {
            stmt.execute();
            log.info("Context table '{}' ensured", TABLE_NAME);
        }
    }

    @Override
    public void store(String namespace, String key, String value, Duration ttl) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(UPSERT_SQL)) {
            stmt.setString(1, namespace);
            stmt.setString(2, key);
            stmt.setString(3, value);
            stmt.setTimestamp(4, ttl == null ? null : Timestamp.from(clock.instant().plus(ttl)));
            stmt.executeUpdate();
            log.debug("Stored '{}' in namespace '{}'", key, namespace);
        } catch (SQLException e) {
            throw new ContextStoreException("Failed to store '" + key + "' in '" + namespace + "'", e);
        }
    }

    @Override
    public Optional<String> retrieve(String namespace, String key) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_SQL)) {
            stmt.setString(1, namespace);
            stmt.setString(2, key);
            stmt.setTimestamp(3, Timestamp.from(clock.instant()));
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(rs.getString("value")) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new ContextStoreException("Failed to read '" + key + "' from '" + namespace + "'", e);
        }
    }

    @Override
    public boolean delete(String namespace, String key) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(DELETE_SQL)) {
            stmt.setString(1, namespace);
            stmt.setString(2, key);
            return stmt.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new ContextStoreException("Failed to delete '" + key + "' from '" + namespace + "'", e);
        }
    }

    @Override
    public int deleteNamespace(String namespace) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(DELETE_NAMESPACE_SQL)) {
            stmt.setString(1, namespace);
            int deleted = stmt.executeUpdate();
            log.debug("Deleted {} entries from namespace '{}'", deleted, namespace);
            return deleted;
        } catch (SQLException e) {
            throw new ContextStoreException("Failed to delete namespace '" + namespace + "'", e);
        }
    }

    @Override
    public List<String> keys(String namespace) {
        List<String> keys = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_KEYS_SQL)) {
            stmt.setString(1, namespace);
            stmt.setTimestamp(2, Timestamp.from(clock.instant()));
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    keys.add(rs.getString("entry_key"));
                }
            }
        } catch (SQLException e) {
            throw new ContextStoreException("Failed to list keys of '" + namespace + "'", e);
        }
        return keys;
    }

    public int purgeExpired() {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(PURGE_SQL)) {
            stmt.setTimestamp(1, Timestamp.from(clock.instant()));
            return stmt.executeUpdate();
        } catch (SQLException e) {
            throw new ContextStoreException("Failed to purge expired entries", e);
        }
    }

    @Override
    public boolean isAvailable() {
        try (Connection conn = dataSource.getConnection()) {
            return conn.isValid(5);
        } catch (SQLException e) {
            log.warn("Context store connection check failed: {}", e.getMessage());
            return false;
        }
    }
}
