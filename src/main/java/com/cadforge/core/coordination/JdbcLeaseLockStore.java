package com.cadforge.core.coordination;

import com.cadforge.core.error.AlreadyLockedException;
import com.cadforge.core.error.LockStoreException;
import com.cadforge.core.model.ResourceLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * JDBC-backed {@link LeaseLockStore} shared by every process pointing at the
 * same database.
 * <p>
 * Leases live in {@code cadforge_resource_locks}, one row per
 * {@code (resource_type, resource_name)}. Acquisition runs in one transaction:
 * delete the expired row for the resource, read the remaining row with
 * {@code FOR UPDATE}, then insert or renew. A concurrent insert of the same
 * resource surfaces as a primary-key violation and is reported as
 * {@link AlreadyLockedException}.
 * <p>
 * Timestamps are stored as epoch milliseconds so that expiry comparisons do not
 * depend on the database time zone.
 */
public class JdbcLeaseLockStore implements LeaseLockStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcLeaseLockStore.class);

    static final String TABLE_NAME = "cadforge_resource_locks";

    private static final String UNIQUE_VIOLATION = "23505";

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                resource_type  VARCHAR(255) NOT NULL,
                resource_name  VARCHAR(255) NOT NULL,
                holder_id      VARCHAR(255) NOT NULL,
                session_id     VARCHAR(255),
                acquired_at_ms BIGINT NOT NULL,
                expires_at_ms  BIGINT NOT NULL,
                PRIMARY KEY (resource_type, resource_name)
            )
            """.formatted(TABLE_NAME);

    private static final String DELETE_EXPIRED_ONE_SQL = """
            DELETE FROM %s
            WHERE resource_type = ? AND resource_name = ? AND expires_at_ms <= ?
            """.formatted(TABLE_NAME);

    private static final String SELECT_FOR_UPDATE_SQL = """
            SELECT resource_type, resource_name, holder_id, session_id, acquired_at_ms, expires_at_ms
            FROM %s
            WHERE resource_type = ? AND resource_name = ?
            FOR UPDATE
            """.formatted(TABLE_NAME);

    private static final String INSERT_SQL = """
            INSERT INTO %s (resource_type, resource_name, holder_id, session_id, acquired_at_ms, expires_at_ms)
            VALUES (?, ?, ?, ?, ?, ?)
            """.formatted(TABLE_NAME);

    private static final String RENEW_SQL = """
            UPDATE %s
            SET session_id = ?, expires_at_ms = ?
            WHERE resource_type = ? AND resource_name = ? AND holder_id = ?
            """.formatted(TABLE_NAME);

    private static final String DELETE_HELD_SQL = """
            DELETE FROM %s
            WHERE resource_type = ? AND resource_name = ? AND holder_id = ?
            """.formatted(TABLE_NAME);

    private static final String SELECT_LIVE_SQL = """
            SELECT resource_type, resource_name, holder_id, session_id, acquired_at_ms, expires_at_ms
            FROM %s
            WHERE resource_type = ? AND resource_name = ? AND expires_at_ms > ?
            """.formatted(TABLE_NAME);

    private static final String SELECT_ALL_LIVE_SQL = """
            SELECT resource_type, resource_name, holder_id, session_id, acquired_at_ms, expires_at_ms
            FROM %s
            WHERE expires_at_ms > ?
            ORDER BY resource_type, resource_name
            """.formatted(TABLE_NAME);

    private static final String DELETE_ALL_EXPIRED_SQL = """
            DELETE FROM %s WHERE expires_at_ms <= ?
            """.formatted(TABLE_NAME);

    private final DataSource dataSource;

    public JdbcLeaseLockStore(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
    }

    /**
     * Creates the lock table if it does not already exist.
     * Should be called once during application startup.
     */
    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(CREATE_TABLE_SQL)) {
            stmt.execute();
            log.info("Lock table '{}' ensured", TABLE_NAME);
        }
    }

    @Override
    public ResourceLock acquire(String resourceType, String resourceName, String holderId, String sessionId,
                                Instant now, Duration ttl) {
        long nowMs = now.toEpochMilli();
        long expiresMs = now.plus(ttl).toEpochMilli();

        try (Connection conn = dataSource.getConnection()) {
            boolean autoCommit = conn.getAutoCommit();
            conn.setAutoCommit(false);
            try {
                ResourceLock granted = acquireInTransaction(conn, resourceType, resourceName, holderId, sessionId,
                        now, nowMs, expiresMs);
                conn.commit();
                return granted;
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(autoCommit);
            }
        } catch (SQLException e) {
            if (UNIQUE_VIOLATION.equals(e.getSQLState())) {
                // lost an insert race; report whoever won
                Optional<ResourceLock> held = find(resourceType, resourceName, now);
                if (held.isPresent()) {
                    throw new AlreadyLockedException(held.get());
                }
                throw new LockStoreException(
                        "Lease on " + resourceType + "/" + resourceName + " changed hands concurrently", e);
            }
            log.error("Failed to acquire lease on {}/{} for '{}'", resourceType, resourceName, holderId, e);
            throw new LockStoreException("Failed to acquire lease on " + resourceType + "/" + resourceName, e);
        }
    }

    private ResourceLock acquireInTransaction(Connection conn, String resourceType, String resourceName,
                                              String holderId, String sessionId, Instant now,
                                              long nowMs, long expiresMs) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(DELETE_EXPIRED_ONE_SQL)) {
            stmt.setString(1, resourceType);
            stmt.setString(2, resourceName);
            stmt.setLong(3, nowMs);
            int purged = stmt.executeUpdate();
            if (purged > 0) {
                log.debug("Purged expired lease on {}/{}", resourceType, resourceName);
            }
        }

        ResourceLock existing = null;
        try (PreparedStatement stmt = conn.prepareStatement(SELECT_FOR_UPDATE_SQL)) {
            stmt.setString(1, resourceType);
            stmt.setString(2, resourceName);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    existing = fromResultSet(rs);
                }
            }
        }

        if (existing != null && !existing.isHeldBy(holderId)) {
            throw new AlreadyLockedException(existing);
        }

        if (existing != null) {
            String session = sessionId != null ? sessionId : existing.sessionId();
            try (PreparedStatement stmt = conn.prepareStatement(RENEW_SQL)) {
                stmt.setString(1, session);
                stmt.setLong(2, expiresMs);
                stmt.setString(3, resourceType);
                stmt.setString(4, resourceName);
                stmt.setString(5, holderId);
                stmt.executeUpdate();
            }
            return new ResourceLock(resourceType, resourceName, holderId, session,
                    existing.acquiredAt(), Instant.ofEpochMilli(expiresMs));
        }

        try (PreparedStatement stmt = conn.prepareStatement(INSERT_SQL)) {
            stmt.setString(1, resourceType);
            stmt.setString(2, resourceName);
            stmt.setString(3, holderId);
            stmt.setString(4, sessionId);
            stmt.setLong(5, nowMs);
            stmt.setLong(6, expiresMs);
            stmt.executeUpdate();
        }
        return new ResourceLock(resourceType, resourceName, holderId, sessionId,
                Instant.ofEpochMilli(nowMs), Instant.ofEpochMilli(expiresMs));
    }

    @Override
    public boolean release(String resourceType, String resourceName, String holderId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(DELETE_HELD_SQL)) {
            stmt.setString(1, resourceType);
            stmt.setString(2, resourceName);
            stmt.setString(3, holderId);
            return stmt.executeUpdate() > 0;
        } catch (SQLException e) {
            log.error("Failed to release lease on {}/{} for '{}'", resourceType, resourceName, holderId, e);
            throw new LockStoreException("Failed to release lease on " + resourceType + "/" + resourceName, e);
        }
    }

    @Override
    public Optional<ResourceLock> find(String resourceType, String resourceName, Instant now) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_LIVE_SQL)) {
            stmt.setString(1, resourceType);
            stmt.setString(2, resourceName);
            stmt.setLong(3, now.toEpochMilli());
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(fromResultSet(rs));
                }
            }
        } catch (SQLException e) {
            log.error("Failed to read lease on {}/{}", resourceType, resourceName, e);
            throw new LockStoreException("Failed to read lease on " + resourceType + "/" + resourceName, e);
        }
        return Optional.empty();
    }

    @Override
    public List<ResourceLock> list(Instant now) {
        List<ResourceLock> locks = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_ALL_LIVE_SQL)) {
            stmt.setLong(1, now.toEpochMilli());
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    locks.add(fromResultSet(rs));
                }
            }
        } catch (SQLException e) {
            log.error("Failed to list leases", e);
            throw new LockStoreException("Failed to list leases", e);
        }
        return locks;
    }

    @Override
    public int purgeExpired(Instant now) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(DELETE_ALL_EXPIRED_SQL)) {
            stmt.setLong(1, now.toEpochMilli());
            return stmt.executeUpdate();
        } catch (SQLException e) {
            log.error("Failed to purge expired leases", e);
            throw new LockStoreException("Failed to purge expired leases", e);
        }
    }

    @Override
    public String describe() {
        return "JDBC lease store (table " + TABLE_NAME + ")";
    }

    @Override
    public boolean isAvailable() {
        try (Connection conn = dataSource.getConnection()) {
            return conn.isValid(5);
        } catch (SQLException e) {
            log.warn("Lock store connection check failed: {}", e.getMessage());
            return false;
        }
    }

    private static ResourceLock fromResultSet(ResultSet rs) throws SQLException {
        return new ResourceLock(
                rs.getString("resource_type"),
                rs.getString("resource_name"),
                rs.getString("holder_id"),
                rs.getString("session_id"),
                Instant.ofEpochMilli(rs.getLong("acquired_at_ms")),
                Instant.ofEpochMilli(rs.getLong("expires_at_ms")));
    }
}
