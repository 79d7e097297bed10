package com.acme.eventlog.pg;

import com.acme.eventlog.core.TransientStoreException;
import com.acme.eventlog.spi.EventLog;
import io.micronaut.data.connection.ConnectionOperations;
import io.micronaut.transaction.TransactionOperations;
import io.micronaut.transaction.TransactionStatus;
import jakarta.inject.Singleton;
import java.sql.*;
import java.util.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * EventLog on a PostgreSQL {@code event} table.
 * - Cursor scans and watermark deletes run as single statements on their own connection
 * - append, claims and deleteOne join the caller's transaction and refuse to run without one
 * - Claims never wait: NOWAIT for targeted claims, SKIP LOCKED for opportunistic ones
 */
@Singleton
public class PgEventLog implements EventLog {
    private static final Logger LOG = LoggerFactory.getLogger(PgEventLog.class);
    private static final String LOCK_NOT_AVAILABLE = "55P03";
    private static final String COLUMNS = "id, object_type, event_type, payload, created_at";

    private final ConnectionOperations<Connection> connectionOps;
    private final TransactionOperations<Connection> transactionOps;

    public PgEventLog(ConnectionOperations<Connection> connectionOps, TransactionOperations<Connection> transactionOps) {
        this.connectionOps = connectionOps;
        this.transactionOps = transactionOps;
    }

    @Override
    public Event append(String objectType, String eventType, String payload) {
        Connection conn = (Connection) requireTransaction("append").getConnection();
        try (var ps = conn.prepareStatement(
            "INSERT INTO event(object_type, event_type, payload) VALUES (?,?,?::jsonb) RETURNING " + COLUMNS)) {
            ps.setString(1, objectType);
            ps.setString(2, eventType);
            ps.setString(3, payload);
            try (var rs = ps.executeQuery()) {
                rs.next();
                return mapRow(rs);
            }
        } catch (SQLException e) {
            throw new TransientStoreException("Failed to append " + eventType + " event", e);
        }
    }

    @Override
    public List<Event> scanSince(long checkpoint, int limit) {
        return connectionOps.executeRead(status -> {
            try (var ps = status.getConnection().prepareStatement(
                "SELECT " + COLUMNS + " FROM event WHERE id > ? ORDER BY id LIMIT ?")) {
                ps.setLong(1, checkpoint);
                ps.setInt(2, limit);
                try (var rs = ps.executeQuery()) {
                    List<Event> result = new ArrayList<>();
                    while (rs.next()) {
                        result.add(mapRow(rs));
                    }
                    return result;
                }
            } catch (SQLException e) {
                throw new TransientStoreException("Failed to scan events after " + checkpoint, e);
            }
        });
    }

    @Override
    public Optional<Event> claimOne(long targetId) {
        TransactionStatus<?> status = requireTransaction("claimOne");
        Connection conn = (Connection) status.getConnection();
        try (var ps = conn.prepareStatement(
            "SELECT " + COLUMNS + " FROM event WHERE id = ? FOR UPDATE NOWAIT")) {
            ps.setLong(1, targetId);
            try (var rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapRow(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            if (LOCK_NOT_AVAILABLE.equals(e.getSQLState())) {
                // the failed statement poisons the transaction; it can only roll back now
                LOG.debug("Event {} is already claimed elsewhere", targetId);
                status.setRollbackOnly();
                return Optional.empty();
            }
            throw new TransientStoreException("Failed to claim event " + targetId, e);
        }
    }

    @Override
    public Optional<Event> claimOne() {
        Connection conn = (Connection) requireTransaction("claimOne").getConnection();
        try (var ps = conn.prepareStatement(
            "SELECT " + COLUMNS + " FROM event ORDER BY id LIMIT 1 FOR UPDATE SKIP LOCKED")) {
            try (var rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapRow(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new TransientStoreException("Failed to claim next event", e);
        }
    }

    @Override
    public long deleteUpTo(long watermark) {
        return connectionOps.executeWrite(status -> {
            try (var ps = status.getConnection().prepareStatement("DELETE FROM event WHERE id <= ?")) {
                ps.setLong(1, watermark);
                return ps.executeLargeUpdate();
            } catch (SQLException e) {
                throw new TransientStoreException("Failed to truncate events up to " + watermark, e);
            }
        });
    }

    @Override
    public boolean deleteOne(long id) {
        Connection conn = (Connection) requireTransaction("deleteOne").getConnection();
        try (var ps = conn.prepareStatement("DELETE FROM event WHERE id = ?")) {
            ps.setLong(1, id);
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new TransientStoreException("Failed to delete event " + id, e);
        }
    }

    private TransactionStatus<?> requireTransaction(String operation) {
        return transactionOps.findTransactionStatus()
            .orElseThrow(() -> new IllegalStateException(operation + " requires an active transaction"));
    }

    private Event mapRow(ResultSet rs) throws SQLException {
        Timestamp createdAt = rs.getTimestamp(5);
        return new Event(
            rs.getLong(1),
            rs.getString(2),
            rs.getString(3),
            rs.getString(4),
            createdAt != null ? createdAt.toInstant() : null
        );
    }
}
