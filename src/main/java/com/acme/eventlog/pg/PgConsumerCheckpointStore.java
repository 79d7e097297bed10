package com.acme.eventlog.pg;

import com.acme.eventlog.core.TransientStoreException;
import com.acme.eventlog.spi.ConsumerCheckpointStore;
import io.micronaut.data.connection.ConnectionOperations;
import io.micronaut.transaction.TransactionOperations;
import jakarta.inject.Singleton;
import java.sql.*;
import java.util.*;

@Singleton
public class PgConsumerCheckpointStore implements ConsumerCheckpointStore {
    private final ConnectionOperations<Connection> connectionOps;
    private final TransactionOperations<Connection> transactionOps;

    public PgConsumerCheckpointStore(ConnectionOperations<Connection> connectionOps,
                                     TransactionOperations<Connection> transactionOps) {
        this.connectionOps = connectionOps;
        this.transactionOps = transactionOps;
    }

    @Override
    public Consumer upsert(String name) {
        return connectionOps.executeWrite(status -> {
            try (var ps = status.getConnection().prepareStatement(
                "INSERT INTO consumer(name) VALUES (?) " +
                "ON CONFLICT (name) DO UPDATE SET updated_at = now() " +
                "RETURNING name, checkpoint, topics, updated_at")) {
                ps.setString(1, name);
                try (var rs = ps.executeQuery()) {
                    rs.next();
                    return mapRow(rs);
                }
            } catch (SQLException e) {
                throw new TransientStoreException("Failed to upsert consumer " + name, e);
            }
        });
    }

    @Override
    public boolean advanceCheckpoint(String name, long newCheckpoint) {
        // the UPDATE row lock serializes racing instances of the same consumer
        return transactionOps.executeWrite(status -> {
            try (var ps = status.getConnection().prepareStatement(
                "UPDATE consumer SET checkpoint = GREATEST(checkpoint, ?), updated_at = now() WHERE name = ?")) {
                ps.setLong(1, newCheckpoint);
                ps.setString(2, name);
                return ps.executeUpdate() > 0;
            } catch (SQLException e) {
                throw new TransientStoreException("Failed to advance checkpoint of " + name, e);
            }
        });
    }

    @Override
    public OptionalLong minCheckpoint() {
        return connectionOps.executeRead(status -> {
            try (var ps = status.getConnection().prepareStatement("SELECT min(checkpoint) FROM consumer");
                 var rs = ps.executeQuery()) {
                rs.next();
                long min = rs.getLong(1);
                return rs.wasNull() ? OptionalLong.empty() : OptionalLong.of(min);
            } catch (SQLException e) {
                throw new TransientStoreException("Failed to compute minimum checkpoint", e);
            }
        });
    }

    @Override
    public boolean subscribe(String name, Set<String> topics) {
        return connectionOps.executeWrite(status -> {
            Connection conn = status.getConnection();
            try (var ps = conn.prepareStatement(
                "UPDATE consumer SET topics = ?, updated_at = now() WHERE name = ?")) {
                ps.setArray(1, conn.createArrayOf("text", new TreeSet<>(topics).toArray(new String[0])));
                ps.setString(2, name);
                return ps.executeUpdate() > 0;
            } catch (SQLException e) {
                throw new TransientStoreException("Failed to update topics of " + name, e);
            }
        });
    }

    private Consumer mapRow(ResultSet rs) throws SQLException {
        Array topics = rs.getArray(3);
        Timestamp updatedAt = rs.getTimestamp(4);
        return new Consumer(
            rs.getString(1),
            rs.getLong(2),
            topics != null ? Set.copyOf(Arrays.asList((String[]) topics.getArray())) : Set.of(WILDCARD),
            updatedAt != null ? updatedAt.toInstant() : null
        );
    }
}
