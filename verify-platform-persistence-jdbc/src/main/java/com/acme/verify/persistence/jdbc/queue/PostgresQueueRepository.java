package com.acme.verify.persistence.jdbc.queue;

import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;

import javax.sql.DataSource;

/**
 * PostgreSQL-specific implementation of QueueRepository.
 * Candidate selection skips rows locked by a concurrent claimer instead of waiting on them.
 */
@Singleton
@Requires(property = "db.dialect", value = "PostgreSQL")
public class PostgresQueueRepository extends JdbcQueueRepository {

    public PostgresQueueRepository(DataSource dataSource) {
        super(dataSource);
    }

    @Override
    protected String getInsertSql() {
        return """
                INSERT INTO verification_queue (id, payload, status, receive_count, enqueued_at)
                VALUES (?, ?::jsonb, 'AVAILABLE', 0, ?)
                """;
    }

    @Override
    protected String getFindAvailableIdsSql() {
        return """
                SELECT id FROM verification_queue
                WHERE status = 'AVAILABLE'
                ORDER BY enqueued_at
                LIMIT ? FOR UPDATE SKIP LOCKED
                """;
    }

    @Override
    protected String getClaimSql() {
        return """
                UPDATE verification_queue
                SET status = 'IN_FLIGHT', receipt_handle = ?, visible_until = ?, receive_count = receive_count + 1
                WHERE id = ? AND status = 'AVAILABLE'
                """;
    }

    @Override
    protected String getDeleteInFlightSql() {
        return """
                DELETE FROM verification_queue
                WHERE id = ? AND receipt_handle = ? AND status = 'IN_FLIGHT'
                """;
    }

    @Override
    protected String getFindExpiredIdsSql() {
        return """
                SELECT id FROM verification_queue
                WHERE status = 'IN_FLIGHT' AND visible_until <= ?
                ORDER BY visible_until
                LIMIT ? FOR UPDATE SKIP LOCKED
                """;
    }

    @Override
    protected String getMarkDeadSql() {
        return """
                UPDATE verification_queue
                SET status = 'DEAD'
                WHERE id = ? AND status = 'IN_FLIGHT' AND visible_until <= ?
                """;
    }

    @Override
    protected String getFindDeadIdsSql() {
        return """
                SELECT id FROM verification_queue
                WHERE status = 'DEAD'
                LIMIT ? FOR UPDATE SKIP LOCKED
                """;
    }

    @Override
    protected String getFindByIdSql() {
        return """
                SELECT id, payload::text AS payload, status, receipt_handle, receive_count, enqueued_at, visible_until
                FROM verification_queue
                WHERE id = ?
                """;
    }

    @Override
    protected String getDeleteDeadSql() {
        return "DELETE FROM verification_queue WHERE id = ? AND status = 'DEAD'";
    }
}
