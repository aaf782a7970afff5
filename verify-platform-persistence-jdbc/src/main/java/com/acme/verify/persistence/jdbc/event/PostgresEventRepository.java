package com.acme.verify.persistence.jdbc.event;

import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;

import javax.sql.DataSource;

/**
 * PostgreSQL-specific implementation of EventRepository using jsonb detail columns and
 * {@code ON CONFLICT} for idempotent fan-out.
 */
@Singleton
@Requires(property = "db.dialect", value = "PostgreSQL")
public class PostgresEventRepository extends JdbcEventRepository {

    public PostgresEventRepository(DataSource dataSource) {
        super(dataSource);
    }

    @Override
    protected String getInsertEventSql() {
        return """
                INSERT INTO event_store (event_id, source, detail_type, detail, status, occurred_at)
                VALUES (?, ?, ?, ?::jsonb, 'NEW', ?)
                """;
    }

    @Override
    protected String getFindUnroutedSql() {
        return """
                SELECT event_id, source, detail_type, detail::text AS detail, occurred_at
                FROM event_store
                WHERE status = 'NEW'
                ORDER BY occurred_at
                LIMIT ? FOR UPDATE SKIP LOCKED
                """;
    }

    @Override
    protected String getInsertDeliverySql() {
        return """
                INSERT INTO event_delivery (event_id, subscription, detail, status, attempts, next_attempt_at, created_at)
                VALUES (?, ?, ?::jsonb, 'PENDING', 0, ?, ?)
                ON CONFLICT (event_id, subscription) DO NOTHING
                """;
    }

    @Override
    protected String getFindDueIdsSql() {
        return """
                SELECT id FROM event_delivery
                WHERE status = 'PENDING' AND next_attempt_at <= ?
                ORDER BY next_attempt_at
                LIMIT ? FOR UPDATE SKIP LOCKED
                """;
    }

    @Override
    protected String getClaimDeliverySql() {
        return """
                UPDATE event_delivery
                SET status = 'IN_PROGRESS', attempts = attempts + 1, claimed_at = ?
                WHERE id = ? AND status = 'PENDING'
                """;
    }

    @Override
    protected String getFindDeliverySql() {
        return """
                SELECT id, event_id, subscription, detail::text AS detail, attempts
                FROM event_delivery
                WHERE id = ?
                """;
    }
}
