package com.acme.verify.persistence.jdbc.event;

import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;

import javax.sql.DataSource;

/**
 * H2-specific implementation of EventRepository
 */
@Singleton
@Requires(property = "db.dialect", value = "H2")
public class H2EventRepository extends JdbcEventRepository {

    public H2EventRepository(DataSource dataSource) {
        super(dataSource);
    }

    @Override
    protected String getInsertEventSql() {
        return """
                INSERT INTO event_store (event_id, source, detail_type, detail, status, occurred_at)
                VALUES (?, ?, ?, ?, 'NEW', ?)
                """;
    }

    @Override
    protected String getFindUnroutedSql() {
        return """
                SELECT event_id, source, detail_type, detail, occurred_at
                FROM event_store
                WHERE status = 'NEW'
                ORDER BY occurred_at
                LIMIT ?
                """;
    }

    @Override
    protected String getInsertDeliverySql() {
        return """
                INSERT INTO event_delivery (event_id, subscription, detail, status, attempts, next_attempt_at, created_at)
                VALUES (?, ?, ?, 'PENDING', 0, ?, ?)
                """;
    }

    @Override
    protected String getFindDueIdsSql() {
        return """
                SELECT id FROM event_delivery
                WHERE status = 'PENDING' AND next_attempt_at <= ?
                ORDER BY next_attempt_at
                LIMIT ?
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
                SELECT id, event_id, subscription, detail, attempts
                FROM event_delivery
                WHERE id = ?
                """;
    }
}
