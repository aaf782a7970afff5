package com.acme.verify.persistence.jdbc.dlq;

import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;

import javax.sql.DataSource;

/**
 * H2-specific implementation of DeadLetterRepository. A duplicate insert fails on the primary key
 * and is reported as "already present" by the base class.
 */
@Singleton
@Requires(property = "db.dialect", value = "H2")
public class H2DeadLetterRepository extends JdbcDeadLetterRepository {

    public H2DeadLetterRepository(DataSource dataSource) {
        super(dataSource);
    }

    @Override
    protected String getInsertSql() {
        return """
                INSERT INTO verification_dlq
                (message_id, subject, context, request_signal, receive_count, enqueued_at, dead_lettered_at, reason)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?)
                """;
    }

    @Override
    protected String getFindRecentSql() {
        return """
                SELECT message_id, subject, context, request_signal, receive_count, enqueued_at, dead_lettered_at, reason
                FROM verification_dlq
                ORDER BY dead_lettered_at DESC
                LIMIT ?
                """;
    }

    @Override
    protected String getFindByIdSql() {
        return """
                SELECT message_id, subject, context, request_signal, receive_count, enqueued_at, dead_lettered_at, reason
                FROM verification_dlq
                WHERE message_id = ?
                """;
    }
}
