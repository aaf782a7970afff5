package com.acme.verify.persistence.jdbc.dlq;

import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;
import javax.sql.DataSource;

/** PostgreSQL-specific implementation of DeadLetterRepository */
@Singleton
@Requires(property = "db.dialect", value = "PostgreSQL")
public class PostgresDeadLetterRepository extends JdbcDeadLetterRepository {

  public PostgresDeadLetterRepository(DataSource dataSource) {
    super(dataSource);
  }

  // A failed INSERT would abort the surrounding transaction on PostgreSQL
  @Override
  protected String getInsertSql() {
    return """
        INSERT INTO verification_dlq
        (message_id, subject, context, request_signal, receive_count, enqueued_at, dead_lettered_at, reason)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?)
        ON CONFLICT (message_id) DO NOTHING
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
