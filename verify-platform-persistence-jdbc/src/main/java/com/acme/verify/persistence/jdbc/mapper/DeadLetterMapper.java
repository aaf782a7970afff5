package com.acme.verify.persistence.jdbc.mapper;

import com.acme.verify.domain.DeadLetter;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.UUID;

/** Maps verification_dlq rows to {@link DeadLetter}. */
public final class DeadLetterMapper {

    private DeadLetterMapper() {
    }

    public static DeadLetter toDeadLetter(ResultSet rs) throws SQLException {
        return new DeadLetter(
                rs.getObject("message_id", UUID.class),
                rs.getString("subject"),
                rs.getString("context"),
                rs.getString("request_signal"),
                rs.getInt("receive_count"),
                QueueRowMapper.toInstant(rs.getTimestamp("enqueued_at")),
                QueueRowMapper.toInstant(rs.getTimestamp("dead_lettered_at")),
                rs.getString("reason"));
    }
}
