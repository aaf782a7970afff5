package com.acme.verify.persistence.jdbc.mapper;

import com.acme.verify.core.Jsons;
import com.acme.verify.domain.QueuedMessage;
import com.acme.verify.domain.VerificationRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.UUID;

/** Maps verification_queue rows to {@link QueuedMessage}. */
public final class QueueRowMapper {

    private static final Logger LOG = LoggerFactory.getLogger(QueueRowMapper.class);

    private QueueRowMapper() {
    }

    public static QueuedMessage toMessage(ResultSet rs) throws SQLException {
        return new QueuedMessage(
                rs.getObject("id", UUID.class),
                rs.getString("receipt_handle"),
                toRequest(rs.getString("payload")),
                rs.getInt("receive_count"),
                toInstant(rs.getTimestamp("enqueued_at")),
                toInstant(rs.getTimestamp("visible_until")));
    }

    /**
     * Payloads are stored as received, so a request that fails to parse is still delivered; the
     * worker rejects it as invalid input.
     */
    static VerificationRequest toRequest(String payload) {
        try {
            return Jsons.fromJson(payload, VerificationRequest.class);
        } catch (IllegalArgumentException e) {
            LOG.warn("Unreadable queue payload, delivering as empty request: {}", e.getMessage());
            return new VerificationRequest(null, null, null);
        }
    }

    static Instant toInstant(Timestamp ts) {
        return ts == null ? null : ts.toInstant();
    }
}
