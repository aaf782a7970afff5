package com.acme.verify.persistence.jdbc.dlq;

import com.acme.verify.domain.DeadLetter;
import com.acme.verify.persistence.jdbc.ExceptionTranslator;
import com.acme.verify.persistence.jdbc.mapper.DeadLetterMapper;
import com.acme.verify.repository.DeadLetterRepository;
import io.micronaut.transaction.annotation.Transactional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Abstract JDBC implementation of DeadLetterRepository using Template Method pattern.
 * Subclasses override database-specific SQL methods.
 */
public abstract class JdbcDeadLetterRepository implements DeadLetterRepository {

    private static final Logger LOG = LoggerFactory.getLogger(JdbcDeadLetterRepository.class);
    private static final int MAX_REASON_LENGTH = 2000;

    protected final DataSource dataSource;

    protected JdbcDeadLetterRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    @Transactional
    public boolean insertIfAbsent(DeadLetter deadLetter) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(getInsertSql())) {

            ps.setObject(1, deadLetter.getMessageId());
            ps.setString(2, deadLetter.getSubject());
            ps.setString(3, deadLetter.getContext());
            ps.setString(4, deadLetter.getSignal());
            ps.setInt(5, deadLetter.getReceiveCount());
            ps.setTimestamp(6, Timestamp.from(deadLetter.getEnqueuedAt()));
            ps.setTimestamp(7, Timestamp.from(deadLetter.getDeadLetteredAt()));
            ps.setString(8, truncate(deadLetter.getReason()));

            boolean inserted = ps.executeUpdate() == 1;
            LOG.debug("Dead letter insert: messageId={}, inserted={}", deadLetter.getMessageId(), inserted);
            return inserted;

        } catch (SQLException e) {
            if (ExceptionTranslator.isUniqueViolation(e)) {
                LOG.debug("Dead letter already present: messageId={}", deadLetter.getMessageId());
                return false;
            }
            throw ExceptionTranslator.translateException(e, "insert dead letter", LOG);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<DeadLetter> findRecent(int limit) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(getFindRecentSql())) {

            ps.setInt(1, limit);
            List<DeadLetter> results = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    results.add(DeadLetterMapper.toDeadLetter(rs));
                }
            }
            return results;

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "list dead letters", LOG);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<DeadLetter> findById(UUID messageId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(getFindByIdSql())) {

            ps.setObject(1, messageId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(DeadLetterMapper.toDeadLetter(rs));
                }
            }
            return Optional.empty();

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "find dead letter", LOG);
        }
    }

    @Override
    @Transactional
    public boolean delete(UUID messageId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement("DELETE FROM verification_dlq WHERE message_id = ?")) {

            ps.setObject(1, messageId);
            return ps.executeUpdate() == 1;

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "delete dead letter", LOG);
        }
    }

    @Override
    @Transactional
    public int deleteOlderThan(Instant cutoff) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(
                     "DELETE FROM verification_dlq WHERE dead_lettered_at < ?")) {

            ps.setTimestamp(1, Timestamp.from(cutoff));
            return ps.executeUpdate();

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "purge expired dead letters", LOG);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public long count() {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement("SELECT COUNT(*) FROM verification_dlq");
             ResultSet rs = ps.executeQuery()) {

            return rs.next() ? rs.getLong(1) : 0L;

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "count dead letters", LOG);
        }
    }

    private static String truncate(String reason) {
        if (reason == null || reason.length() <= MAX_REASON_LENGTH) {
            return reason;
        }
        return reason.substring(0, MAX_REASON_LENGTH);
    }

    // Template methods for database-specific SQL

    protected abstract String getInsertSql();

    protected abstract String getFindRecentSql();

    protected abstract String getFindByIdSql();
}
