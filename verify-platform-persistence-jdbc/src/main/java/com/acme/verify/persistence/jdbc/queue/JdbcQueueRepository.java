package com.acme.verify.persistence.jdbc.queue;

import com.acme.verify.core.Jsons;
import com.acme.verify.domain.QueueStatus;
import com.acme.verify.domain.QueuedMessage;
import com.acme.verify.domain.VerificationRequest;
import com.acme.verify.persistence.jdbc.ExceptionTranslator;
import com.acme.verify.persistence.jdbc.mapper.QueueRowMapper;
import com.acme.verify.repository.QueueRepository;
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
 * Abstract JDBC implementation of QueueRepository using Template Method pattern.
 * Every state change is a conditional UPDATE on the current status, so an ack and a dead-letter
 * move racing for the same message cannot both succeed.
 */
public abstract class JdbcQueueRepository implements QueueRepository {

    private static final Logger LOG = LoggerFactory.getLogger(JdbcQueueRepository.class);

    protected final DataSource dataSource;

    protected JdbcQueueRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    @Transactional
    public void insert(UUID messageId, VerificationRequest request, Instant enqueuedAt) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(getInsertSql())) {

            ps.setObject(1, messageId);
            ps.setString(2, Jsons.toJson(request));
            ps.setTimestamp(3, Timestamp.from(enqueuedAt));
            ps.executeUpdate();
            LOG.debug("Enqueued message: messageId={}", messageId);

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "enqueue verification request", LOG);
        }
    }

    @Override
    @Transactional
    public List<UUID> findAvailableIds(int max) {
        return findIds(getFindAvailableIdsSql(), "find available messages", ps -> ps.setInt(1, max));
    }

    @Override
    @Transactional
    public Optional<QueuedMessage> claim(UUID messageId, String receiptHandle, Instant visibleUntil) {
        try (Connection conn = dataSource.getConnection()) {
            try (PreparedStatement ps = conn.prepareStatement(getClaimSql())) {
                ps.setString(1, receiptHandle);
                ps.setTimestamp(2, Timestamp.from(visibleUntil));
                ps.setObject(3, messageId);
                if (ps.executeUpdate() == 0) {
                    return Optional.empty();
                }
            }
            return selectById(conn, messageId);

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "claim message", LOG);
        }
    }

    @Override
    @Transactional
    public boolean deleteInFlight(UUID messageId, String receiptHandle) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(getDeleteInFlightSql())) {

            ps.setObject(1, messageId);
            ps.setString(2, receiptHandle);
            return ps.executeUpdate() == 1;

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "acknowledge message", LOG);
        }
    }

    @Override
    @Transactional
    public List<UUID> findExpiredIds(Instant now, int max) {
        return findIds(getFindExpiredIdsSql(), "find expired messages", ps -> {
            ps.setTimestamp(1, Timestamp.from(now));
            ps.setInt(2, max);
        });
    }

    @Override
    @Transactional
    public boolean markDead(UUID messageId, Instant now) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(getMarkDeadSql())) {

            ps.setObject(1, messageId);
            ps.setTimestamp(2, Timestamp.from(now));
            return ps.executeUpdate() == 1;

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "mark message dead", LOG);
        }
    }

    @Override
    @Transactional
    public List<UUID> findDeadIds(int max) {
        return findIds(getFindDeadIdsSql(), "find dead messages", ps -> ps.setInt(1, max));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<QueuedMessage> findById(UUID messageId) {
        try (Connection conn = dataSource.getConnection()) {
            return selectById(conn, messageId);
        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "find message by id", LOG);
        }
    }

    @Override
    @Transactional
    public void deleteDead(UUID messageId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(getDeleteDeadSql())) {

            ps.setObject(1, messageId);
            if (ps.executeUpdate() == 0) {
                LOG.warn("No DEAD row deleted: messageId={}", messageId);
            }

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "delete dead message", LOG);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public long countByStatus(QueueStatus status) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(
                     "SELECT COUNT(*) FROM verification_queue WHERE status = ?")) {

            ps.setString(1, status.name());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0L;
            }

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "count messages", LOG);
        }
    }

    private Optional<QueuedMessage> selectById(Connection conn, UUID messageId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(getFindByIdSql())) {
            ps.setObject(1, messageId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(QueueRowMapper.toMessage(rs));
                }
                return Optional.empty();
            }
        }
    }

    private List<UUID> findIds(String sql, String operation, StatementBinder binder) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            binder.bind(ps);
            List<UUID> ids = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    ids.add(rs.getObject(1, UUID.class));
                }
            }
            return ids;

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, operation, LOG);
        }
    }

    @FunctionalInterface
    private interface StatementBinder {
        void bind(PreparedStatement ps) throws SQLException;
    }

    // Template methods for database-specific SQL

    protected abstract String getInsertSql();

    protected abstract String getFindAvailableIdsSql();

    protected abstract String getClaimSql();

    protected abstract String getDeleteInFlightSql();

    protected abstract String getFindExpiredIdsSql();

    protected abstract String getMarkDeadSql();

    protected abstract String getFindDeadIdsSql();

    protected abstract String getFindByIdSql();

    protected abstract String getDeleteDeadSql();
}
