package com.acme.verify.persistence.jdbc.event;

import com.acme.verify.events.EventDelivery;
import com.acme.verify.events.StoredEvent;
import com.acme.verify.persistence.jdbc.ExceptionTranslator;
import com.acme.verify.persistence.jdbc.mapper.EventRowMapper;
import com.acme.verify.repository.EventRepository;
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
import java.util.UUID;

/**
 * Abstract JDBC implementation of EventRepository using Template Method pattern.
 * Events are written once; each (event, subscription) pair gets its own delivery row with its own
 * attempt counter and schedule.
 */
public abstract class JdbcEventRepository implements EventRepository {

    private static final Logger LOG = LoggerFactory.getLogger(JdbcEventRepository.class);
    private static final int MAX_ERROR_LENGTH = 2000;

    protected final DataSource dataSource;

    protected JdbcEventRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    @Transactional
    public void insertEvent(StoredEvent event) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(getInsertEventSql())) {

            ps.setObject(1, event.eventId());
            ps.setString(2, event.source());
            ps.setString(3, event.detailType());
            ps.setString(4, event.detailJson());
            ps.setTimestamp(5, Timestamp.from(event.occurredAt()));
            ps.executeUpdate();
            LOG.debug("Stored event: eventId={}, detailType={}", event.eventId(), event.detailType());

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "store event", LOG);
        }
    }

    @Override
    @Transactional
    public List<StoredEvent> findUnrouted(int max) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(getFindUnroutedSql())) {

            ps.setInt(1, max);
            List<StoredEvent> results = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    results.add(EventRowMapper.toEvent(rs));
                }
            }
            return results;

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "find unrouted events", LOG);
        }
    }

    @Override
    @Transactional
    public boolean insertDeliveryIfAbsent(StoredEvent event, String subscription, Instant now) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(getInsertDeliverySql())) {

            ps.setObject(1, event.eventId());
            ps.setString(2, subscription);
            ps.setString(3, event.detailJson());
            ps.setTimestamp(4, Timestamp.from(now));
            ps.setTimestamp(5, Timestamp.from(now));
            return ps.executeUpdate() == 1;

        } catch (SQLException e) {
            if (ExceptionTranslator.isUniqueViolation(e)) {
                return false;
            }
            throw ExceptionTranslator.translateException(e, "create event delivery", LOG);
        }
    }

    @Override
    @Transactional
    public void markRouted(UUID eventId, Instant now) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(
                     "UPDATE event_store SET status = 'ROUTED', routed_at = ? WHERE event_id = ?")) {

            ps.setTimestamp(1, Timestamp.from(now));
            ps.setObject(2, eventId);
            if (ps.executeUpdate() == 0) {
                LOG.warn("No rows updated for markRouted: eventId={}", eventId);
            }

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "mark event routed", LOG);
        }
    }

    @Override
    @Transactional
    public List<EventDelivery> claimDue(int max, Instant now) {
        try (Connection conn = dataSource.getConnection()) {
            List<Long> candidates = new ArrayList<>();
            try (PreparedStatement ps = conn.prepareStatement(getFindDueIdsSql())) {
                ps.setTimestamp(1, Timestamp.from(now));
                ps.setInt(2, max);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        candidates.add(rs.getLong(1));
                    }
                }
            }

            List<EventDelivery> claimed = new ArrayList<>();
            for (Long id : candidates) {
                try (PreparedStatement ps = conn.prepareStatement(getClaimDeliverySql())) {
                    ps.setTimestamp(1, Timestamp.from(now));
                    ps.setLong(2, id);
                    if (ps.executeUpdate() == 0) {
                        continue;
                    }
                }
                try (PreparedStatement ps = conn.prepareStatement(getFindDeliverySql())) {
                    ps.setLong(1, id);
                    try (ResultSet rs = ps.executeQuery()) {
                        if (rs.next()) {
                            claimed.add(EventRowMapper.toDelivery(rs));
                        }
                    }
                }
            }
            return claimed;

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "claim due deliveries", LOG);
        }
    }

    @Override
    @Transactional
    public void markDelivered(long deliveryId, Instant now) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement("""
                     UPDATE event_delivery
                     SET status = 'DELIVERED', delivered_at = ?, last_error = NULL
                     WHERE id = ?
                     """)) {

            ps.setTimestamp(1, Timestamp.from(now));
            ps.setLong(2, deliveryId);
            if (ps.executeUpdate() == 0) {
                LOG.warn("No rows updated for markDelivered: id={}", deliveryId);
            }

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "mark delivery delivered", LOG);
        }
    }

    @Override
    @Transactional
    public void reschedule(long deliveryId, String error, Instant nextAttemptAt) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement("""
                     UPDATE event_delivery
                     SET status = 'PENDING', last_error = ?, next_attempt_at = ?, claimed_at = NULL
                     WHERE id = ?
                     """)) {

            ps.setString(1, truncate(error));
            ps.setTimestamp(2, Timestamp.from(nextAttemptAt));
            ps.setLong(3, deliveryId);
            if (ps.executeUpdate() == 0) {
                LOG.warn("No rows updated for reschedule: id={}", deliveryId);
            }

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "reschedule delivery", LOG);
        }
    }

    @Override
    @Transactional
    public void park(long deliveryId, String error, Instant now) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement("""
                     UPDATE event_delivery
                     SET status = 'PARKED', last_error = ?, parked_at = ?
                     WHERE id = ?
                     """)) {

            ps.setString(1, truncate(error));
            ps.setTimestamp(2, Timestamp.from(now));
            ps.setLong(3, deliveryId);
            if (ps.executeUpdate() == 0) {
                LOG.warn("No rows updated for park: id={}", deliveryId);
            }

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "park delivery", LOG);
        }
    }

    @Override
    @Transactional
    public int recoverStuck(Instant claimedBefore) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement("""
                     UPDATE event_delivery
                     SET status = 'PENDING', claimed_at = NULL
                     WHERE status = 'IN_PROGRESS' AND claimed_at < ?
                     """)) {

            ps.setTimestamp(1, Timestamp.from(claimedBefore));
            return ps.executeUpdate();

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "recover stuck deliveries", LOG);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public long countDeliveries(String status) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(
                     "SELECT COUNT(*) FROM event_delivery WHERE status = ?")) {

            ps.setString(1, status);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0L;
            }

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "count deliveries", LOG);
        }
    }

    private static String truncate(String error) {
        if (error == null || error.length() <= MAX_ERROR_LENGTH) {
            return error;
        }
        return error.substring(0, MAX_ERROR_LENGTH);
    }

    // Template methods for database-specific SQL

    protected abstract String getInsertEventSql();

    protected abstract String getFindUnroutedSql();

    protected abstract String getInsertDeliverySql();

    protected abstract String getFindDueIdsSql();

    protected abstract String getClaimDeliverySql();

    protected abstract String getFindDeliverySql();
}
