package com.acme.verify.persistence.jdbc.mapper;

import com.acme.verify.events.EventDelivery;
import com.acme.verify.events.StoredEvent;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.UUID;

/** Maps event_store and event_delivery rows. */
public final class EventRowMapper {

    private EventRowMapper() {
    }

    public static StoredEvent toEvent(ResultSet rs) throws SQLException {
        return new StoredEvent(
                rs.getObject("event_id", UUID.class),
                rs.getString("source"),
                rs.getString("detail_type"),
                rs.getString("detail"),
                QueueRowMapper.toInstant(rs.getTimestamp("occurred_at")));
    }

    public static EventDelivery toDelivery(ResultSet rs) throws SQLException {
        return new EventDelivery(
                rs.getLong("id"),
                rs.getObject("event_id", UUID.class),
                rs.getString("subscription"),
                rs.getString("detail"),
                rs.getInt("attempts"));
    }
}
