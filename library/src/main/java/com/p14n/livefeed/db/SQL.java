package com.p14n.livefeed.db;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.p14n.livefeed.data.Event;
import com.p14n.livefeed.data.EventType;
import com.p14n.livefeed.data.PendingEvent;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;

/**
 * Utility class providing SQL-related constants and helper methods for the
 * pending events table.
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>{@code
 * PreparedStatement stmt = connection.prepareStatement(
 *         "INSERT INTO livefeed.pending_events (" + SQL.CORE_COLS + ") VALUES (" + SQL.CORE_PH + ")");
 * SQL.setEventOnStatement(stmt, event);
 * }</pre>
 */
public class SQL {

    /** Private constructor to prevent instantiation of utility class */
    private SQL() {
    }

    private static final ObjectMapper mapper = new ObjectMapper();

    /** Columns written when an event is appended */
    public static final String CORE_COLS = "id, event_type, payload, tenant_id, emitted_at, traceparent";

    /** Columns read back, including the delivery marker */
    public static final String EXT_COLS = CORE_COLS + ", delivered_at";

    /** Placeholder parameters for core columns; the payload is cast to jsonb */
    public static final String CORE_PH = "?,?,?::jsonb,?,?,?";

    /**
     * Creates a PendingEvent from the current ResultSet row.
     *
     * @param rs ResultSet positioned at the row to map, selected with
     *           {@link #EXT_COLS}
     * @return New PendingEvent populated with the row data
     * @throws SQLException if the row cannot be read or the payload is not valid
     *                      JSON
     */
    public static PendingEvent pendingEventFromResultSet(ResultSet rs) throws SQLException {
        Timestamp delivered = rs.getTimestamp("delivered_at");
        return new PendingEvent(eventFromResultSet(rs), delivered == null ? null : delivered.toInstant());
    }

    public static Event eventFromResultSet(ResultSet rs) throws SQLException {
        String id = rs.getString("id");
        try {
            return Event.create(
                    id,
                    EventType.fromChannel(rs.getString("event_type")),
                    mapper.readTree(rs.getString("payload")),
                    rs.getString("tenant_id"),
                    rs.getTimestamp("emitted_at").toInstant(),
                    rs.getString("traceparent"));
        } catch (JsonProcessingException e) {
            throw new SQLException("Stored payload is not valid JSON for event " + id, e);
        }
    }

    /**
     * Sets the core event columns on a PreparedStatement, in the order of
     * {@link #CORE_COLS}.
     *
     * @param stmt  PreparedStatement to set parameters on
     * @param event Event containing the data to set
     * @throws SQLException if any database access error occurs
     */
    public static void setEventOnStatement(PreparedStatement stmt, Event event) throws SQLException {
        stmt.setString(1, event.id());
        stmt.setString(2, event.type().channel());
        stmt.setString(3, event.payload().toString());
        stmt.setString(4, event.tenantId());
        stmt.setTimestamp(5, Timestamp.from(event.emittedAt()));
        stmt.setString(6, event.traceparent());
    }
}
