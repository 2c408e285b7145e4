package com.p14n.livefeed.eventlog;

import com.p14n.livefeed.data.Event;
import com.p14n.livefeed.data.PendingEvent;
import com.p14n.livefeed.db.SQL;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Durable append-only record of emitted events, backed by
 * {@code livefeed.pending_events}.
 *
 * <p>
 * Rows are only ever inserted, stamped once with a delivery time, and deleted
 * by {@link #deleteDeliveredBefore(Instant)}. A row whose delivery time is null
 * is never deleted.
 * </p>
 */
public class EventLog {

    private static final Logger logger = LoggerFactory.getLogger(EventLog.class);

    private static final String TABLE = "livefeed.pending_events";

    private final DataSource ds;
    private final Clock clock;

    public EventLog(DataSource ds) {
        this(ds, Clock.systemUTC());
    }

    public EventLog(DataSource ds, Clock clock) {
        this.ds = ds;
        this.clock = clock;
    }

    /**
     * Appends an event using the caller's connection, so the write takes part in
     * whatever transaction the connection has open.
     *
     * @param connection The database connection
     * @param event      The event to persist
     * @throws SQLException if the row could not be written
     */
    public void append(Connection connection, Event event) throws SQLException {
        String sql = String.format("INSERT INTO %s (%s) VALUES (%s)", TABLE, SQL.CORE_COLS, SQL.CORE_PH);
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            SQL.setEventOnStatement(stmt, event);
            stmt.executeUpdate();
        }
        logger.atDebug()
                .addArgument(event.id())
                .addArgument(event.topic())
                .addArgument(event.tenantId())
                .log("Event {} stored for {} tenant {}");
    }

    /**
     * Appends an event on a connection from the pool, committed on return.
     *
     * @param event The event to persist
     * @throws SQLException if the row could not be written
     */
    public void append(Event event) throws SQLException {
        try (Connection c = ds.getConnection()) {
            append(c, event);
        }
    }

    /**
     * Reads one page of events for catchup, ordered by emission time then id.
     *
     * @param tenantId        tenant to read, or null for all tenants
     * @param since           only events emitted strictly after this time, or
     *                        null for no lower bound
     * @param undeliveredOnly only events not yet marked delivered
     * @param after           the last event of the previous page, or null for the
     *                        first page
     * @param limit           maximum rows to return
     * @return the page, possibly empty
     * @throws SQLException if the query fails
     */
    public List<PendingEvent> findForReplay(String tenantId, Instant since, boolean undeliveredOnly, Event after,
            int limit) throws SQLException {
        StringBuilder sql = new StringBuilder("SELECT ").append(SQL.EXT_COLS)
                .append(" FROM ").append(TABLE).append(" WHERE true");
        List<Object> params = new ArrayList<>();
        if (tenantId != null) {
            sql.append(" AND tenant_id = ?");
            params.add(tenantId);
        }
        if (since != null) {
            sql.append(" AND emitted_at > ?");
            params.add(Timestamp.from(since));
        }
        if (undeliveredOnly) {
            sql.append(" AND delivered_at IS NULL");
        }
        if (after != null) {
            sql.append(" AND (emitted_at, id) > (?::timestamptz, ?)");
            params.add(Timestamp.from(after.emittedAt()));
            params.add(after.id());
        }
        sql.append(" ORDER BY emitted_at, id LIMIT ?");
        params.add(limit);

        try (Connection c = ds.getConnection();
                PreparedStatement stmt = c.prepareStatement(sql.toString())) {
            for (int i = 0; i < params.size(); i++) {
                stmt.setObject(i + 1, params.get(i));
            }
            List<PendingEvent> events = new ArrayList<>();
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    events.add(SQL.pendingEventFromResultSet(rs));
                }
            }
            return events;
        }
    }

    public Optional<PendingEvent> find(String id) throws SQLException {
        String sql = "SELECT " + SQL.EXT_COLS + " FROM " + TABLE + " WHERE id = ?";
        try (Connection c = ds.getConnection();
                PreparedStatement stmt = c.prepareStatement(sql)) {
            stmt.setString(1, id);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(SQL.pendingEventFromResultSet(rs)) : Optional.empty();
            }
        }
    }

    /**
     * Stamps an event as delivered. The first delivery time is kept if the event
     * was already stamped.
     *
     * @param id the event id
     * @return true if the row was stamped by this call
     * @throws SQLException if the update fails
     */
    public boolean markDelivered(String id) throws SQLException {
        String sql = "UPDATE " + TABLE + " SET delivered_at = ? WHERE id = ? AND delivered_at IS NULL";
        try (Connection c = ds.getConnection();
                PreparedStatement stmt = c.prepareStatement(sql)) {
            stmt.setTimestamp(1, Timestamp.from(clock.instant()));
            stmt.setString(2, id);
            return stmt.executeUpdate() == 1;
        }
    }

    /**
     * Deletes delivered events whose delivery time is before the cutoff.
     * Undelivered events are never touched.
     *
     * @param cutoff delivery time threshold
     * @return number of rows deleted
     * @throws SQLException if the delete fails
     */
    public int deleteDeliveredBefore(Instant cutoff) throws SQLException {
        String sql = "DELETE FROM " + TABLE + " WHERE delivered_at IS NOT NULL AND delivered_at < ?";
        try (Connection c = ds.getConnection();
                PreparedStatement stmt = c.prepareStatement(sql)) {
            stmt.setTimestamp(1, Timestamp.from(cutoff));
            return stmt.executeUpdate();
        }
    }

    public EventLogStats stats() throws SQLException {
        String sql = """
                SELECT count(*) FILTER (WHERE delivered_at IS NULL) AS pending,
                       count(*) FILTER (WHERE delivered_at IS NOT NULL) AS delivered,
                       min(emitted_at) FILTER (WHERE delivered_at IS NULL) AS oldest_pending
                FROM livefeed.pending_events""";
        try (Connection c = ds.getConnection();
                PreparedStatement stmt = c.prepareStatement(sql);
                ResultSet rs = stmt.executeQuery()) {
            rs.next();
            Timestamp oldest = rs.getTimestamp("oldest_pending");
            return new EventLogStats(rs.getLong("pending"), rs.getLong("delivered"),
                    oldest == null ? null : oldest.toInstant());
        }
    }

    Clock clock() {
        return clock;
    }
}
