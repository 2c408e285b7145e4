package com.p14n.livefeed.catchup;

import com.p14n.livefeed.data.Event;
import com.p14n.livefeed.data.PendingEvent;
import com.p14n.livefeed.eventlog.EventLog;
import com.p14n.livefeed.stream.ClientConnection;
import com.p14n.livefeed.stream.PermissionFilter;
import com.p14n.livefeed.stream.WireFormat;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the events a reconnecting stream missed from the event log.
 *
 * <p>
 * Delivery marking is a best-effort signal shared by all streams of a tenant:
 * it never stops a {@link CatchupQuery.Mode#SINCE} replay from returning an
 * event again to another stream.
 * </p>
 */
public class CatchupService {
    private static final Logger logger = LoggerFactory.getLogger(CatchupService.class);
    private static final int DEFAULT_BATCH_SIZE = 100;
    private static final int DEFAULT_MAX_EVENTS = 1000;

    private final EventLog eventLog;
    private final int batchSize;
    private final int maxEvents;

    public CatchupService(EventLog eventLog) {
        this(eventLog, DEFAULT_BATCH_SIZE, DEFAULT_MAX_EVENTS);
    }

    public CatchupService(EventLog eventLog, int batchSize, int maxEvents) {
        if (batchSize <= 0 || maxEvents <= 0) {
            throw new IllegalArgumentException("batchSize and maxEvents must be positive");
        }
        this.eventLog = eventLog;
        this.batchSize = batchSize;
        this.maxEvents = maxEvents;
    }

    /**
     * Reads the events matching a catchup query, oldest first.
     *
     * @param tenantId the tenant to replay, or null for every tenant
     * @param query    the checkpoint and mode
     * @return events ordered by emission time, at most the configured maximum
     * @throws SQLException if the event log cannot be read
     */
    public List<Event> replay(String tenantId, CatchupQuery query) throws SQLException {
        if (!query.requested()) {
            return Collections.emptyList();
        }
        Replay replay = read(tenantId, query);
        if (replay.truncated()) {
            logger.atWarn()
                    .addArgument(tenantId)
                    .addArgument(maxEvents)
                    .log("Catchup for tenant {} truncated at {} events");
        }
        logger.atInfo()
                .addArgument(replay.events().size())
                .addArgument(tenantId)
                .addArgument(query.since())
                .addArgument(query.mode())
                .log("Replaying {} events for tenant {} since {} ({})");
        return replay.events();
    }

    /** Events read for one catchup, and whether more were left behind the cap. */
    record Replay(List<Event> events, boolean truncated) {
    }

    Replay read(String tenantId, CatchupQuery query) throws SQLException {
        boolean undeliveredOnly = query.mode() == CatchupQuery.Mode.UNDELIVERED;
        List<Event> events = new ArrayList<>();
        Event last = null;
        while (true) {
            int remaining = maxEvents - events.size();
            int limit = Math.min(batchSize, remaining);
            boolean finalPage = limit == remaining;
            // one extra row on the final page tells a full log from a truncated one
            List<PendingEvent> page = eventLog.findForReplay(tenantId, query.since(), undeliveredOnly, last,
                    finalPage ? limit + 1 : limit);
            boolean truncated = page.size() > limit;
            for (PendingEvent p : truncated ? page.subList(0, limit) : page) {
                events.add(p.event());
            }
            if (truncated || finalPage || page.size() < limit) {
                return new Replay(events, truncated);
            }
            last = events.get(events.size() - 1);
        }
    }

    /**
     * Same as {@link #replay(String, CatchupQuery)} but a failing event log
     * degrades to an empty replay: the stream opens with live events only.
     */
    public List<Event> replayOrLiveOnly(String tenantId, CatchupQuery query) {
        try {
            return replay(tenantId, query);
        } catch (SQLException | RuntimeException e) {
            logger.atError()
                    .setCause(e)
                    .addArgument(tenantId)
                    .addArgument(query.since())
                    .log("Catchup failed for tenant {} since {}; events in the gap are not replayed, streaming live only");
            return Collections.emptyList();
        }
    }

    /**
     * Replays the events a new connection missed, in emission order. Each event
     * the filter allows is written to the connection and then marked delivered.
     * A failed write closes the connection and ends the replay; a failed read
     * replays nothing. The administrator without a tenant replays every tenant.
     *
     * @return the events written, in order
     */
    public List<Event> replayTo(ClientConnection connection, CatchupQuery query, PermissionFilter filter,
            WireFormat wire) {
        List<Event> written = new ArrayList<>();
        for (Event event : replayOrLiveOnly(connection.caller().tenantId(), query)) {
            if (!filter.canReceive(connection.caller(), event)) {
                continue;
            }
            if (!connection.send(wire.eventFrame(event))) {
                logger.atWarn()
                        .addArgument(connection.connectionId())
                        .addArgument(written.size())
                        .log("Connection {} failed during catchup after {} events");
                connection.close();
                break;
            }
            written.add(event);
            acknowledge(event);
        }
        return written;
    }

    /**
     * Marks a replayed event delivered. Failures are logged, not thrown.
     *
     * @param event the event that was written to a stream
     */
    public void acknowledge(Event event) {
        try {
            eventLog.markDelivered(event.id());
        } catch (SQLException e) {
            logger.atWarn()
                    .setCause(e)
                    .addArgument(event.id())
                    .log("Failed to mark event {} delivered");
        }
    }
}
