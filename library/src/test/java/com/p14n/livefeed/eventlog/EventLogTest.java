package com.p14n.livefeed.eventlog;

import com.p14n.livefeed.data.Event;
import com.p14n.livefeed.data.EventType;
import com.p14n.livefeed.data.PendingEvent;
import com.p14n.livefeed.db.DatabaseSetup;

import io.zonky.test.db.postgres.embedded.EmbeddedPostgres;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.stream.Collectors;

import static com.p14n.livefeed.TestEvents.event;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EventLogTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    private EmbeddedPostgres pg;
    private EventLog eventLog;

    @BeforeEach
    void setUp() throws Exception {
        pg = EmbeddedPostgres.start();
        new DatabaseSetup(pg.getPostgresDatabase()).setupAll();
        eventLog = new EventLog(pg.getPostgresDatabase(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() throws Exception {
        if (pg != null) {
            pg.close();
        }
    }

    @Test
    void appendedEventReadsBackUndelivered() throws SQLException {
        Event e = event(EventType.ORDER_CREATED, "r1", NOW.minusSeconds(5));
        eventLog.append(e);

        PendingEvent stored = eventLog.find(e.id()).orElseThrow();
        assertEquals(e, stored.event());
        assertNull(stored.deliveredAt());
        assertFalse(stored.delivered());
    }

    @Test
    void appendJoinsTheCallersTransaction() throws SQLException {
        Event e = event("r1");
        try (Connection c = pg.getPostgresDatabase().getConnection()) {
            c.setAutoCommit(false);
            eventLog.append(c, e);
            c.rollback();
        }
        assertTrue(eventLog.find(e.id()).isEmpty());
    }

    @Test
    void replayIsOrderedAndFiltered() throws SQLException {
        Event old = event(EventType.ORDER_CREATED, "r1", NOW.minusSeconds(100));
        Event a = event(EventType.ORDER_CREATED, "r1", NOW.minusSeconds(50));
        Event b = event(EventType.ORDER_STATUS_CHANGED, "r1", NOW.minusSeconds(40));
        Event other = event(EventType.ORDER_CREATED, "r2", NOW.minusSeconds(45));
        for (Event e : List.of(b, other, old, a)) {
            eventLog.append(e);
        }

        List<Event> r1 = events(eventLog.findForReplay("r1", NOW.minusSeconds(60), false, null, 10));
        assertEquals(List.of(a, b), r1);

        List<Event> all = events(eventLog.findForReplay(null, NOW.minusSeconds(60), false, null, 10));
        assertEquals(List.of(a, other, b), all);
    }

    @Test
    void sinceIsExclusive() throws SQLException {
        Event e = event(EventType.ORDER_CREATED, "r1", NOW.minusSeconds(10));
        eventLog.append(e);
        assertTrue(eventLog.findForReplay("r1", e.emittedAt(), false, null, 10).isEmpty());
        assertEquals(1, eventLog.findForReplay("r1", e.emittedAt().minusMillis(1), false, null, 10).size());
    }

    @Test
    void pagesContinueAfterTheLastEvent() throws SQLException {
        Instant sameTime = NOW.minusSeconds(10);
        Event e1 = event(EventType.ORDER_CREATED, "r1", sameTime);
        Event e2 = event(EventType.ORDER_CREATED, "r1", sameTime);
        Event e3 = event(EventType.ORDER_CREATED, "r1", sameTime);
        eventLog.append(e1);
        eventLog.append(e2);
        eventLog.append(e3);

        List<Event> first = events(eventLog.findForReplay("r1", null, false, null, 2));
        List<Event> second = events(eventLog.findForReplay("r1", null, false, first.get(1), 2));

        assertEquals(List.of(e1, e2), first);
        assertEquals(List.of(e3), second);
    }

    @Test
    void markDeliveredKeepsTheFirstTime() throws SQLException {
        Event e = event("r1");
        eventLog.append(e);

        assertTrue(eventLog.markDelivered(e.id()));
        assertFalse(eventLog.markDelivered(e.id()));
        assertEquals(NOW, eventLog.find(e.id()).orElseThrow().deliveredAt());

        assertTrue(eventLog.findForReplay("r1", null, true, null, 10).isEmpty());
        assertEquals(1, eventLog.findForReplay("r1", null, false, null, 10).size());
    }

    @Test
    void deleteNeverTouchesUndeliveredEvents() throws SQLException {
        Event undeliveredAncient = event(EventType.ORDER_CREATED, "r1", NOW.minusSeconds(86_400 * 30));
        Event delivered = event(EventType.ORDER_CREATED, "r1", NOW.minusSeconds(86_400 * 30));
        eventLog.append(undeliveredAncient);
        eventLog.append(delivered);
        eventLog.markDelivered(delivered.id());

        assertEquals(1, eventLog.deleteDeliveredBefore(NOW.plusSeconds(1)));
        assertTrue(eventLog.find(undeliveredAncient.id()).isPresent());
        assertTrue(eventLog.find(delivered.id()).isEmpty());
    }

    @Test
    void statsCountPendingAndDelivered() throws SQLException {
        assertEquals(new EventLogStats(0, 0, null), eventLog.stats());

        Event oldest = event(EventType.ORDER_CREATED, "r1", NOW.minusSeconds(30));
        Event newer = event(EventType.ORDER_CREATED, "r1", NOW.minusSeconds(20));
        Event delivered = event(EventType.ORDER_CREATED, "r2", NOW.minusSeconds(40));
        eventLog.append(oldest);
        eventLog.append(newer);
        eventLog.append(delivered);
        eventLog.markDelivered(delivered.id());

        EventLogStats stats = eventLog.stats();
        assertEquals(2, stats.totalPending());
        assertEquals(1, stats.totalDelivered());
        assertEquals(oldest.emittedAt(), stats.oldestPending());
    }

    private static List<Event> events(List<PendingEvent> pending) {
        return pending.stream().map(PendingEvent::event).collect(Collectors.toList());
    }
}
