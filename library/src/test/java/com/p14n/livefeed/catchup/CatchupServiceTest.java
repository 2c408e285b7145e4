package com.p14n.livefeed.catchup;

import com.p14n.livefeed.data.Event;
import com.p14n.livefeed.data.EventType;
import com.p14n.livefeed.db.DatabaseSetup;
import com.p14n.livefeed.eventlog.EventLog;
import com.p14n.livefeed.stream.Caller;
import com.p14n.livefeed.stream.ClientConnection;
import com.p14n.livefeed.stream.RecordingSink;
import com.p14n.livefeed.stream.TenantPermissionFilter;
import com.p14n.livefeed.stream.WireFormat;

import io.zonky.test.db.postgres.embedded.EmbeddedPostgres;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static com.p14n.livefeed.TestEvents.event;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class CatchupServiceTest {

    private static final Instant BASE = Instant.parse("2024-06-01T10:00:00Z");

    private EmbeddedPostgres pg;
    private EventLog eventLog;

    @BeforeEach
    void setUp() throws Exception {
        pg = EmbeddedPostgres.start();
        new DatabaseSetup(pg.getPostgresDatabase()).setupAll();
        eventLog = new EventLog(pg.getPostgresDatabase());
    }

    @AfterEach
    void tearDown() throws Exception {
        if (pg != null) {
            pg.close();
        }
    }

    private List<Event> appendSeconds(String tenant, int... seconds) throws SQLException {
        List<Event> events = new ArrayList<>();
        for (int s : seconds) {
            Event e = event(EventType.ORDER_STATUS_CHANGED, tenant, BASE.plusSeconds(s));
            eventLog.append(e);
            events.add(e);
        }
        return events;
    }

    @Test
    void replaysEverythingAfterTheCheckpointInOrder() throws SQLException {
        // emitted at 10, 20 and 30; the client last saw 15
        List<Event> events = appendSeconds("r1", 10, 20, 30);
        CatchupService catchup = new CatchupService(eventLog);

        List<Event> replayed = catchup.replay("r1", CatchupQuery.since(BASE.plusSeconds(15)));

        assertEquals(List.of(events.get(1), events.get(2)), replayed);
    }

    @Test
    void pagesThroughTheLogUpToTheCap() throws SQLException {
        List<Event> events = appendSeconds("r1", 1, 2, 3, 4, 5, 6, 7);

        List<Event> all = new CatchupService(eventLog, 2, 100).replay("r1", CatchupQuery.since(BASE));
        assertEquals(events, all);

        List<Event> capped = new CatchupService(eventLog, 2, 5).replay("r1", CatchupQuery.since(BASE));
        assertEquals(events.subList(0, 5), capped);
    }

    @Test
    void onlyReportsTruncationWhenEventsAreLeftBehind() throws SQLException {
        List<Event> events = appendSeconds("r1", 1, 2, 3, 4);

        CatchupService.Replay exact = new CatchupService(eventLog, 2, 4).read("r1", CatchupQuery.since(BASE));
        assertEquals(events, exact.events());
        assertFalse(exact.truncated());

        CatchupService.Replay capped = new CatchupService(eventLog, 2, 3).read("r1", CatchupQuery.since(BASE));
        assertEquals(events.subList(0, 3), capped.events());
        assertTrue(capped.truncated());

        CatchupService.Replay underCap = new CatchupService(eventLog, 3, 10).read("r1", CatchupQuery.since(BASE));
        assertEquals(events, underCap.events());
        assertFalse(underCap.truncated());
    }

    @Test
    void sinceModeIgnoresDeliveryUndeliveredModeHonoursIt() throws SQLException {
        List<Event> events = appendSeconds("r1", 1, 2, 3);
        eventLog.markDelivered(events.get(0).id());
        CatchupService catchup = new CatchupService(eventLog);

        assertEquals(events, catchup.replay("r1", CatchupQuery.since(BASE)));
        assertEquals(events.subList(1, 3), catchup.replay("r1", CatchupQuery.undelivered(null)));
        assertEquals(events.subList(2, 3), catchup.replay("r1", CatchupQuery.undelivered(BASE.plusSeconds(2))));
    }

    @Test
    void nullTenantReplaysAllTenants() throws SQLException {
        appendSeconds("r1", 1);
        appendSeconds("r2", 2);
        CatchupService catchup = new CatchupService(eventLog);

        assertEquals(2, catchup.replay(null, CatchupQuery.since(BASE)).size());
        assertEquals(1, catchup.replay("r2", CatchupQuery.since(BASE)).size());
    }

    @Test
    void noCheckpointReplaysNothing() throws SQLException {
        appendSeconds("r1", 1);
        assertTrue(new CatchupService(eventLog).replay("r1", CatchupQuery.none()).isEmpty());
    }

    @Test
    void replayToWritesAndMarksDelivered() throws SQLException {
        List<Event> events = appendSeconds("r1", 1, 2);
        RecordingSink sink = new RecordingSink();
        ClientConnection connection = new ClientConnection("c1", new Caller("u1", "r1", "waiter", Set.of()),
                Instant.now(), sink);
        WireFormat wire = new WireFormat();

        List<Event> written = new CatchupService(eventLog).replayTo(connection, CatchupQuery.since(BASE),
                new TenantPermissionFilter(), wire);

        assertEquals(events, written);
        assertEquals(List.of(wire.eventFrame(events.get(0)), wire.eventFrame(events.get(1))), sink.eventFrames());
        for (Event e : events) {
            assertNotNull(eventLog.find(e.id()).orElseThrow().deliveredAt());
        }
    }

    @Test
    void failedWriteStopsReplayAndLeavesTheRestUndelivered() throws SQLException {
        List<Event> events = appendSeconds("r1", 1, 2);
        RecordingSink sink = new RecordingSink();
        sink.failWrites();
        ClientConnection connection = new ClientConnection("c1", new Caller("u1", "r1", "waiter", Set.of()),
                Instant.now(), sink);

        List<Event> written = new CatchupService(eventLog).replayTo(connection, CatchupQuery.since(BASE),
                new TenantPermissionFilter(), new WireFormat());

        assertTrue(written.isEmpty());
        assertTrue(connection.isClosed());
        assertNull(eventLog.find(events.get(0).id()).orElseThrow().deliveredAt());
    }

    @Test
    void unreadableLogDegradesToLiveOnly() throws SQLException {
        EventLog broken = mock(EventLog.class);
        when(broken.findForReplay(any(), any(), anyBoolean(), any(), anyInt()))
                .thenThrow(new SQLException("relation does not exist"));
        CatchupService catchup = new CatchupService(broken);

        assertThrows(SQLException.class, () -> catchup.replay("r1", CatchupQuery.since(BASE)));
        assertTrue(catchup.replayOrLiveOnly("r1", CatchupQuery.since(BASE)).isEmpty());
    }

    @Test
    void failedAcknowledgementIsNotThrown() throws SQLException {
        EventLog broken = mock(EventLog.class);
        when(broken.markDelivered(any())).thenThrow(new SQLException("timeout"));

        new CatchupService(broken).acknowledge(event("r1"));
    }
}
