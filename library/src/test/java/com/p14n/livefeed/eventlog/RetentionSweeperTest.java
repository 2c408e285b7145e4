package com.p14n.livefeed.eventlog;

import com.p14n.livefeed.data.Event;
import com.p14n.livefeed.data.EventType;
import com.p14n.livefeed.db.DatabaseSetup;
import com.p14n.livefeed.executor.TestAsyncExecutor;

import io.zonky.test.db.postgres.embedded.EmbeddedPostgres;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static com.p14n.livefeed.TestEvents.event;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class RetentionSweeperTest {

    private static final Instant NOW = Instant.parse("2024-06-10T00:00:00Z");

    private EmbeddedPostgres pg;

    @BeforeEach
    void setUp() throws Exception {
        pg = EmbeddedPostgres.start();
        new DatabaseSetup(pg.getPostgresDatabase()).setupAll();
    }

    @AfterEach
    void tearDown() throws Exception {
        if (pg != null) {
            pg.close();
        }
    }

    @Test
    void removesOnlyEventsDeliveredBeforeTheWindow() throws SQLException {
        Instant eightDaysAgo = NOW.minus(Duration.ofDays(8));
        EventLog past = new EventLog(pg.getPostgresDatabase(), Clock.fixed(eightDaysAgo, ZoneOffset.UTC));
        EventLog present = new EventLog(pg.getPostgresDatabase(), Clock.fixed(NOW, ZoneOffset.UTC));

        Event expired = event(EventType.ORDER_CREATED, "r1", eightDaysAgo);
        Event recent = event(EventType.ORDER_CREATED, "r1", eightDaysAgo);
        Event neverDelivered = event(EventType.ORDER_CREATED, "r1", eightDaysAgo);
        present.append(expired);
        present.append(recent);
        present.append(neverDelivered);
        past.markDelivered(expired.id());
        present.markDelivered(recent.id());

        RetentionSweeper sweeper = new RetentionSweeper(present, Duration.ofDays(7));

        assertEquals(1, sweeper.sweep());
        assertTrue(present.find(expired.id()).isEmpty());
        assertTrue(present.find(recent.id()).isPresent());
        assertTrue(present.find(neverDelivered.id()).isPresent());
    }

    @Test
    void failedSweepIsReportedNotThrown() throws SQLException {
        EventLog broken = mock(EventLog.class);
        when(broken.clock()).thenReturn(Clock.fixed(NOW, ZoneOffset.UTC));
        when(broken.deleteDeliveredBefore(any())).thenThrow(new SQLException("database is down"));

        assertEquals(-1, new RetentionSweeper(broken, Duration.ofDays(7)).sweep());
    }

    @Test
    void schedulesOnceAtTheInterval() {
        TestAsyncExecutor executor = new TestAsyncExecutor();
        RetentionSweeper sweeper = new RetentionSweeper(
                new EventLog(pg.getPostgresDatabase(), Clock.fixed(NOW, ZoneOffset.UTC)), Duration.ofDays(7));

        sweeper.start(executor, 60);
        sweeper.start(executor, 60);

        assertEquals(1, executor.scheduledCount());
        assertEquals(Duration.ofMinutes(60).toMillis(), executor.periodMillis(0));

        sweeper.close();
        assertEquals(0, executor.scheduledCount());
    }
}
