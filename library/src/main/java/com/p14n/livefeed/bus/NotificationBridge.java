package com.p14n.livefeed.bus;

import com.p14n.livefeed.data.Event;
import com.p14n.livefeed.data.EventType;
import com.p14n.livefeed.executor.AsyncExecutor;
import com.p14n.livefeed.telemetry.StreamMetrics;

import org.postgresql.PGConnection;
import org.postgresql.PGNotification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Bridges PostgreSQL {@code LISTEN/NOTIFY} into the process.
 *
 * <p>
 * A single background task owns one listener connection subscribed to every
 * {@link EventType} channel. Each notification is decoded and offered to the
 * dispatch queue drained by the stream multiplexer. When the connection fails
 * the task reconnects with exponential backoff and subscribes again;
 * notifications sent while it was down are not recovered here, they remain in
 * the event log for catchup.
 * </p>
 */
public class NotificationBridge implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(NotificationBridge.class);

    private static final int POLL_TIMEOUT_MILLIS = 500;

    /** Polls between liveness queries, about ten seconds at the poll timeout. */
    static final int DEFAULT_HEARTBEAT_EVERY_POLLS = 20;

    private final ListenerConnectionFactory connections;
    private final BlockingQueue<Event> dispatch;
    private final EnvelopeCodec codec;
    private final AsyncExecutor executor;
    private final StreamMetrics metrics;
    private final long reconnectInitialMillis;
    private final long reconnectMaxMillis;
    private final int heartbeatEveryPolls;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile boolean listening;
    private volatile Future<?> loop;

    public NotificationBridge(ListenerConnectionFactory connections, BlockingQueue<Event> dispatch,
            EnvelopeCodec codec, AsyncExecutor executor, StreamMetrics metrics,
            long reconnectInitialMillis, long reconnectMaxMillis) {
        this(connections, dispatch, codec, executor, metrics, reconnectInitialMillis, reconnectMaxMillis,
                DEFAULT_HEARTBEAT_EVERY_POLLS);
    }

    /**
     * @param heartbeatEveryPolls number of empty or non-empty polls between
     *                            {@code SELECT 1} round trips on the listener
     *                            connection; waiting for notifications sends no
     *                            traffic, so a connection dropped by an idle
     *                            timeout is only noticed through this query
     */
    public NotificationBridge(ListenerConnectionFactory connections, BlockingQueue<Event> dispatch,
            EnvelopeCodec codec, AsyncExecutor executor, StreamMetrics metrics,
            long reconnectInitialMillis, long reconnectMaxMillis, int heartbeatEveryPolls) {
        if (heartbeatEveryPolls < 1) {
            throw new IllegalArgumentException("heartbeatEveryPolls must be positive");
        }
        this.connections = connections;
        this.dispatch = dispatch;
        this.codec = codec;
        this.executor = executor;
        this.metrics = metrics;
        this.reconnectInitialMillis = reconnectInitialMillis;
        this.reconnectMaxMillis = reconnectMaxMillis;
        this.heartbeatEveryPolls = heartbeatEveryPolls;
    }

    /**
     * Starts the receive loop unless it is already running. Safe to call from
     * any number of threads; only one subscription is ever created.
     */
    public void ensureRunning() {
        if (running.compareAndSet(false, true)) {
            logger.atInfo().log("Starting notification bridge");
            loop = executor.submit(() -> {
                receiveLoop();
                return null;
            });
        }
    }

    /**
     * @return true while the listener connection is open and subscribed
     */
    public boolean isListening() {
        return listening;
    }

    private void receiveLoop() {
        Backoff backoff = new Backoff(reconnectInitialMillis, reconnectMaxMillis);
        while (running.get()) {
            try (Connection connection = connections.open()) {
                subscribe(connection);
                listening = true;
                backoff.reset();
                logger.atInfo().addArgument(EventType.values().length).log("Listening on {} channels");
                poll(connection);
            } catch (SQLException | RuntimeException e) {
                if (!running.get()) {
                    break;
                }
                metrics.recordReconnect();
                logger.atWarn()
                        .setCause(e)
                        .log("Notification listener connection lost");
            } finally {
                listening = false;
            }

            if (running.get()) {
                long delay = backoff.nextDelayMillis();
                logger.atWarn().addArgument(delay).log("Reconnecting notification listener in {}ms");
                try {
                    Thread.sleep(delay);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }
        logger.atInfo().log("Notification bridge stopped");
    }

    private void subscribe(Connection connection) throws SQLException {
        connection.setAutoCommit(true);
        try (Statement stmt = connection.createStatement()) {
            for (EventType type : EventType.values()) {
                // channel names are fixed identifiers, never caller input
                stmt.execute("LISTEN " + type.channel());
            }
        }
    }

    private void poll(Connection connection) throws SQLException {
        PGConnection pg = connection.unwrap(PGConnection.class);
        int polls = 0;
        while (running.get()) {
            PGNotification[] notifications = pg.getNotifications(POLL_TIMEOUT_MILLIS);
            if (notifications != null) {
                for (PGNotification n : notifications) {
                    handle(n.getName(), n.getParameter());
                }
            }
            if (connection.isClosed()) {
                throw new SQLException("Listener connection closed");
            }
            if (++polls % heartbeatEveryPolls == 0) {
                heartbeat(connection);
            }
        }
    }

    private void heartbeat(Connection connection) throws SQLException {
        try (Statement stmt = connection.createStatement()) {
            stmt.execute("SELECT 1");
        }
    }

    void handle(String channel, String payload) {
        try {
            Event event = codec.decode(channel, payload);
            if (!dispatch.offer(event)) {
                logger.atWarn().addArgument(event.id()).log("Dispatch queue full, dropped live event {}");
                return;
            }
            logger.atDebug()
                    .addArgument(event.id())
                    .addArgument(channel)
                    .log("Received event {} on {}");
        } catch (IllegalArgumentException e) {
            logger.atWarn()
                    .setCause(e)
                    .addArgument(channel)
                    .log("Ignoring malformed notification on {}");
        }
    }

    /**
     * Stops the receive loop and waits briefly for it to release the listener
     * connection.
     */
    @Override
    public void close() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        Future<?> f = loop;
        if (f != null) {
            try {
                f.get(POLL_TIMEOUT_MILLIS * 4L, TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                f.cancel(true);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (ExecutionException e) {
                logger.atWarn().setCause(e.getCause()).log("Notification bridge ended with an error");
            }
        }
    }
}
