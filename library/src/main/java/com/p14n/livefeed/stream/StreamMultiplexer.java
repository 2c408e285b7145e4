package com.p14n.livefeed.stream;

import com.p14n.livefeed.catchup.CatchupQuery;
import com.p14n.livefeed.catchup.CatchupService;
import com.p14n.livefeed.data.Event;
import com.p14n.livefeed.executor.AsyncExecutor;
import com.p14n.livefeed.telemetry.StreamMetrics;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

import static com.p14n.livefeed.telemetry.OpenTelemetryFunctions.processWithTelemetry;

/**
 * Owns the open client streams and writes events to them.
 *
 * <p>
 * Events arrive on {@link #dispatchQueue()} and are drained by one background
 * task, so every connection sees live events in dispatch order. A failed write
 * closes only the connection it was written to.
 * </p>
 */
public class StreamMultiplexer implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(StreamMultiplexer.class);
    private static final long POLL_MILLIS = 500;

    private final ConnectionRegistry registry;
    private final PermissionFilter filter;
    private final CatchupService catchup;
    private final WireFormat wire;
    private final AsyncExecutor executor;
    private final StreamMetrics metrics;
    private final OpenTelemetry ot;
    private final Tracer tracer;
    private final long keepAliveMillis;
    private final Clock clock;

    private final BlockingQueue<Event> dispatch = new LinkedBlockingQueue<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean shutdown = new AtomicBoolean(false);
    private volatile Future<?> drain;

    public StreamMultiplexer(ConnectionRegistry registry, PermissionFilter filter, CatchupService catchup,
            WireFormat wire, AsyncExecutor executor, OpenTelemetry ot, long keepAliveMillis) {
        this(registry, filter, catchup, wire, executor, ot, keepAliveMillis, Clock.systemUTC());
    }

    public StreamMultiplexer(ConnectionRegistry registry, PermissionFilter filter, CatchupService catchup,
            WireFormat wire, AsyncExecutor executor, OpenTelemetry ot, long keepAliveMillis, Clock clock) {
        if (keepAliveMillis <= 0) {
            throw new IllegalArgumentException("keepAliveMillis must be positive");
        }
        this.registry = registry;
        this.filter = filter;
        this.catchup = catchup;
        this.wire = wire;
        this.executor = executor;
        this.ot = ot;
        this.tracer = ot.getTracer("livefeed-stream");
        this.metrics = new StreamMetrics(ot.getMeter("livefeed"));
        this.keepAliveMillis = keepAliveMillis;
        this.clock = clock;
    }

    /**
     * The queue the notification bridge feeds.
     */
    public BlockingQueue<Event> dispatchQueue() {
        return dispatch;
    }

    public int connectionCount() {
        return registry.size();
    }

    /**
     * Starts the drain task. Calling it again while running does nothing.
     */
    public void start() {
        if (shutdown.get()) {
            throw new IllegalStateException("Multiplexer has been shut down");
        }
        if (running.compareAndSet(false, true)) {
            drain = executor.submit(() -> {
                drainLoop();
                return null;
            });
        }
    }

    private void drainLoop() {
        logger.atInfo().log("Dispatch drain started");
        while (running.get()) {
            try {
                Event event = dispatch.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
                if (event != null) {
                    processWithTelemetry(ot, tracer, event, "fan_out", () -> {
                        fanOut(event);
                        return null;
                    });
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (RuntimeException e) {
                logger.atError().setCause(e).log("Unexpected error in dispatch drain");
            }
        }
        logger.atInfo().log("Dispatch drain stopped");
    }

    /**
     * Opens a stream: writes the connection frame, replays the requested
     * catchup, then registers the connection for live events and starts its
     * keep-alive.
     *
     * @return the connection, already closed if the client went away during
     *         setup
     * @throws IllegalStateException    if the multiplexer has been shut down
     * @throws IllegalArgumentException if a caller other than a platform
     *                                  administrator has no tenant
     */
    public ClientConnection open(Caller caller, EventSink sink, CatchupQuery query) {
        if (shutdown.get()) {
            throw new IllegalStateException("Multiplexer has been shut down");
        }
        if (!caller.isPlatformAdmin() && caller.tenantId() == null) {
            throw new IllegalArgumentException("Caller " + caller.callerId() + " has no tenant");
        }
        Instant now = clock.instant();
        ClientConnection connection = new ClientConnection(UUID.randomUUID().toString(), caller, now, sink);
        if (!connection.send(wire.connectionFrame(connection.connectionId(), now.toEpochMilli()))) {
            connection.close();
            return connection;
        }
        if (query.requested()) {
            replay(connection, query);
        }
        if (connection.isClosed()) {
            return connection;
        }
        registry.register(connection);
        metrics.recordConnectionOpened();
        connection.keepAlive(executor.scheduleAtFixedRate(() -> keepAlive(connection),
                keepAliveMillis, keepAliveMillis, TimeUnit.MILLISECONDS));
        logger.atInfo()
                .addArgument(connection.connectionId())
                .addArgument(caller.callerId())
                .addArgument(caller.tenantId())
                .addArgument(registry.size())
                .log("Opened connection {} for caller {} tenant {} ({} open)");
        if (shutdown.get()) {
            close(connection.connectionId());
        }
        return connection;
    }

    private void replay(ClientConnection connection, CatchupQuery query) {
        List<Event> written = catchup.replayTo(connection, query, filter, wire);
        for (Event event : written) {
            metrics.recordReplayed(event.topic());
        }
        if (connection.isClosed()) {
            metrics.recordWriteFailure();
        }
    }

    /**
     * Unregisters and closes a connection. Unknown or already closed ids are
     * ignored.
     */
    public void close(String connectionId) {
        ClientConnection connection = registry.unregister(connectionId);
        if (connection == null) {
            return;
        }
        connection.close();
        metrics.recordConnectionClosed();
        logger.atInfo()
                .addArgument(connectionId)
                .addArgument(registry.size())
                .log("Closed connection {} ({} open)");
    }

    /**
     * Writes an event to every registered connection allowed to receive it.
     * Never throws; a failing connection is closed and the rest still receive
     * the event.
     */
    public void fanOut(Event event) {
        String frame = wire.eventFrame(event);
        for (ClientConnection connection : registry.connections()) {
            try {
                if (!filter.canReceive(connection.caller(), event)) {
                    continue;
                }
                if (connection.send(frame)) {
                    metrics.recordDelivered(event.topic());
                } else {
                    writeFailed(connection);
                }
            } catch (RuntimeException e) {
                logger.atWarn()
                        .setCause(e)
                        .addArgument(event.id())
                        .addArgument(connection.connectionId())
                        .log("Failed to deliver event {} to connection {}");
                writeFailed(connection);
            }
        }
    }

    private void keepAlive(ClientConnection connection) {
        if (!connection.send(WireFormat.KEEP_ALIVE_FRAME)) {
            writeFailed(connection);
        }
    }

    private void writeFailed(ClientConnection connection) {
        metrics.recordWriteFailure();
        logger.atDebug()
                .addArgument(connection.connectionId())
                .log("Closing connection {} after failed write");
        close(connection.connectionId());
    }

    /**
     * Stops the drain task and closes every open connection.
     */
    public void shutdown() {
        if (!shutdown.compareAndSet(false, true)) {
            return;
        }
        running.set(false);
        Future<?> f = drain;
        if (f != null) {
            try {
                f.get(2, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (ExecutionException | TimeoutException e) {
                logger.atWarn().setCause(e).log("Dispatch drain did not stop cleanly");
                f.cancel(true);
            }
        }
        List<ClientConnection> open = registry.unregisterAll();
        for (ClientConnection connection : open) {
            connection.close();
            metrics.recordConnectionClosed();
        }
        logger.atInfo()
                .addArgument(open.size())
                .log("Multiplexer shut down, closed {} connections");
    }

    @Override
    public void close() {
        shutdown();
    }
}
