package com.p14n.livefeed;

import com.p14n.livefeed.bus.BusNotifier;
import com.p14n.livefeed.bus.EnvelopeCodec;
import com.p14n.livefeed.bus.ListenerConnectionFactory;
import com.p14n.livefeed.bus.NotificationBridge;
import com.p14n.livefeed.catchup.CatchupService;
import com.p14n.livefeed.data.LiveFeedConfig;
import com.p14n.livefeed.db.DatabaseSetup;
import com.p14n.livefeed.eventlog.EventLog;
import com.p14n.livefeed.eventlog.RetentionSweeper;
import com.p14n.livefeed.executor.AsyncExecutor;
import com.p14n.livefeed.executor.DefaultExecutor;
import com.p14n.livefeed.stream.ConnectionRegistry;
import com.p14n.livefeed.stream.PermissionFilter;
import com.p14n.livefeed.stream.StreamMultiplexer;
import com.p14n.livefeed.stream.TenantPermissionFilter;
import com.p14n.livefeed.stream.WireFormat;
import com.p14n.livefeed.telemetry.StreamMetrics;

import io.opentelemetry.api.OpenTelemetry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Wires the live feed together for one process.
 *
 * <p>
 * {@link #start()} creates the schema, starts the dispatch drain, subscribes
 * to the notification bus and schedules the retention sweep.
 * {@link #close()} stops all of it and closes every open stream.
 * </p>
 *
 * <pre>{@code
 * var server = new LiveFeedServer(dataSource, config, OpenTelemetry.noop());
 * server.start();
 * server.publisher().publish(EventType.ORDER_CREATED, payload, restaurantId);
 * }</pre>
 */
public class LiveFeedServer implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(LiveFeedServer.class);

    private final DataSource ds;
    private final LiveFeedConfig cfg;
    private final ListenerConnectionFactory listenerConnections;
    private final AsyncExecutor asyncExecutor;
    private final PermissionFilter filter;
    private final OpenTelemetry ot;

    private final List<AutoCloseable> closeables = new ArrayList<>();
    private EventLog eventLog;
    private EventPublisher publisher;
    private StreamMultiplexer multiplexer;
    private NotificationBridge bridge;
    private RetentionSweeper sweeper;
    private boolean started;

    public LiveFeedServer(DataSource ds, LiveFeedConfig cfg, OpenTelemetry ot) {
        this(ds, cfg, ListenerConnectionFactory.fromConfig(cfg), new DefaultExecutor(2),
                new TenantPermissionFilter(), ot);
    }

    /**
     * @param ds                  pooled data source for the event log and the
     *                            notifier
     * @param cfg                 timing and database configuration
     * @param listenerConnections opens the dedicated listener connection
     * @param asyncExecutor       runs the receive loop, the drain, keep-alives
     *                            and the sweep; closed with the server
     * @param filter              decides which streams receive which events
     * @param ot                  telemetry
     */
    public LiveFeedServer(DataSource ds, LiveFeedConfig cfg, ListenerConnectionFactory listenerConnections,
            AsyncExecutor asyncExecutor, PermissionFilter filter, OpenTelemetry ot) {
        this.ds = ds;
        this.cfg = cfg;
        this.listenerConnections = listenerConnections;
        this.asyncExecutor = asyncExecutor;
        this.filter = filter;
        this.ot = ot;
    }

    public synchronized void start() {
        if (started) {
            throw new IllegalStateException("Live feed server already started");
        }
        logger.atInfo().log("Starting live feed server");
        try {
            new DatabaseSetup(ds).setupAll();

            EnvelopeCodec codec = new EnvelopeCodec();
            eventLog = new EventLog(ds);
            publisher = new EventPublisher(eventLog, new BusNotifier(ds, codec), ot);

            CatchupService catchup = new CatchupService(eventLog, cfg.catchupBatchSize(), cfg.maxReplayEvents());
            multiplexer = new StreamMultiplexer(new ConnectionRegistry(), filter, catchup, new WireFormat(),
                    asyncExecutor, ot, TimeUnit.SECONDS.toMillis(cfg.keepAliveSeconds()));
            multiplexer.start();

            bridge = new NotificationBridge(listenerConnections, multiplexer.dispatchQueue(), codec, asyncExecutor,
                    new StreamMetrics(ot.getMeter("livefeed")), cfg.reconnectInitialMillis(),
                    cfg.reconnectMaxMillis());
            bridge.ensureRunning();

            sweeper = new RetentionSweeper(eventLog, Duration.ofDays(cfg.retentionDays()));
            sweeper.start(asyncExecutor, cfg.sweepIntervalMinutes());

            // closed in this order
            closeables.add(sweeper);
            closeables.add(bridge);
            closeables.add(multiplexer);
            closeables.add(asyncExecutor);
            started = true;
            logger.atInfo().log("Live feed server started");
        } catch (RuntimeException e) {
            logger.atError()
                    .setCause(e)
                    .log("Failed to start live feed server");
            throw e;
        }
    }

    public EventPublisher publisher() {
        requireStarted();
        return publisher;
    }

    public StreamMultiplexer multiplexer() {
        requireStarted();
        return multiplexer;
    }

    public EventLog eventLog() {
        requireStarted();
        return eventLog;
    }

    public synchronized boolean isListening() {
        return bridge != null && bridge.isListening();
    }

    private synchronized void requireStarted() {
        if (!started) {
            throw new IllegalStateException("Live feed server not started");
        }
    }

    @Override
    public synchronized void close() {
        if (!started) {
            return;
        }
        logger.atInfo().log("Stopping live feed server");
        for (var c : closeables) {
            try {
                c.close();
            } catch (Exception e) {
                logger.atWarn()
                        .setCause(e)
                        .addArgument(c.getClass().getSimpleName())
                        .log("Error closing {}");
            }
        }
        closeables.clear();
        started = false;
        logger.atInfo().log("Live feed server stopped");
    }
}
