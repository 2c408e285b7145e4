package com.p14n.livefeed.stream;

import java.io.IOException;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One open client stream. Writes are serialised per connection so catchup,
 * live fan-out and keep-alives never interleave inside a frame.
 */
public class ClientConnection {

    private static final Logger logger = LoggerFactory.getLogger(ClientConnection.class);

    private final String connectionId;
    private final Caller caller;
    private final Instant openedAt;
    private final EventSink sink;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile ScheduledFuture<?> keepAlive;

    public ClientConnection(String connectionId, Caller caller, Instant openedAt, EventSink sink) {
        this.connectionId = connectionId;
        this.caller = caller;
        this.openedAt = openedAt;
        this.sink = sink;
    }

    public String connectionId() {
        return connectionId;
    }

    public Caller caller() {
        return caller;
    }

    public Instant openedAt() {
        return openedAt;
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * @return true if the frame was handed to the sink, false if the connection
     *         is closed or the write failed
     */
    public synchronized boolean send(String frame) {
        if (closed.get()) {
            return false;
        }
        try {
            sink.send(frame);
            return true;
        } catch (IOException | RuntimeException e) {
            logger.atDebug()
                    .setCause(e)
                    .addArgument(connectionId)
                    .log("Write to connection {} failed");
            return false;
        }
    }

    void keepAlive(ScheduledFuture<?> task) {
        this.keepAlive = task;
        if (closed.get()) {
            task.cancel(false);
        }
    }

    /**
     * Cancels the keep-alive and ends the sink. Only the first call has any
     * effect.
     *
     * @return true if this call closed the connection
     */
    public boolean close() {
        if (!closed.compareAndSet(false, true)) {
            return false;
        }
        ScheduledFuture<?> task = keepAlive;
        if (task != null) {
            task.cancel(false);
        }
        try {
            sink.close();
        } catch (RuntimeException e) {
            logger.atWarn()
                    .setCause(e)
                    .addArgument(connectionId)
                    .log("Error closing sink of connection {}");
        }
        return true;
    }
}
