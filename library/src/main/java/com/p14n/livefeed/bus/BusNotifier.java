package com.p14n.livefeed.bus;

import com.p14n.livefeed.data.Event;

import javax.sql.DataSource;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sends events on their PostgreSQL notification channel with
 * {@code pg_notify}.
 *
 * <p>
 * Notification is best effort: failures are retried with exponential backoff
 * and then logged, never thrown. The event is already in the event log, so a
 * lost notification only delays delivery until the next catchup.
 * </p>
 */
public class BusNotifier {

    private static final Logger logger = LoggerFactory.getLogger(BusNotifier.class);

    /** PostgreSQL rejects notification payloads of 8000 bytes or more. */
    static final int MAX_PAYLOAD_BYTES = 7999;

    private final DataSource ds;
    private final EnvelopeCodec codec;
    private final int maxAttempts;
    private final long initialBackoffMillis;
    private final long maxBackoffMillis;

    public BusNotifier(DataSource ds, EnvelopeCodec codec) {
        this(ds, codec, 3, 100, 2000);
    }

    public BusNotifier(DataSource ds, EnvelopeCodec codec, int maxAttempts, long initialBackoffMillis,
            long maxBackoffMillis) {
        this.ds = ds;
        this.codec = codec;
        this.maxAttempts = maxAttempts;
        this.initialBackoffMillis = initialBackoffMillis;
        this.maxBackoffMillis = maxBackoffMillis;
    }

    /**
     * @param event the event to announce
     * @return true if the notification was accepted by the database
     */
    public boolean notify(Event event) {
        String envelope = envelope(event);
        if (envelope == null) {
            return false;
        }

        Backoff backoff = new Backoff(initialBackoffMillis, maxBackoffMillis);
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                send(event.topic(), envelope);
                logger.atDebug()
                        .addArgument(event.id())
                        .addArgument(event.topic())
                        .log("Event {} notified on {}");
                return true;
            } catch (SQLException e) {
                if (attempt == maxAttempts) {
                    logger.atError()
                            .setCause(e)
                            .addArgument(event.id())
                            .addArgument(event.topic())
                            .addArgument(maxAttempts)
                            .log("Failed to notify event {} on {} after {} attempts");
                    return false;
                }
                long delay = backoff.nextDelayMillis();
                logger.atWarn()
                        .addArgument(attempt)
                        .addArgument(event.topic())
                        .addArgument(delay)
                        .addArgument(e.getMessage())
                        .log("Notify attempt {} on {} failed, retrying in {}ms: {}");
                try {
                    Thread.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    return false;
                }
            }
        }
        return false;
    }

    /**
     * Queues the notification on the caller's connection. Inside a transaction
     * PostgreSQL delivers it only when the transaction commits and discards it
     * on rollback, so listeners never see an event that was not stored. Not
     * retried: a failure leaves the transaction aborted and is the caller's to
     * handle.
     *
     * @param connection the connection the event was written on
     * @param event      the event to announce
     * @return false if the envelope was too large to send
     * @throws SQLException if the database rejected the notification
     */
    public boolean notify(Connection connection, Event event) throws SQLException {
        String envelope = envelope(event);
        if (envelope == null) {
            return false;
        }
        send(connection, event.topic(), envelope);
        logger.atDebug()
                .addArgument(event.id())
                .addArgument(event.topic())
                .log("Event {} queued for notification on {} with the caller's transaction");
        return true;
    }

    private String envelope(Event event) {
        String envelope = codec.encode(event);
        int size = envelope.getBytes(StandardCharsets.UTF_8).length;
        if (size > MAX_PAYLOAD_BYTES) {
            logger.atWarn()
                    .addArgument(event.id())
                    .addArgument(size)
                    .log("Event {} envelope is {} bytes, too large to notify; it will reach clients on catchup");
            return null;
        }
        return envelope;
    }

    private void send(String channel, String envelope) throws SQLException {
        try (Connection c = ds.getConnection()) {
            send(c, channel, envelope);
        }
    }

    private static void send(Connection c, String channel, String envelope) throws SQLException {
        try (PreparedStatement stmt = c.prepareStatement("SELECT pg_notify(?, ?)")) {
            stmt.setString(1, channel);
            stmt.setString(2, envelope);
            stmt.execute();
        }
    }
}
