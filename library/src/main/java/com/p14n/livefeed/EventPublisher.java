package com.p14n.livefeed;

import com.fasterxml.jackson.databind.JsonNode;
import com.p14n.livefeed.bus.BusNotifier;
import com.p14n.livefeed.data.Event;
import com.p14n.livefeed.data.EventIds;
import com.p14n.livefeed.data.EventType;
import com.p14n.livefeed.eventlog.EventLog;
import com.p14n.livefeed.telemetry.StreamMetrics;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;

import static com.p14n.livefeed.telemetry.OpenTelemetryFunctions.serializeTraceContext;

/**
 * Entry point for business code that emits real-time events.
 *
 * <p>
 * Publishing writes the event to the event log first and only then announces
 * it on the notification bus. Once {@code publish} returns the event is
 * durable and will reach every eligible stream, live or through catchup. A
 * failed announcement is logged and never undoes the write.
 * </p>
 *
 * <pre>{@code
 * ObjectNode payload = mapper.createObjectNode().put("orderId", "o-42").put("status", "ready");
 * String id = publisher.publish(EventType.ORDER_STATUS_CHANGED, payload, restaurantId);
 * }</pre>
 */
public class EventPublisher {

    private static final Logger logger = LoggerFactory.getLogger(EventPublisher.class);

    private final EventLog eventLog;
    private final BusNotifier notifier;
    private final OpenTelemetry ot;
    private final Tracer tracer;
    private final StreamMetrics metrics;
    private final Clock clock;

    public EventPublisher(EventLog eventLog, BusNotifier notifier, OpenTelemetry ot) {
        this(eventLog, notifier, ot, Clock.systemUTC());
    }

    public EventPublisher(EventLog eventLog, BusNotifier notifier, OpenTelemetry ot, Clock clock) {
        this.eventLog = eventLog;
        this.notifier = notifier;
        this.ot = ot;
        this.tracer = ot.getTracer("livefeed-publisher");
        this.metrics = new StreamMetrics(ot.getMeter("livefeed"));
        this.clock = clock;
    }

    /**
     * Persists and announces an event.
     *
     * @param type     the event type, which is also its channel
     * @param payload  a JSON object passed through to clients unchanged
     * @param tenantId the restaurant the event belongs to
     * @return the new event id
     * @throws SQLException             if the event could not be persisted
     * @throws IllegalArgumentException if a field is missing or the payload is
     *                                  not a JSON object
     */
    public String publish(EventType type, JsonNode payload, String tenantId) throws SQLException {
        return publish(null, type, payload, tenantId);
    }

    /**
     * Persists and announces the event on the caller's connection, so both
     * commit or roll back with the caller's transaction. PostgreSQL holds the
     * notification until commit, so live streams only ever see stored events.
     * A failed notification on the caller's connection is thrown, since it
     * leaves that transaction aborted.
     *
     * @param connection the caller's connection, or null to use the pool
     */
    public String publish(Connection connection, EventType type, JsonNode payload, String tenantId)
            throws SQLException {
        Span span = tracer.spanBuilder("publish_event")
                .setAttribute("channel", type == null ? "" : type.channel())
                .setAttribute("tenant", tenantId == null ? "" : tenantId)
                .startSpan();
        try (Scope scope = span.makeCurrent()) {
            Event event = Event.create(EventIds.next(), type, payload, tenantId, clock.instant(),
                    serializeTraceContext(ot));
            span.setAttribute("event.id", event.id());
            boolean announced;
            if (connection == null) {
                eventLog.append(event);
                metrics.recordPublished(event.topic());
                announced = notifier.notify(event);
            } else {
                eventLog.append(connection, event);
                metrics.recordPublished(event.topic());
                announced = notifier.notify(connection, event);
            }
            if (!announced) {
                logger.atWarn()
                        .addArgument(event.id())
                        .addArgument(event.topic())
                        .log("Event {} stored but not announced on {}; it will be delivered by catchup");
            }
            logger.atDebug()
                    .addArgument(event.id())
                    .addArgument(event.topic())
                    .addArgument(tenantId)
                    .log("Published event {} on {} for tenant {}");
            return event.id();
        } catch (SQLException | RuntimeException e) {
            span.recordException(e);
            logger.atError()
                    .setCause(e)
                    .addArgument(type)
                    .addArgument(tenantId)
                    .log("Failed to publish {} event for tenant {}");
            throw e;
        } finally {
            span.end();
        }
    }
}
