package com.p14n.livefeed.data;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Record representing an event emitted by business logic for delivery to
 * connected clients.
 */
public record Event(String id,
                    EventType type,
                    JsonNode payload,
                    String tenantId,
                    Instant emittedAt,
                    String traceparent) implements Traceable {

    /**
     * Creates a new Event instance with validation of required fields.
     * The emission time is truncated to milliseconds so that it compares exactly
     * with the epoch-millisecond checkpoints clients send back.
     *
     * @throws IllegalArgumentException if any required field is null or empty
     */
    public static Event create(String id, EventType type, JsonNode payload, String tenantId, Instant emittedAt,
            String traceparent) {
        if (id == null || id.trim().isEmpty()) {
            throw new IllegalArgumentException("id cannot be null or empty");
        }
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (payload == null || !payload.isObject()) {
            throw new IllegalArgumentException("payload must be a JSON object");
        }
        if (tenantId == null || tenantId.trim().isEmpty()) {
            throw new IllegalArgumentException("tenantId cannot be null or empty");
        }
        if (emittedAt == null) {
            throw new IllegalArgumentException("emittedAt cannot be null");
        }
        return new Event(id, type, payload, tenantId, emittedAt.truncatedTo(ChronoUnit.MILLIS), traceparent);
    }

    @Override
    public String topic() {
        return type.channel();
    }

    @Override
    public String subject() {
        return tenantId;
    }
}
