package com.p14n.livefeed.bus;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.p14n.livefeed.data.Event;
import com.p14n.livefeed.data.EventType;

import java.time.Instant;

/**
 * Converts events to and from the JSON envelope carried as a notification
 * payload:
 *
 * <pre>
 * {"eventId":..., "eventType":..., "payload":{...}, "tenantId":..., "emittedAt":millis, "traceparent":...}
 * </pre>
 */
public class EnvelopeCodec {

    private final ObjectMapper mapper;

    public EnvelopeCodec() {
        this(new ObjectMapper());
    }

    public EnvelopeCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public String encode(Event event) {
        ObjectNode envelope = mapper.createObjectNode();
        envelope.put("eventId", event.id());
        envelope.put("eventType", event.type().channel());
        envelope.set("payload", event.payload());
        envelope.put("tenantId", event.tenantId());
        envelope.put("emittedAt", event.emittedAt().toEpochMilli());
        if (event.traceparent() != null) {
            envelope.put("traceparent", event.traceparent());
        }
        try {
            return mapper.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode envelope for event " + event.id(), e);
        }
    }

    /**
     * Decodes a notification received on a channel.
     *
     * @param channel the channel the notification arrived on
     * @param json    the notification payload
     * @return the event
     * @throws IllegalArgumentException if the payload is not a valid envelope or
     *                                  names a different channel
     */
    public Event decode(String channel, String json) {
        JsonNode envelope;
        try {
            envelope = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Notification on " + channel + " is not JSON", e);
        }
        if (envelope == null || !envelope.isObject()) {
            throw new IllegalArgumentException("Notification on " + channel + " is not a JSON object");
        }
        EventType type = EventType.fromChannel(text(envelope, "eventType"));
        if (!type.channel().equals(channel)) {
            throw new IllegalArgumentException("Envelope type " + type.channel() + " arrived on channel " + channel);
        }
        JsonNode emittedAt = envelope.get("emittedAt");
        if (emittedAt == null || !emittedAt.canConvertToLong()) {
            throw new IllegalArgumentException("Envelope on " + channel + " has no emittedAt");
        }
        return Event.create(
                text(envelope, "eventId"),
                type,
                envelope.get("payload"),
                text(envelope, "tenantId"),
                Instant.ofEpochMilli(emittedAt.asLong()),
                text(envelope, "traceparent"));
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
