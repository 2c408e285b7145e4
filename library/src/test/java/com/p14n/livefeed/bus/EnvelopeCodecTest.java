package com.p14n.livefeed.bus;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.p14n.livefeed.data.Event;
import com.p14n.livefeed.data.EventType;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static com.p14n.livefeed.TestEvents.orderPayload;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class EnvelopeCodecTest {

    private final EnvelopeCodec codec = new EnvelopeCodec();
    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void envelopeCarriesEveryField() throws Exception {
        Event event = Event.create("evt-1", EventType.ORDER_STATUS_CHANGED, orderPayload("o-1", "ready"), "r1",
                Instant.ofEpochMilli(1_700_000_000_123L), "00-0af7651916cd43dd8448eb211c80319c-b7ad6b7169203331-01");

        JsonNode envelope = mapper.readTree(codec.encode(event));

        assertEquals("evt-1", envelope.get("eventId").asText());
        assertEquals("order_status_changed", envelope.get("eventType").asText());
        assertEquals("ready", envelope.get("payload").get("status").asText());
        assertEquals("r1", envelope.get("tenantId").asText());
        assertEquals(1_700_000_000_123L, envelope.get("emittedAt").asLong());

        Event decoded = codec.decode("order_status_changed", codec.encode(event));
        assertEquals(event, decoded);
    }

    @Test
    void traceparentIsOptional() throws Exception {
        Event event = Event.create("evt-2", EventType.ORDER_CREATED, orderPayload("o-2", "pending"), "r1",
                Instant.ofEpochMilli(1_700_000_000_000L), null);
        String json = codec.encode(event);
        assertFalse(mapper.readTree(json).has("traceparent"));
        assertNull(codec.decode("order_created", json).traceparent());
    }

    @Test
    void rejectsMalformedPayloads() {
        assertThrows(IllegalArgumentException.class, () -> codec.decode("order_created", "not json"));
        assertThrows(IllegalArgumentException.class, () -> codec.decode("order_created", "[1,2]"));
        assertThrows(IllegalArgumentException.class, () -> codec.decode("order_created",
                "{\"eventId\":\"e\",\"eventType\":\"order_created\",\"payload\":{},\"tenantId\":\"r1\"}"));
        assertThrows(IllegalArgumentException.class, () -> codec.decode("order_created",
                "{\"eventId\":\"e\",\"eventType\":\"order_exploded\",\"payload\":{},\"tenantId\":\"r1\",\"emittedAt\":1}"));
    }

    @Test
    void rejectsEnvelopeOnTheWrongChannel() {
        String json = "{\"eventId\":\"e\",\"eventType\":\"order_created\",\"payload\":{},\"tenantId\":\"r1\",\"emittedAt\":1}";
        assertThrows(IllegalArgumentException.class, () -> codec.decode("payment_completed", json));
    }
}
