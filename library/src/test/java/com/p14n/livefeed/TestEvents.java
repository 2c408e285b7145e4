package com.p14n.livefeed;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.p14n.livefeed.data.Event;
import com.p14n.livefeed.data.EventIds;
import com.p14n.livefeed.data.EventType;

import java.time.Instant;

public class TestEvents {

    private TestEvents() {
    }

    public static ObjectNode orderPayload(String orderId, String status) {
        return JsonNodeFactory.instance.objectNode()
                .put("orderId", orderId)
                .put("status", status);
    }

    public static Event event(EventType type, String tenantId, Instant emittedAt) {
        return Event.create(EventIds.next(), type,
                orderPayload("order-1", "pending"), tenantId, emittedAt, null);
    }

    public static Event event(String tenantId) {
        return event(EventType.ORDER_CREATED, tenantId, Instant.now());
    }
}
