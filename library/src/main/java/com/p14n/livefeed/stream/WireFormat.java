package com.p14n.livefeed.stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.p14n.livefeed.data.Event;

/**
 * Builds the {@code text/event-stream} frames written to clients. Each frame
 * is a single {@code data:} line of JSON followed by a blank line; Jackson
 * escapes newlines inside strings so a frame never spans lines.
 */
public class WireFormat {

    public static final String CONNECTION_TYPE = "connection";
    public static final String CONNECTED_MESSAGE = "Connected to real-time updates";
    public static final String KEEP_ALIVE_FRAME = ": keep-alive\n\n";

    private final ObjectMapper mapper;

    public WireFormat() {
        this(new ObjectMapper());
    }

    public WireFormat(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public String connectionFrame(String connectionId, long timestampMillis) {
        ObjectNode root = mapper.createObjectNode();
        root.put("type", CONNECTION_TYPE);
        ObjectNode data = root.putObject("data");
        data.put("connectionId", connectionId);
        data.put("timestamp", timestampMillis);
        data.put("message", CONNECTED_MESSAGE);
        return frame(root);
    }

    public String eventFrame(Event event) {
        ObjectNode root = mapper.createObjectNode();
        root.put("type", event.type().channel());
        root.set("data", event.payload());
        root.put("timestamp", event.emittedAt().toEpochMilli());
        return frame(root);
    }

    private String frame(ObjectNode node) {
        try {
            return "data: " + mapper.writeValueAsString(node) + "\n\n";
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialise frame", e);
        }
    }
}
