package com.p14n.livefeed.data;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The fixed set of event types. Each channel name is used both as the
 * {@code type} of a stream message and as the PostgreSQL notification channel
 * the event travels on.
 */
public enum EventType {

    ORDER_CREATED("order_created"),
    ORDER_STATUS_CHANGED("order_status_changed"),
    ORDER_ITEM_STATUS_CHANGED("order_item_status_changed"),
    KITCHEN_NOTIFICATION("kitchen_notification"),
    RESTAURANT_NOTIFICATION("restaurant_notification"),
    TABLE_STATUS_CHANGED("table_status_changed"),
    PAYMENT_COMPLETED("payment_completed");

    private static final Map<String, EventType> BY_CHANNEL = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(EventType::channel, Function.identity()));

    private final String channel;

    EventType(String channel) {
        this.channel = channel;
    }

    /**
     * @return the channel name, a valid unquoted SQL identifier
     */
    public String channel() {
        return channel;
    }

    /**
     * Resolves an event type from its channel name.
     *
     * @param channel the channel name
     * @return the matching event type
     * @throws IllegalArgumentException if no event type uses the channel
     */
    public static EventType fromChannel(String channel) {
        EventType type = channel == null ? null : BY_CHANNEL.get(channel);
        if (type == null) {
            throw new IllegalArgumentException("Unknown channel: " + channel);
        }
        return type;
    }
}
