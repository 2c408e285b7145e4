package com.p14n.livefeed.telemetry;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongUpDownCounter;
import io.opentelemetry.api.metrics.Meter;

/**
 * OpenTelemetry instruments for the live feed.
 *
 * <ul>
 * <li>events_published: events durably written, per channel</li>
 * <li>events_delivered: frames written to a client stream, per channel</li>
 * <li>events_replayed: events written during catchup, per channel</li>
 * <li>stream_write_failures: writes that closed a connection</li>
 * <li>active_connections: currently registered streams</li>
 * <li>bus_reconnects: notification listener reconnect attempts</li>
 * </ul>
 */
public class StreamMetrics {

        private static final AttributeKey<String> CHANNEL = AttributeKey.stringKey("channel");

        private final LongCounter publishedEvents;
        private final LongCounter deliveredEvents;
        private final LongCounter replayedEvents;
        private final LongCounter writeFailures;
        private final LongUpDownCounter activeConnections;
        private final LongCounter busReconnects;

        public StreamMetrics(Meter meter) {
                publishedEvents = meter.counterBuilder("events_published")
                                .setDescription("Number of events written to the event log")
                                .build();

                deliveredEvents = meter.counterBuilder("events_delivered")
                                .setDescription("Number of live event frames written to client streams")
                                .build();

                replayedEvents = meter.counterBuilder("events_replayed")
                                .setDescription("Number of event frames written during catchup")
                                .build();

                writeFailures = meter.counterBuilder("stream_write_failures")
                                .setDescription("Number of stream writes that failed and closed the connection")
                                .build();

                activeConnections = meter.upDownCounterBuilder("active_connections")
                                .setDescription("Number of open client streams")
                                .build();

                busReconnects = meter.counterBuilder("bus_reconnects")
                                .setDescription("Number of notification listener reconnect attempts")
                                .build();
        }

        public void recordPublished(String channel) {
                publishedEvents.add(1, Attributes.of(CHANNEL, channel));
        }

        public void recordDelivered(String channel) {
                deliveredEvents.add(1, Attributes.of(CHANNEL, channel));
        }

        public void recordReplayed(String channel) {
                replayedEvents.add(1, Attributes.of(CHANNEL, channel));
        }

        public void recordWriteFailure() {
                writeFailures.add(1);
        }

        public void recordConnectionOpened() {
                activeConnections.add(1);
        }

        public void recordConnectionClosed() {
                activeConnections.add(-1);
        }

        public void recordReconnect() {
                busReconnects.add(1);
        }
}
