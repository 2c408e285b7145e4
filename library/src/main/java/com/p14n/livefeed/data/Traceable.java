package com.p14n.livefeed.data;

/**
 * Interface for objects that can be traced and identified in a distributed
 * system.
 * Provides the attributes used to name spans and to correlate the publishing
 * side of an event with its fan-out.
 *
 * <p>
 * Key attributes:
 * </p>
 * <ul>
 * <li>{@code id}: Unique identifier for the traceable object</li>
 * <li>{@code topic}: Channel the object travels on</li>
 * <li>{@code subject}: Tenant the object belongs to</li>
 * <li>{@code traceparent}: OpenTelemetry trace context identifier</li>
 * </ul>
 */
public interface Traceable {

    /**
     * Returns the unique identifier of the traceable object.
     *
     * @return the unique identifier string
     */
    String id();

    /**
     * Returns the channel name used for routing.
     *
     * @return the topic string
     */
    String topic();

    /**
     * Returns the tenant or entity identifier.
     *
     * @return the subject string
     */
    String subject();

    /**
     * Returns the OpenTelemetry trace parent identifier for distributed tracing.
     *
     * @return the trace parent string
     */
    String traceparent();
}
