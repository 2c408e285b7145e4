package com.p14n.livefeed.data;

import java.time.Instant;

/**
 * An event as stored in the event log, with the time it was first replayed to
 * a client. {@code deliveredAt} is null until then.
 */
public record PendingEvent(Event event, Instant deliveredAt) {

    public boolean delivered() {
        return deliveredAt != null;
    }
}
