package com.p14n.livefeed.eventlog;

import java.time.Instant;

/**
 * Counts of pending and delivered events, and the emission time of the oldest
 * event still waiting for delivery (null when none is).
 */
public record EventLogStats(long totalPending, long totalDelivered, Instant oldestPending) {
}
