package com.p14n.livefeed.bus;

/**
 * Exponential delay sequence: initial, 2x, 4x ... capped at a maximum.
 * Not thread safe; each retry loop owns its own instance.
 */
public class Backoff {

    private final long initialMillis;
    private final long maxMillis;
    private long next;

    public Backoff(long initialMillis, long maxMillis) {
        if (initialMillis <= 0 || maxMillis < initialMillis) {
            throw new IllegalArgumentException("Backoff needs 0 < initial <= max");
        }
        this.initialMillis = initialMillis;
        this.maxMillis = maxMillis;
        this.next = initialMillis;
    }

    public long nextDelayMillis() {
        long delay = next;
        next = Math.min(next * 2, maxMillis);
        return delay;
    }

    public void reset() {
        next = initialMillis;
    }
}
