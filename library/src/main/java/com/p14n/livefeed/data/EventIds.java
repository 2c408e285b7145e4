package com.p14n.livefeed.data;

import java.security.SecureRandom;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Generates time-sortable event identifiers.
 *
 * <p>
 * Identifiers are 26 lowercase hex characters: 12 for the millisecond
 * timestamp, 6 for a per-process counter and 8 random. Within one process the
 * counter keeps identifiers generated in the same millisecond in creation
 * order, so lexical order matches emission order.
 * </p>
 */
public class EventIds {

    private static final SecureRandom RANDOM = new SecureRandom();
    private static final AtomicLong LAST = new AtomicLong();

    private EventIds() {
    }

    public static String next() {
        return next(System.currentTimeMillis());
    }

    static String next(long millis) {
        // packs millis (high) and a 24-bit counter (low); never goes backwards
        long packed = LAST.updateAndGet(prev -> {
            long candidate = millis << 24;
            return candidate > prev ? candidate : prev + 1;
        });
        long time = packed >>> 24;
        long counter = packed & 0xFFFFFF;
        return String.format("%012x%06x%08x", time, counter, RANDOM.nextInt() & 0xFFFFFFFFL);
    }
}
