package com.p14n.livefeed.catchup;

import java.time.Instant;

/**
 * What a newly opened stream asks to have replayed before live delivery
 * starts.
 *
 * <ul>
 * <li>{@link Mode#SINCE}: every event emitted after {@code since}, whether or
 * not another stream has already been sent it. With no checkpoint nothing is
 * replayed.</li>
 * <li>{@link Mode#UNDELIVERED}: events never marked delivered, limited to those
 * after {@code since} when a checkpoint is given.</li>
 * </ul>
 */
public record CatchupQuery(Instant since, Mode mode) {

    public enum Mode {
        SINCE,
        UNDELIVERED
    }

    public CatchupQuery {
        if (mode == null) {
            throw new IllegalArgumentException("mode cannot be null");
        }
    }

    public static CatchupQuery none() {
        return new CatchupQuery(null, Mode.SINCE);
    }

    public static CatchupQuery since(Instant since) {
        return new CatchupQuery(since, Mode.SINCE);
    }

    public static CatchupQuery undelivered(Instant since) {
        return new CatchupQuery(since, Mode.UNDELIVERED);
    }

    public boolean requested() {
        return mode == Mode.UNDELIVERED || since != null;
    }
}
