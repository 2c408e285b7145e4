package com.p14n.livefeed.stream;

import com.p14n.livefeed.data.Event;

/**
 * Decides whether an event may be written to a caller's stream.
 */
@FunctionalInterface
public interface PermissionFilter {

    boolean canReceive(Caller caller, Event event);

    /**
     * @return a filter that passes only events both filters pass
     */
    default PermissionFilter and(PermissionFilter other) {
        return (caller, event) -> canReceive(caller, event) && other.canReceive(caller, event);
    }
}
