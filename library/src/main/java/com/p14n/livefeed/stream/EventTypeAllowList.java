package com.p14n.livefeed.stream;

import com.p14n.livefeed.data.Event;
import com.p14n.livefeed.data.EventType;

import java.util.EnumSet;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Restricts listed roles to a set of event types. Roles without an entry,
 * and platform administrators, are not restricted. Meant to be layered on a
 * {@link TenantPermissionFilter} with {@link PermissionFilter#and}.
 */
public class EventTypeAllowList implements PermissionFilter {

    private final Map<String, Set<EventType>> allowed = new HashMap<>();

    public EventTypeAllowList allow(String role, EventType first, EventType... rest) {
        allowed.put(role, EnumSet.of(first, rest));
        return this;
    }

    @Override
    public boolean canReceive(Caller caller, Event event) {
        if (caller.isPlatformAdmin()) {
            return true;
        }
        Set<EventType> types = allowed.get(caller.role());
        return types == null || types.contains(event.type());
    }
}
