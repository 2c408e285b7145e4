package com.p14n.livefeed.stream;

import com.p14n.livefeed.data.Event;

/**
 * Platform administrators receive every event; everyone else receives the
 * events of their own tenant, whatever their role.
 */
public class TenantPermissionFilter implements PermissionFilter {

    @Override
    public boolean canReceive(Caller caller, Event event) {
        if (caller.isPlatformAdmin()) {
            return true;
        }
        return caller.tenantId() != null && caller.tenantId().equals(event.tenantId());
    }
}
