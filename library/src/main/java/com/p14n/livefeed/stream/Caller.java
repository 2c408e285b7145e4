package com.p14n.livefeed.stream;

import java.util.Set;

/**
 * The authenticated identity behind a stream, as resolved by the transport.
 *
 * @param callerId    opaque user identifier
 * @param tenantId    the restaurant the caller belongs to, null for platform
 *                    administrators that are not scoped to one
 * @param role        the caller's role, e.g. {@code restaurant_admin}
 * @param permissions permission names granted to the caller
 */
public record Caller(String callerId, String tenantId, String role, Set<String> permissions) {

    public static final String PLATFORM_ADMIN = "platform_admin";

    public Caller {
        if (callerId == null || callerId.isBlank()) {
            throw new IllegalArgumentException("callerId cannot be null or empty");
        }
        permissions = permissions == null ? Set.of() : Set.copyOf(permissions);
    }

    public boolean isPlatformAdmin() {
        return PLATFORM_ADMIN.equals(role);
    }
}
