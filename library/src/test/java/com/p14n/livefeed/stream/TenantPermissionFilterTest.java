package com.p14n.livefeed.stream;

import com.p14n.livefeed.data.Event;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.AlphaChars;
import net.jqwik.api.constraints.StringLength;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static com.p14n.livefeed.TestEvents.event;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TenantPermissionFilterTest {

    private final TenantPermissionFilter filter = new TenantPermissionFilter();

    @Test
    void staffReceiveTheirOwnTenant() {
        Caller waiter = new Caller("u1", "r1", "waiter", Set.of());
        assertTrue(filter.canReceive(waiter, event("r1")));
        assertFalse(filter.canReceive(waiter, event("r2")));
    }

    @Test
    void everyRoleInTheTenantReceives() {
        for (String role : new String[] { "restaurant_admin", "kitchen", "cashier", "waiter", null }) {
            assertTrue(filter.canReceive(new Caller("u1", "r1", role, Set.of()), event("r1")));
        }
    }

    @Test
    void platformAdminReceivesEveryTenant() {
        Caller admin = new Caller("admin", null, Caller.PLATFORM_ADMIN, Set.of());
        assertTrue(filter.canReceive(admin, event("r1")));
        assertTrue(filter.canReceive(admin, event("r2")));
    }

    @Test
    void callerWithoutTenantReceivesNothing() {
        assertFalse(filter.canReceive(new Caller("u1", null, "waiter", Set.of()), event("r1")));
    }

    @Property
    void nonAdminsNeverSeeOtherTenants(@ForAll @AlphaChars @StringLength(min = 1, max = 8) String callerTenant,
            @ForAll @AlphaChars @StringLength(min = 1, max = 8) String eventTenant,
            @ForAll @AlphaChars @StringLength(min = 1, max = 12) String role) {
        Caller caller = new Caller("u1", callerTenant, role, Set.of());
        Event e = event(eventTenant);
        boolean expected = role.equals(Caller.PLATFORM_ADMIN) || callerTenant.equals(eventTenant);
        assertEquals(expected, filter.canReceive(caller, e));
    }
}
