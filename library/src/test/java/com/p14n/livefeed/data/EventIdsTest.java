package com.p14n.livefeed.data;

import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.LongRange;
import net.jqwik.api.constraints.Size;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EventIdsTest {

    @Test
    void idsAreFixedWidthHex() {
        String id = EventIds.next();
        assertEquals(26, id.length());
        assertTrue(id.matches("^[0-9a-f]+$"));
    }

    @Test
    void idsInTheSameMillisecondKeepCreationOrder() {
        long now = System.currentTimeMillis() + 60_000;
        String first = EventIds.next(now);
        String second = EventIds.next(now);
        String third = EventIds.next(now);
        assertTrue(first.compareTo(second) < 0);
        assertTrue(second.compareTo(third) < 0);
    }

    @Property(tries = 50)
    void idsAreStrictlyIncreasingInGenerationOrder(
            @ForAll @Size(min = 2, max = 50) List<@LongRange(min = 0, max = 1L << 44) Long> millis) {
        List<String> ids = new ArrayList<>();
        for (Long m : millis) {
            ids.add(EventIds.next(m));
        }
        for (int i = 1; i < ids.size(); i++) {
            assertTrue(ids.get(i - 1).compareTo(ids.get(i)) < 0, ids.get(i - 1) + " !< " + ids.get(i));
        }
    }
}
