package org.telemetrystore.util;

import org.telemetrystore.model.Location;
import org.telemetrystore.model.Update;
import org.telemetrystore.model.UpdateMeta;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class UpdateBufferTest {

    private static Update at(int i) {
        return new Update(Instant.ofEpochSecond(1_700_000_000L + i), Location.of(i, -i), null, UpdateMeta.EMPTY);
    }

    @Test
    void emptyBufferHasNoLatest() {
        UpdateBuffer b = new UpdateBuffer();
        assertEquals(0, b.size());
        assertTrue(b.isEmpty());
        assertTrue(b.latest().isEmpty());
        assertTrue(b.snapshot().isEmpty());
        assertEquals(200, b.capacity());
    }

    @Test
    void keepsArrivalOrderBelowCapacity() {
        UpdateBuffer b = new UpdateBuffer(5);
        for (int i = 1; i <= 3; i++) b.append(at(i));

        assertEquals(3, b.size());
        assertEquals(at(3), b.latest().orElseThrow());
        assertEquals(List.of(at(1), at(2), at(3)), b.snapshot());
    }

    @Test
    void evictsOldestOnceFull() {
        UpdateBuffer b = new UpdateBuffer(200);
        for (int i = 1; i <= 450; i++) b.append(at(i));

        assertEquals(200, b.size());
        List<Update> snap = b.snapshot();
        assertEquals(at(251), snap.get(0));
        assertEquals(at(450), snap.get(199));
        for (int i = 0; i < snap.size(); i++) {
            assertEquals(at(251 + i), snap.get(i));
        }
        assertEquals(at(450), b.latest().orElseThrow());
    }

    @Test
    void capacityOfOneKeepsOnlyTheLatest() {
        UpdateBuffer b = new UpdateBuffer(1);
        b.append(at(1));
        b.append(at(2));
        assertEquals(List.of(at(2)), b.snapshot());
    }

    @Test
    void snapshotIsACopy() {
        UpdateBuffer b = new UpdateBuffer(3);
        b.append(at(1));
        List<Update> snap = b.snapshot();
        b.append(at(2));

        assertEquals(1, snap.size());
        assertThrows(UnsupportedOperationException.class, () -> snap.add(at(9)));
    }

    @Test
    void rejectsBadInput() {
        assertThrows(IllegalArgumentException.class, () -> new UpdateBuffer(0));
        assertThrows(IllegalArgumentException.class, () -> new UpdateBuffer(2).append(null));
    }
}
