package org.telemetrystore.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class UpdateTest {

    private static final Instant TS = Instant.parse("2026-10-19T09:00:00Z");

    @Test
    void onlyImageDataUrisCountAsFrames() {
        assertEquals("data:image/png;base64,AA", Update.imageFrameOrNull("data:image/png;base64,AA"));
        assertNull(Update.imageFrameOrNull("javascript:alert(1)"));
        assertNull(Update.imageFrameOrNull("data:text/html,<b>x</b>"));
        assertNull(Update.imageFrameOrNull(null));
    }

    @Test
    void requestWithOnlyABadFrameHasNoPayload() {
        UpdateRequest r = UpdateRequest.ofFrame("hello");
        assertNull(r.frame());
        assertFalse(r.hasPayload());
        assertTrue(UpdateRequest.ofFrame("data:image/jpeg;base64,/9j/").hasPayload());
    }

    @Test
    void updateDropsANonImageFrame() {
        Update u = new Update(TS, Location.of(1, 2), "https://example.org/cat.jpg", null);
        assertNull(u.frame());
        assertSame(UpdateMeta.EMPTY, u.meta());
    }

    @Test
    void sessionHistoryIsACopy() {
        Session s = Session.open("tok", TS, TS.plusSeconds(60), 2);
        s.record(new Update(TS.plusSeconds(1), Location.of(1, 1), null, UpdateMeta.EMPTY));

        assertThrows(UnsupportedOperationException.class, () -> s.history().clear());
        assertEquals(1, s.historySize());
        assertEquals(TS.plusSeconds(1), s.lastSeen());
    }
}
