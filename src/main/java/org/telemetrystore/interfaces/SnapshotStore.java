package org.telemetrystore.interfaces;

import java.io.IOException;

/**
 * Raw durable storage for one JSON snapshot document.
 */
public interface SnapshotStore {

    /** Load the current snapshot text, or null if there is none. */
    String load();

    /**
     * Replace the snapshot with {@code json}. Must be safe to call repeatedly
     * and must never leave a partially written document behind.
     */
    void save(String json) throws IOException;
}
