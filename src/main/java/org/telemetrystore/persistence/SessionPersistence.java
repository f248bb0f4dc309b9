package org.telemetrystore.persistence;

import org.telemetrystore.interfaces.SnapshotStore;
import org.telemetrystore.model.Session;

import java.io.IOException;
import java.util.Map;

/**
 * Durable mirror of the whole session mapping: a {@link SessionSnapshotCodec}
 * over a {@link SnapshotStore}.
 */
public final class SessionPersistence {

    private final SnapshotStore snapshots;
    private final SessionSnapshotCodec codec;

    public SessionPersistence(SnapshotStore snapshots, SessionSnapshotCodec codec) {
        this.snapshots = snapshots;
        this.codec = codec;
    }

    /**
     * Recovers every readable session. A missing or malformed file yields an
     * empty map; malformed records are skipped.
     */
    public Map<String, Session> load() {
        Map<String, Session> loaded = codec.decode(snapshots.load());
        System.out.println("[Persist] recovered " + loaded.size() + " session(s)");
        return loaded;
    }

    /**
     * Serializes and atomically replaces the durable snapshot.
     *
     * @throws IOException if the durable write fails; the previous snapshot stays intact
     */
    public void save(Map<String, Session> sessions) throws IOException {
        snapshots.save(codec.encode(sessions));
    }

    public int capacity() {
        return codec.capacity();
    }
}
