package org.telemetrystore.model;

import org.telemetrystore.util.UpdateBuffer;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Mutable per-token state held by the session store.
 * <p>
 * Instances are built only through {@link #open} (new sessions) and {@link #restore}
 * (snapshot recovery); the history buffer itself is never handed out, reads get
 * immutable copies. Not thread-safe: the store calls {@link #record} under its lock,
 * and callers outside the store see {@link SessionStatus} views instead.
 * </p>
 */
public final class Session {

    private final String token;
    private final Instant createdAt;
    private final Instant expiresAt;
    private final UpdateBuffer updates;
    private Instant lastSeen; // null until the first accepted update

    private Session(String token, Instant createdAt, Instant expiresAt,
                    Instant lastSeen, UpdateBuffer updates) {
        this.token = Objects.requireNonNull(token, "token");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.expiresAt = Objects.requireNonNull(expiresAt, "expiresAt");
        if (!expiresAt.isAfter(createdAt)) {
            throw new IllegalArgumentException("expiresAt must be after createdAt for " + token);
        }
        this.updates = updates;
        this.lastSeen = lastSeen;
    }

    /** A fresh session with no updates. */
    public static Session open(String token, Instant createdAt, Instant expiresAt, int capacity) {
        return new Session(token, createdAt, expiresAt, null, new UpdateBuffer(capacity));
    }

    /**
     * Rebuilds a session from persisted state. When {@code history} is longer than
     * {@code capacity} only its most recent entries are kept.
     */
    public static Session restore(String token, Instant createdAt, Instant expiresAt,
                                  Instant lastSeen, List<Update> history, int capacity) {
        UpdateBuffer buffer = new UpdateBuffer(capacity);
        history.forEach(buffer::append);
        return new Session(token, createdAt, expiresAt, lastSeen, buffer);
    }

    public String token()       { return token; }
    public Instant createdAt()  { return createdAt; }
    public Instant expiresAt()  { return expiresAt; }
    public Instant lastSeen()   { return lastSeen; }

    /** @return retained updates, oldest first, as an immutable copy */
    public List<Update> history() {
        return updates.snapshot();
    }

    public int historySize() {
        return updates.size();
    }

    /** Appends an accepted update and marks the session as seen at its timestamp. */
    public void record(Update update) {
        updates.append(update);
        lastSeen = update.ts();
    }

    public SessionStatus status(long ttlSeconds) {
        return new SessionStatus(token, createdAt, expiresAt, lastSeen,
                updates.size(), updates.latest().orElse(null), ttlSeconds);
    }

    @Override
    public String toString() {
        return "Session{" +
                "token='" + token + '\'' +
                ", createdAt=" + createdAt +
                ", expiresAt=" + expiresAt +
                ", lastSeen=" + lastSeen +
                ", updates=" + updates.size() +
                '}';
    }
}
