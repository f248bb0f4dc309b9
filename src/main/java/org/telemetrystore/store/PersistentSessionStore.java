package org.telemetrystore.store;

import org.telemetrystore.config.PersistenceFailurePolicy;
import org.telemetrystore.errors.InvalidPayloadException;
import org.telemetrystore.errors.PersistenceException;
import org.telemetrystore.errors.SessionExpiredException;
import org.telemetrystore.errors.SessionNotFoundException;
import org.telemetrystore.errors.SnapshotWriteException;
import org.telemetrystore.interfaces.ExpiryPolicy;
import org.telemetrystore.interfaces.SessionStore;
import org.telemetrystore.interfaces.TokenGenerator;
import org.telemetrystore.interfaces.WriteRetrier;
import org.telemetrystore.model.CreatedSession;
import org.telemetrystore.model.Session;
import org.telemetrystore.model.SessionStatus;
import org.telemetrystore.model.Update;
import org.telemetrystore.model.UpdateRequest;
import org.telemetrystore.persistence.SessionPersistence;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Session store that mirrors every mutation to durable storage.
 * <p>
 * <b>Design notes:</b>
 * <ul>
 *   <li>One store-wide lock covers lookup, expiry check, mutation and the snapshot
 *       write, so each saved snapshot is a consistent view of the whole mapping.</li>
 *   <li>Expiry is evaluated against the injected {@link Clock} on every access; there is
 *       no sweeper thread.</li>
 *   <li>Write failures are retried, then handled per {@link PersistenceFailurePolicy}.
 *       The in-memory mutation is kept, except for a session whose creation could
 *       not be saved under {@code FAIL}: its token is never returned, so it is dropped.</li>
 * </ul>
 */
public final class PersistentSessionStore implements SessionStore {

    static final int MAX_TOKEN_ATTEMPTS = 16;

    private final Map<String, Session> sessions;
    private final ReentrantLock lock = new ReentrantLock();

    private final SessionPersistence persistence;
    private final TokenGenerator tokens;
    private final ExpiryPolicy expiry;
    private final Clock clock;
    private final WriteRetrier writes;
    private final PersistenceFailurePolicy failurePolicy;

    /**
     * Loads the durable snapshot once and adopts it as the initial mapping.
     */
    public PersistentSessionStore(SessionPersistence persistence,
                                  TokenGenerator tokens,
                                  ExpiryPolicy expiry,
                                  Clock clock,
                                  WriteRetrier writes,
                                  PersistenceFailurePolicy failurePolicy) {
        this.persistence = persistence;
        this.tokens = tokens;
        this.expiry = expiry;
        this.clock = clock;
        this.writes = writes;
        this.failurePolicy = failurePolicy;
        this.sessions = new HashMap<>(persistence.load());
        System.out.println("[Store] started with " + sessions.size() + " session(s), ttl=" + expiry.ttl());
    }

    @Override
    public CreatedSession create() {
        lock.lock();
        try {
            String token = mintUnusedToken();
            Instant now = clock.instant();
            Session s = Session.open(token, now, expiry.expiresAt(now), persistence.capacity());
            sessions.put(token, s);
            try {
                persist("create");
            } catch (PersistenceException e) {
                // the caller never learns this token, so the session must not linger
                sessions.remove(token);
                throw e;
            }
            System.out.println("[Store] created session expiring at " + s.expiresAt());
            return new CreatedSession(token, s.expiresAt(), ttlSeconds());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public SessionStatus status(String token) {
        lock.lock();
        try {
            return ensureLive(token).status(ttlSeconds());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<Update> history(String token) {
        lock.lock();
        try {
            return ensureLive(token).history();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void append(String token, UpdateRequest update) {
        lock.lock();
        try {
            Session s = ensureLive(token);
            if (update == null || !update.hasPayload()) {
                throw new InvalidPayloadException("No frame or location data supplied");
            }
            s.record(update.stamp(clock.instant()));
            persist("append");
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close(String token) {
        lock.lock();
        try {
            if (token == null || sessions.remove(token) == null) {
                throw new SessionNotFoundException(token);
            }
            persist("close");
            System.out.println("[Store] closed session, " + sessions.size() + " remaining");
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int size() {
        lock.lock();
        try {
            return sessions.size();
        } finally {
            lock.unlock();
        }
    }

    public long ttlSeconds() {
        return expiry.ttl().getSeconds();
    }

    /* ------------------------------ internals (lock held) ------------------------------ */

    /** Looks up a session, evicting and reporting it if its TTL has elapsed. */
    private Session ensureLive(String token) {
        Session s = token == null ? null : sessions.get(token);
        if (s == null) {
            throw new SessionNotFoundException(token);
        }
        if (expiry.isExpired(s.expiresAt(), clock.instant())) {
            sessions.remove(token);
            persist("expire");
            System.out.println("[Store] evicted expired session (expired at " + s.expiresAt() + ")");
            throw new SessionExpiredException(token, s.expiresAt());
        }
        return s;
    }

    /** A clash with a live token is a generator anomaly, so only a few retries are allowed. */
    private String mintUnusedToken() {
        for (int i = 0; i < MAX_TOKEN_ATTEMPTS; i++) {
            String t = tokens.newToken();
            if (!sessions.containsKey(t)) {
                return t;
            }
            System.err.println("[Store] token collision on attempt " + (i + 1) + ", regenerating");
        }
        throw new IllegalStateException("token generator produced " + MAX_TOKEN_ATTEMPTS + " colliding tokens");
    }

    private void persist(String cause) {
        try {
            writes.write(() -> persistence.save(sessions));
        } catch (IOException e) {
            int attempts = e instanceof SnapshotWriteException ? ((SnapshotWriteException) e).attempts() : 1;
            if (failurePolicy == PersistenceFailurePolicy.FAIL) {
                throw new PersistenceException("snapshot write failed after " + cause
                        + " (" + attempts + " attempt(s))", e.getCause() != null ? e.getCause() : e);
            }
            System.err.println("[Store] snapshot write failed after " + cause + " (" + attempts
                    + " attempt(s)), continuing in memory: " + e.getMessage());
        }
    }
}
