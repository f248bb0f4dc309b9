package org.telemetrystore.interfaces;

import org.telemetrystore.model.CreatedSession;
import org.telemetrystore.model.SessionStatus;
import org.telemetrystore.model.Update;
import org.telemetrystore.model.UpdateRequest;

import java.util.List;

/**
 * Token-addressed, time-bounded sessions with bounded update history.
 * <p>
 * Expiry is lazy: a session past its expiry instant is removed by the first
 * access that notices it. Token lookups throw
 * {@link org.telemetrystore.errors.SessionNotFoundException} for unknown tokens and
 * {@link org.telemetrystore.errors.SessionExpiredException} for expired ones.
 * </p>
 */
public interface SessionStore {

    /** Mints a new session. */
    CreatedSession create();

    /** Live view of the session: timestamps, history count and latest update. */
    SessionStatus status(String token);

    /** Ordered copy of the retained updates, oldest first. */
    List<Update> history(String token);

    /**
     * Accepts one update.
     *
     * @throws org.telemetrystore.errors.InvalidPayloadException if it has neither location nor frame
     */
    void append(String token, UpdateRequest update);

    /** Removes the session regardless of expiry. */
    void close(String token);

    /** Number of sessions held, including expired ones not yet accessed. */
    int size();
}
