package org.telemetrystore.interfaces;

import java.time.Duration;
import java.time.Instant;

public interface ExpiryPolicy {

    Duration ttl();

    /** Expiry instant for a session created at {@code createdAt}. */
    default Instant expiresAt(Instant createdAt) {
        return createdAt.plus(ttl());
    }

    /** Strict comparison: a session is still live at exactly {@code expiresAt}. */
    default boolean isExpired(Instant expiresAt, Instant now) {
        return now.isAfter(expiresAt);
    }
}
