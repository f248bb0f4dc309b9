package org.telemetrystore.util;

import org.telemetrystore.interfaces.ExpiryPolicy;

import java.time.Duration;

/**
 * FixedTtlPolicy gives every session the same time-to-live, counted from creation.
 * <p>
 * <b>Notes:</b>
 * <ul>
 *   <li>Immutable and thread-safe.</li>
 *   <li>Expiry is strict: a session is live at exactly {@code createdAt + ttl}.</li>
 * </ul>
 */
public final class FixedTtlPolicy implements ExpiryPolicy {

    public static final Duration DEFAULT_TTL = Duration.ofHours(1);

    /** Time-to-live for every session. */
    private final Duration ttl;

    /**
     * Constructs a fixed TTL policy.
     *
     * @param ttl positive duration after creation before a session is expired
     */
    public FixedTtlPolicy(Duration ttl) {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive, was " + ttl);
        }
        this.ttl = ttl;
    }

    public static FixedTtlPolicy ofSeconds(long seconds) {
        return new FixedTtlPolicy(Duration.ofSeconds(seconds));
    }

    @Override
    public Duration ttl() {
        return ttl;
    }
}
