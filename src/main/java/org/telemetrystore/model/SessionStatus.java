package org.telemetrystore.model;

import java.time.Instant;
import java.util.Optional;

/**
 * Point-in-time view of a live session as served to a monitor.
 * {@code lastSeen} and {@code latest} are null until the first accepted update.
 */
public record SessionStatus(String token,
                            Instant createdAt,
                            Instant expiresAt,
                            Instant lastSeen,
                            int historyCount,
                            Update latest,
                            long ttlSeconds) {

    public Optional<Update> latestUpdate() {
        return Optional.ofNullable(latest);
    }
}
