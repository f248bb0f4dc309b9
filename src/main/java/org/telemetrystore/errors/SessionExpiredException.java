package org.telemetrystore.errors;

import java.time.Instant;

/**
 * The token existed but its TTL elapsed. The session has been removed, so the
 * next access with the same token gets {@link SessionNotFoundException}.
 */
public class SessionExpiredException extends RuntimeException {

    private final String token;
    private final Instant expiredAt;

    public SessionExpiredException(String token, Instant expiredAt) {
        super("Session expired");
        this.token = token;
        this.expiredAt = expiredAt;
    }

    public String token() {
        return token;
    }

    public Instant expiredAt() {
        return expiredAt;
    }
}
