package org.telemetrystore.interfaces;

/**
 * Source of session tokens.
 * A token is the only credential needed to read or append to a session,
 * so implementations must be unguessable and URL-safe.
 */
public interface TokenGenerator {

    /**
     * Returns a fresh token. Never null, never blank.
     */
    String newToken();
}
