package org.telemetrystore.model;

import java.time.Instant;

/** Result of minting a session. */
public record CreatedSession(String token, Instant expiresAt, long ttlSeconds) {}
