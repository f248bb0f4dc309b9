package org.telemetrystore.config;

/** What the store does when a durable snapshot write fails after retries. */
public enum PersistenceFailurePolicy {
    /** Log the failure and keep serving from memory. */
    DEGRADE,
    /** Surface the failure to the caller as a {@code PersistenceException}. */
    FAIL
}
