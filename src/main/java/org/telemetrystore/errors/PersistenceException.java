package org.telemetrystore.errors;

/**
 * A durable snapshot write failed after all retries.
 * The previous durable file is left untouched; the in-memory state keeps the mutation.
 */
public class PersistenceException extends RuntimeException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
