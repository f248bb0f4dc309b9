package org.telemetrystore.errors;

import java.io.IOException;

/**
 * Every attempt at a durable snapshot write failed. The cause is the last
 * failure; earlier failures are attached as suppressed exceptions.
 */
public class SnapshotWriteException extends IOException {

    private final int attempts;

    public SnapshotWriteException(int attempts, IOException last) {
        super("snapshot write failed after " + attempts + " attempt(s): " + last.getMessage(), last);
        this.attempts = attempts;
    }

    public int attempts() {
        return attempts;
    }
}
