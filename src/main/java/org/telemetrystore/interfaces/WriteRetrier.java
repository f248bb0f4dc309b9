package org.telemetrystore.interfaces;

import java.io.IOException;

/**
 * Runs a durable write, repeating it while it fails with {@link IOException}.
 */
public interface WriteRetrier {

    /** A write against durable storage. */
    @FunctionalInterface
    interface DurableWrite {
        void run() throws IOException;
    }

    /**
     * @return the number of attempts the write took (1 if it succeeded first time)
     * @throws org.telemetrystore.errors.SnapshotWriteException once every attempt failed;
     *         it carries the attempt count and the last failure as cause
     * @throws java.io.InterruptedIOException if interrupted while waiting between attempts
     */
    int write(DurableWrite write) throws IOException;
}
