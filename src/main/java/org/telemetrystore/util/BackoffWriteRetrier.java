package org.telemetrystore.util;

import org.telemetrystore.errors.SnapshotWriteException;
import org.telemetrystore.interfaces.WriteRetrier;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Duration;

/**
 * Retries durable writes with a doubling pause between attempts.
 * <p>
 * The store calls this while holding its lock, so every other operation waits
 * out the pauses; keep {@code maxDelay} in the tens of milliseconds.
 * </p>
 */
public final class BackoffWriteRetrier implements WriteRetrier {

    private final int maxAttempts;
    private final Duration firstDelay;
    private final Duration maxDelay;

    /**
     * @param maxAttempts total attempts including the first, at least 1
     * @param firstDelay  pause before the second attempt; doubled for each later one
     * @param maxDelay    upper bound for any single pause
     */
    public BackoffWriteRetrier(int maxAttempts, Duration firstDelay, Duration maxDelay) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, was " + maxAttempts);
        }
        if (firstDelay.isNegative() || maxDelay.compareTo(firstDelay) < 0) {
            throw new IllegalArgumentException("need 0 <= firstDelay <= maxDelay, was "
                    + firstDelay + " / " + maxDelay);
        }
        this.maxAttempts = maxAttempts;
        this.firstDelay = firstDelay;
        this.maxDelay = maxDelay;
    }

    /** No retries: the first failure is final. */
    public static BackoffWriteRetrier singleAttempt() {
        return new BackoffWriteRetrier(1, Duration.ZERO, Duration.ZERO);
    }

    @Override
    public int write(DurableWrite write) throws IOException {
        IOException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (last != null) {
                pauseBefore(attempt, last);
            }
            try {
                write.run();
                if (attempt > 1) {
                    System.out.println("[Persist] snapshot written on attempt " + attempt);
                }
                return attempt;
            } catch (IOException e) {
                if (last != null) {
                    e.addSuppressed(last);
                }
                last = e;
            }
        }
        throw new SnapshotWriteException(maxAttempts, last);
    }

    /** Pause before {@code attempt}: firstDelay, 2x, 4x ... capped at maxDelay. */
    Duration delayBefore(int attempt) {
        Duration d = firstDelay;
        for (int i = 2; i < attempt && d.compareTo(maxDelay) < 0; i++) {
            d = d.multipliedBy(2);
        }
        return d.compareTo(maxDelay) > 0 ? maxDelay : d;
    }

    private void pauseBefore(int attempt, IOException last) throws InterruptedIOException {
        Duration d = delayBefore(attempt);
        System.err.println("[Persist] snapshot write failed (" + last.getMessage() + "), attempt "
                + attempt + "/" + maxAttempts + " in " + d.toMillis() + "ms");
        try {
            Thread.sleep(d.toMillis());
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            InterruptedIOException stop = new InterruptedIOException("interrupted before write attempt " + attempt);
            stop.initCause(last);
            throw stop;
        }
    }

    public int maxAttempts() {
        return maxAttempts;
    }
}
