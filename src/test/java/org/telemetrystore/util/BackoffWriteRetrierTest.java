package org.telemetrystore.util;

import org.telemetrystore.errors.SnapshotWriteException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class BackoffWriteRetrierTest {

    private final BackoffWriteRetrier retrier =
            new BackoffWriteRetrier(3, Duration.ofMillis(1), Duration.ofMillis(2));

    @Test
    void firstSuccessUsesOneAttempt() throws IOException {
        AtomicInteger calls = new AtomicInteger();
        assertEquals(1, retrier.write(calls::incrementAndGet));
        assertEquals(1, calls.get());
    }

    @Test
    void succeedsAfterTransientFailures() throws IOException {
        AtomicInteger calls = new AtomicInteger();
        int attempts = retrier.write(() -> {
            if (calls.incrementAndGet() < 3) {
                throw new IOException("disk busy");
            }
        });
        assertEquals(3, attempts);
    }

    @Test
    void exhaustedAttemptsReportTheLastFailure() {
        AtomicInteger calls = new AtomicInteger();
        SnapshotWriteException e = assertThrows(SnapshotWriteException.class, () -> retrier.write(() -> {
            throw new IOException("full #" + calls.incrementAndGet());
        }));

        assertEquals(3, calls.get());
        assertEquals(3, e.attempts());
        assertEquals("full #3", e.getCause().getMessage());
        assertEquals("full #2", e.getCause().getSuppressed()[0].getMessage());
    }

    @Test
    void singleAttemptDoesNotRetry() {
        AtomicInteger calls = new AtomicInteger();
        SnapshotWriteException e = assertThrows(SnapshotWriteException.class,
                () -> BackoffWriteRetrier.singleAttempt().write(() -> {
                    calls.incrementAndGet();
                    throw new IOException("read-only file system");
                }));
        assertEquals(1, calls.get());
        assertEquals(1, e.attempts());
    }

    @Test
    void delayDoublesUpToTheCap() {
        BackoffWriteRetrier r = new BackoffWriteRetrier(6, Duration.ofMillis(10), Duration.ofMillis(50));
        assertEquals(Duration.ofMillis(10), r.delayBefore(2));
        assertEquals(Duration.ofMillis(20), r.delayBefore(3));
        assertEquals(Duration.ofMillis(40), r.delayBefore(4));
        assertEquals(Duration.ofMillis(50), r.delayBefore(5));
        assertEquals(Duration.ofMillis(50), r.delayBefore(6));
    }

    @Test
    void interruptStopsRetrying() {
        AtomicInteger calls = new AtomicInteger();
        BackoffWriteRetrier slow = new BackoffWriteRetrier(5, Duration.ofSeconds(5), Duration.ofSeconds(5));
        Thread.currentThread().interrupt();
        try {
            InterruptedIOException e = assertThrows(InterruptedIOException.class, () -> slow.write(() -> {
                calls.incrementAndGet();
                throw new IOException("nope");
            }));
            assertEquals(1, calls.get());
            assertEquals("nope", e.getCause().getMessage());
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void rejectsBadArguments() {
        assertThrows(IllegalArgumentException.class,
                () -> new BackoffWriteRetrier(0, Duration.ZERO, Duration.ZERO));
        assertThrows(IllegalArgumentException.class,
                () -> new BackoffWriteRetrier(2, Duration.ofMillis(-1), Duration.ZERO));
        assertThrows(IllegalArgumentException.class,
                () -> new BackoffWriteRetrier(2, Duration.ofMillis(10), Duration.ofMillis(5)));
    }
}
