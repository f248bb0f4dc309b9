package org.telemetrystore.app;

import org.telemetrystore.config.StoreConfig;
import org.telemetrystore.persistence.FileSnapshotStore;
import org.telemetrystore.persistence.SessionPersistence;
import org.telemetrystore.persistence.SessionSnapshotCodec;
import org.telemetrystore.store.PersistentSessionStore;
import org.telemetrystore.util.BackoffWriteRetrier;
import org.telemetrystore.util.FixedTtlPolicy;
import org.telemetrystore.util.SecureTokenGenerator;

import java.time.Clock;
import java.time.Duration;

/**
 * Wires a {@link PersistentSessionStore} from a {@link StoreConfig}.
 * The returned handle is meant to be passed explicitly to the request layer.
 */
public final class SessionStoreFactory {

    private SessionStoreFactory() {}

    /** Store configured from {@code session-store.properties} and system properties. */
    public static PersistentSessionStore open() {
        return open(StoreConfig.load(), Clock.systemUTC());
    }

    public static PersistentSessionStore open(StoreConfig config, Clock clock) {
        System.out.println("[Store] opening " + config);
        SessionPersistence persistence = new SessionPersistence(
                new FileSnapshotStore(config.stateDir(), config.stateFile()),
                new SessionSnapshotCodec(config.historyCapacity()));
        return new PersistentSessionStore(
                persistence,
                new SecureTokenGenerator(config.tokenBytes()),
                new FixedTtlPolicy(config.ttl()),
                clock,
                new BackoffWriteRetrier(config.retryAttempts(),
                        Duration.ofMillis(config.retryBaseDelayMs()),
                        Duration.ofMillis(Math.max(config.retryBaseDelayMs(), config.retryMaxDelayMs()))),
                config.failurePolicy());
    }
}
