package org.telemetrystore.config;

import org.telemetrystore.persistence.FileSnapshotStore;
import org.telemetrystore.util.FixedTtlPolicy;
import org.telemetrystore.util.SecureTokenGenerator;
import org.telemetrystore.util.UpdateBuffer;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Properties;

/**
 * Store settings.
 * <p>
 * Resolution order, later wins: built-in defaults, {@code session-store.properties}
 * on the classpath, then JVM system properties prefixed with {@code sessionstore.}
 * (e.g. {@code -Dsessionstore.ttl.seconds=600}). Values that do not parse fall back
 * to the default with a note on stderr.
 * </p>
 */
public final class StoreConfig {

    public static final String RESOURCE = "session-store.properties";
    public static final String SYSTEM_PREFIX = "sessionstore.";

    public static final String STATE_DIR = "state.dir";
    public static final String STATE_FILE = "state.file";
    public static final String TTL_SECONDS = "ttl.seconds";
    public static final String HISTORY_CAPACITY = "history.capacity";
    public static final String TOKEN_BYTES = "token.bytes";
    public static final String PERSIST_FAILURE = "persist.failure";
    public static final String RETRY_ATTEMPTS = "persist.retry.attempts";
    public static final String RETRY_BASE_DELAY_MS = "persist.retry.base-delay-ms";
    public static final String RETRY_MAX_DELAY_MS = "persist.retry.max-delay-ms";

    // Upper bounds; larger values fall back to the default.
    public static final Duration MAX_TTL = Duration.ofDays(365);
    public static final int MAX_HISTORY_CAPACITY = 100_000;
    public static final int MAX_TOKEN_BYTES = 64;
    public static final int MAX_RETRY_ATTEMPTS = 10;
    public static final long MAX_RETRY_DELAY_MS = 10_000;

    private final Path stateDir;
    private final String stateFile;
    private final Duration ttl;
    private final int historyCapacity;
    private final int tokenBytes;
    private final PersistenceFailurePolicy failurePolicy;
    private final int retryAttempts;
    private final long retryBaseDelayMs;
    private final long retryMaxDelayMs;

    private StoreConfig(Properties p) {
        this.stateDir = Paths.get(p.getProperty(STATE_DIR, ".").trim());
        String file = p.getProperty(STATE_FILE, FileSnapshotStore.DEFAULT_FILE_NAME).trim();
        this.stateFile = file.isEmpty() ? FileSnapshotStore.DEFAULT_FILE_NAME : file;
        this.ttl = Duration.ofSeconds(bounded(p, TTL_SECONDS, FixedTtlPolicy.DEFAULT_TTL.getSeconds(),
                1, MAX_TTL.getSeconds()));
        this.historyCapacity = boundedInt(p, HISTORY_CAPACITY, UpdateBuffer.DEFAULT_CAPACITY, 1, MAX_HISTORY_CAPACITY);
        this.tokenBytes = boundedInt(p, TOKEN_BYTES, SecureTokenGenerator.DEFAULT_BYTES,
                SecureTokenGenerator.DEFAULT_BYTES, MAX_TOKEN_BYTES);
        this.failurePolicy = policy(p.getProperty(PERSIST_FAILURE));
        this.retryAttempts = boundedInt(p, RETRY_ATTEMPTS, 2, 1, MAX_RETRY_ATTEMPTS);
        this.retryBaseDelayMs = bounded(p, RETRY_BASE_DELAY_MS, 20, 0, MAX_RETRY_DELAY_MS);
        this.retryMaxDelayMs = bounded(p, RETRY_MAX_DELAY_MS, 100, 0, MAX_RETRY_DELAY_MS);
    }

    /** Defaults, then the classpath resource, then system property overrides. */
    public static StoreConfig load() {
        Properties p = new Properties();
        try (InputStream in = StoreConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                p.load(in);
            }
        } catch (IOException e) {
            System.err.println("[Config] could not read " + RESOURCE + ", using defaults: " + e.getMessage());
        }
        for (String name : System.getProperties().stringPropertyNames()) {
            if (name.startsWith(SYSTEM_PREFIX)) {
                p.setProperty(name.substring(SYSTEM_PREFIX.length()), System.getProperty(name));
            }
        }
        return new StoreConfig(p);
    }

    /** Only the given properties on top of the built-in defaults. */
    public static StoreConfig from(Properties p) {
        return new StoreConfig(p);
    }

    public static StoreConfig defaults() {
        return new StoreConfig(new Properties());
    }

    public Path stateDir()                        { return stateDir; }
    public String stateFile()                     { return stateFile; }
    public Path statePath()                       { return stateDir.resolve(stateFile); }
    public Duration ttl()                         { return ttl; }
    public int historyCapacity()                  { return historyCapacity; }
    public int tokenBytes()                       { return tokenBytes; }
    public PersistenceFailurePolicy failurePolicy() { return failurePolicy; }
    public int retryAttempts()                    { return retryAttempts; }
    public long retryBaseDelayMs()                { return retryBaseDelayMs; }
    public long retryMaxDelayMs()                 { return retryMaxDelayMs; }

    private static int boundedInt(Properties p, String key, int def, int min, int max) {
        return (int) bounded(p, key, def, min, max);
    }

    /** Parsed value if it lies in {@code [min, max]}, otherwise {@code def} with a note. */
    private static long bounded(Properties p, String key, long def, long min, long max) {
        long v = parseLong(p, key, def);
        if (v < min || v > max) {
            System.err.println("[Config] " + key + "=" + v + " is outside [" + min + ", " + max
                    + "], using " + def);
            return def;
        }
        return v;
    }

    private static long parseLong(Properties p, String key, long def) {
        String raw = p.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return def;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            System.err.println("[Config] invalid " + key + "='" + raw + "', using " + def);
            return def;
        }
    }

    private static PersistenceFailurePolicy policy(String raw) {
        if (raw == null || raw.isBlank()) {
            return PersistenceFailurePolicy.DEGRADE;
        }
        try {
            return PersistenceFailurePolicy.valueOf(raw.trim().toUpperCase(java.util.Locale.ROOT));
        } catch (IllegalArgumentException e) {
            System.err.println("[Config] invalid " + PERSIST_FAILURE + "='" + raw + "', using DEGRADE");
            return PersistenceFailurePolicy.DEGRADE;
        }
    }

    @Override
    public String toString() {
        return "StoreConfig{" +
                "statePath=" + statePath() +
                ", ttl=" + ttl +
                ", historyCapacity=" + historyCapacity +
                ", tokenBytes=" + tokenBytes +
                ", failurePolicy=" + failurePolicy +
                ", retryAttempts=" + retryAttempts +
                '}';
    }
}
