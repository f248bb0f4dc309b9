package org.telemetrystore.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.time.Duration;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class StoreConfigTest {

    @AfterEach
    void clearOverrides() {
        System.clearProperty("sessionstore.ttl.seconds");
        System.clearProperty("sessionstore.persist.failure");
    }

    @Test
    void defaults() {
        StoreConfig c = StoreConfig.defaults();
        assertEquals(Duration.ofSeconds(3600), c.ttl());
        assertEquals(200, c.historyCapacity());
        assertEquals(8, c.tokenBytes());
        assertEquals(PersistenceFailurePolicy.DEGRADE, c.failurePolicy());
        assertEquals(Paths.get(".").resolve("session_state.json"), c.statePath());
        assertEquals(2, c.retryAttempts());
    }

    @Test
    void explicitPropertiesOverrideDefaults() {
        Properties p = new Properties();
        p.setProperty(StoreConfig.STATE_DIR, "/var/lib/sessions");
        p.setProperty(StoreConfig.TTL_SECONDS, "600");
        p.setProperty(StoreConfig.HISTORY_CAPACITY, "50");
        p.setProperty(StoreConfig.TOKEN_BYTES, "16");
        p.setProperty(StoreConfig.PERSIST_FAILURE, "fail");

        StoreConfig c = StoreConfig.from(p);
        assertEquals(Paths.get("/var/lib/sessions", "session_state.json"), c.statePath());
        assertEquals(Duration.ofMinutes(10), c.ttl());
        assertEquals(50, c.historyCapacity());
        assertEquals(16, c.tokenBytes());
        assertEquals(PersistenceFailurePolicy.FAIL, c.failurePolicy());
    }

    @Test
    void invalidValuesFallBack() {
        Properties p = new Properties();
        p.setProperty(StoreConfig.TTL_SECONDS, "an hour");
        p.setProperty(StoreConfig.HISTORY_CAPACITY, "0");
        p.setProperty(StoreConfig.TOKEN_BYTES, "4");
        p.setProperty(StoreConfig.PERSIST_FAILURE, "panic");
        p.setProperty(StoreConfig.RETRY_BASE_DELAY_MS, "-5");

        StoreConfig c = StoreConfig.from(p);
        assertEquals(Duration.ofHours(1), c.ttl());
        assertEquals(200, c.historyCapacity());
        assertEquals(8, c.tokenBytes());
        assertEquals(PersistenceFailurePolicy.DEGRADE, c.failurePolicy());
        assertEquals(20, c.retryBaseDelayMs());
    }

    @Test
    void outOfRangeValuesFallBackInsteadOfOverflowing() {
        Properties p = new Properties();
        p.setProperty(StoreConfig.HISTORY_CAPACITY, "3000000000");
        p.setProperty(StoreConfig.TTL_SECONDS, String.valueOf(Long.MAX_VALUE));
        p.setProperty(StoreConfig.TOKEN_BYTES, "4294967304");
        p.setProperty(StoreConfig.RETRY_ATTEMPTS, "2147483648");
        p.setProperty(StoreConfig.RETRY_MAX_DELAY_MS, "86400000");

        StoreConfig c = StoreConfig.from(p);
        assertEquals(200, c.historyCapacity());
        assertEquals(Duration.ofHours(1), c.ttl());
        assertEquals(8, c.tokenBytes());
        assertEquals(2, c.retryAttempts());
        assertEquals(100, c.retryMaxDelayMs());
    }

    @Test
    void upperBoundsAreInclusive() {
        Properties p = new Properties();
        p.setProperty(StoreConfig.HISTORY_CAPACITY, String.valueOf(StoreConfig.MAX_HISTORY_CAPACITY));
        p.setProperty(StoreConfig.TTL_SECONDS, String.valueOf(StoreConfig.MAX_TTL.getSeconds()));
        p.setProperty(StoreConfig.TOKEN_BYTES, String.valueOf(StoreConfig.MAX_TOKEN_BYTES));
        p.setProperty(StoreConfig.RETRY_ATTEMPTS, String.valueOf(StoreConfig.MAX_RETRY_ATTEMPTS));

        StoreConfig c = StoreConfig.from(p);
        assertEquals(StoreConfig.MAX_HISTORY_CAPACITY, c.historyCapacity());
        assertEquals(StoreConfig.MAX_TTL, c.ttl());
        assertEquals(StoreConfig.MAX_TOKEN_BYTES, c.tokenBytes());
        assertEquals(StoreConfig.MAX_RETRY_ATTEMPTS, c.retryAttempts());
    }

    @Test
    void loadReadsClasspathThenSystemProperties() {
        System.setProperty("sessionstore.ttl.seconds", "90");
        System.setProperty("sessionstore.persist.failure", "FAIL");

        StoreConfig c = StoreConfig.load();
        assertEquals(Duration.ofSeconds(90), c.ttl());
        assertEquals(PersistenceFailurePolicy.FAIL, c.failurePolicy());
        assertEquals("session_state.json", c.stateFile());
    }
}
