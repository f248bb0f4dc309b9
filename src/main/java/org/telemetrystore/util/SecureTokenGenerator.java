package org.telemetrystore.util;

import org.telemetrystore.interfaces.TokenGenerator;

import java.security.SecureRandom;
import java.util.Base64;

/**
 * Generates URL-safe tokens from raw {@link SecureRandom} bytes.
 * <p>
 * 8 bytes encode to an 11 character Base64url string with no padding.
 * The default {@code SecureRandom} constructor picks a non-blocking source
 * on the usual platforms.
 * </p>
 */
public final class SecureTokenGenerator implements TokenGenerator {

    public static final int DEFAULT_BYTES = 8;

    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();

    private final SecureRandom random;
    private final int numBytes;

    public SecureTokenGenerator() {
        this(DEFAULT_BYTES);
    }

    /**
     * @param numBytes raw random bytes per token; values below 8 are raised to 8
     */
    public SecureTokenGenerator(int numBytes) {
        this(new SecureRandom(), numBytes);
    }

    SecureTokenGenerator(SecureRandom random, int numBytes) {
        this.random = random;
        this.numBytes = Math.max(DEFAULT_BYTES, numBytes);
    }

    @Override
    public String newToken() {
        byte[] raw = new byte[numBytes];
        random.nextBytes(raw);
        return ENCODER.encodeToString(raw);
    }

    public int numBytes() {
        return numBytes;
    }
}
