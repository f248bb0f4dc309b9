package org.telemetrystore.errors;

/** The token never existed, was closed, or was already evicted after expiry. */
public class SessionNotFoundException extends RuntimeException {

    private final String token;

    public SessionNotFoundException(String token) {
        super("Unknown session token");
        this.token = token;
    }

    public String token() {
        return token;
    }
}
