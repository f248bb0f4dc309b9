package org.telemetrystore.errors;

/** An update carried neither a location nor a frame. Nothing was stored. */
public class InvalidPayloadException extends RuntimeException {

    public InvalidPayloadException(String message) {
        super(message);
    }
}
