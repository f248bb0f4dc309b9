package org.telemetrystore.model;

/** Client context attached to an update. Both fields are optional. */
public record UpdateMeta(String userAgent, Integer tzOffsetMinutes) {

    public static final UpdateMeta EMPTY = new UpdateMeta(null, null);

    public UpdateMeta {
        if (userAgent != null && userAgent.isBlank()) {
            userAgent = null;
        }
    }
}
