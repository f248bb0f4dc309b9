package org.telemetrystore.model;

import java.time.Instant;

/**
 * Client-submitted update before the server assigns its timestamp.
 *
 * @param location optional geolocation sample
 * @param frame    optional {@code data:image...} URI; any other string reads as no frame
 * @param meta     client context, never null
 */
public record UpdateRequest(Location location, String frame, UpdateMeta meta) {

    public UpdateRequest {
        frame = Update.imageFrameOrNull(frame);
        if (meta == null) {
            meta = UpdateMeta.EMPTY;
        }
    }

    public static UpdateRequest ofLocation(Location location) {
        return new UpdateRequest(location, null, UpdateMeta.EMPTY);
    }

    public static UpdateRequest ofFrame(String frame) {
        return new UpdateRequest(null, frame, UpdateMeta.EMPTY);
    }

    /** @return true if the request carries a location or an image frame */
    public boolean hasPayload() {
        return location != null || frame != null;
    }

    /** Binds this request to the ingestion instant. */
    public Update stamp(Instant ts) {
        return new Update(ts, location, frame, meta);
    }
}
