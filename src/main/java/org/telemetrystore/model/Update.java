package org.telemetrystore.model;

import java.time.Instant;
import java.util.Objects;

/**
 * One accepted telemetry sample. Immutable; {@code ts} is assigned by the
 * store at ingestion and never taken from the client.
 * <p>
 * A frame is kept only if it declares an image media type
 * ({@value #FRAME_PREFIX}...); anything else is stored as no frame.
 * </p>
 */
public record Update(Instant ts, Location location, String frame, UpdateMeta meta) {

    public static final String FRAME_PREFIX = "data:image";

    public Update {
        Objects.requireNonNull(ts, "ts");
        frame = imageFrameOrNull(frame);
        if (meta == null) {
            meta = UpdateMeta.EMPTY;
        }
    }

    /** @return {@code frame} if it is an image data URI, otherwise null */
    public static String imageFrameOrNull(String frame) {
        return frame != null && frame.startsWith(FRAME_PREFIX) ? frame : null;
    }
}
