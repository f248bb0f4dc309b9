package org.telemetrystore.api;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.telemetrystore.model.Location;
import org.telemetrystore.model.Update;
import org.telemetrystore.model.UpdateMeta;
import org.telemetrystore.model.UpdateRequest;

import static org.telemetrystore.util.JsonFields.optDouble;
import static org.telemetrystore.util.JsonFields.optInteger;
import static org.telemetrystore.util.JsonFields.optObject;
import static org.telemetrystore.util.JsonFields.optString;

/**
 * Turns an append body {@code {location?, frame?, userAgent?, tzOffsetMinutes?}}
 * into an {@link UpdateRequest}.
 * <p>
 * Anything that does not fit the shape is dropped rather than passed through:
 * a body that is not a JSON object parses as empty, {@code location} must be an
 * object, and {@code frame} must be a string with a {@code data:image} prefix.
 * Whether the result carries enough to be stored is the store's decision.
 * </p>
 */
public final class UpdateRequestParser {

    public UpdateRequest parse(String body) {
        JsonObject o = asObject(body);
        if (o == null) {
            return new UpdateRequest(null, null, UpdateMeta.EMPTY);
        }

        JsonObject l = optObject(o, "location");
        Location location = l == null ? null
                : new Location(optDouble(l, "lat"), optDouble(l, "lng"),
                               optDouble(l, "accuracy"), optDouble(l, "speed"));

        String frame = Update.imageFrameOrNull(optString(o, "frame"));

        UpdateMeta meta = new UpdateMeta(optString(o, "userAgent"), optInteger(o, "tzOffsetMinutes"));
        return new UpdateRequest(location, frame, meta);
    }

    private static JsonObject asObject(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            JsonElement e = JsonParser.parseString(body);
            return e.isJsonObject() ? e.getAsJsonObject() : null;
        } catch (JsonParseException e) {
            return null;
        }
    }
}
