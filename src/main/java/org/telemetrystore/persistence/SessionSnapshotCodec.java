package org.telemetrystore.persistence;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.telemetrystore.model.Location;
import org.telemetrystore.model.Session;
import org.telemetrystore.model.Update;
import org.telemetrystore.model.UpdateMeta;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.telemetrystore.util.JsonFields.optDouble;
import static org.telemetrystore.util.JsonFields.optInteger;
import static org.telemetrystore.util.JsonFields.optObject;
import static org.telemetrystore.util.JsonFields.optString;

/**
 * Converts the token → session mapping to and from its JSON snapshot form.
 * <p>
 * Layout: one object keyed by token. Each record holds {@code token},
 * {@code created_at}, {@code expires_at}, {@code last_seen} and {@code updates};
 * each update holds {@code ts}, {@code location}, {@code frame} and
 * {@code meta: {ua, tzOffsetMinutes}}. Absent values are written as explicit
 * {@code null}. Instants are ISO-8601 with offset, always UTC on write.
 * </p>
 * <p>
 * Decoding never throws. A document that is not a JSON object decodes to an
 * empty map; a record with missing or unparsable timestamps is dropped; an
 * update without a usable timestamp or payload is dropped from its record.
 * </p>
 */
public final class SessionSnapshotCodec {

    private static final DateTimeFormatter ISO = DateTimeFormatter.ISO_OFFSET_DATE_TIME;

    private final Gson gson = new GsonBuilder().serializeNulls().create();
    private final int capacity;

    public SessionSnapshotCodec(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1, was " + capacity);
        }
        this.capacity = capacity;
    }

    public int capacity() {
        return capacity;
    }

    // ---------------------------------------------------------------- encode

    public String encode(Map<String, Session> sessions) {
        JsonObject root = new JsonObject();
        sessions.forEach((token, session) -> root.add(token, encodeSession(session)));
        return gson.toJson(root);
    }

    private static JsonObject encodeSession(Session s) {
        JsonObject o = new JsonObject();
        o.addProperty("token", s.token());
        o.addProperty("created_at", format(s.createdAt()));
        o.addProperty("expires_at", format(s.expiresAt()));
        o.addProperty("last_seen", format(s.lastSeen()));
        JsonArray updates = new JsonArray();
        for (Update u : s.history()) {
            updates.add(encodeUpdate(u));
        }
        o.add("updates", updates);
        return o;
    }

    /** Wire form of one update; shared with the request layer's status responses. */
    public static JsonObject encodeUpdate(Update u) {
        JsonObject o = new JsonObject();
        o.addProperty("ts", format(u.ts()));
        Location loc = u.location();
        if (loc == null) {
            o.add("location", null);
        } else {
            JsonObject l = new JsonObject();
            l.addProperty("lat", loc.lat());
            l.addProperty("lng", loc.lng());
            l.addProperty("accuracy", loc.accuracy());
            l.addProperty("speed", loc.speed());
            o.add("location", l);
        }
        o.addProperty("frame", u.frame());
        JsonObject meta = new JsonObject();
        meta.addProperty("ua", u.meta().userAgent());
        meta.addProperty("tzOffsetMinutes", u.meta().tzOffsetMinutes());
        o.add("meta", meta);
        return o;
    }

    /** @return ISO-8601 UTC text, or null for null */
    public static String format(Instant instant) {
        return instant == null ? null : ISO.format(instant.atOffset(ZoneOffset.UTC));
    }

    // ---------------------------------------------------------------- decode

    /**
     * @param json snapshot text; null or blank decodes to an empty map
     * @return recovered sessions in document order
     */
    public Map<String, Session> decode(String json) {
        Map<String, Session> out = new LinkedHashMap<>();
        if (json == null || json.isBlank()) {
            return out;
        }

        JsonElement root;
        try {
            root = JsonParser.parseString(json);
        } catch (JsonParseException e) {
            System.err.println("[Persist] snapshot is not valid JSON, starting empty: " + e.getMessage());
            return out;
        }
        if (!root.isJsonObject()) {
            System.err.println("[Persist] snapshot root is not an object, starting empty");
            return out;
        }

        int skipped = 0;
        for (Map.Entry<String, JsonElement> e : root.getAsJsonObject().entrySet()) {
            Session s = decodeSession(e.getKey(), e.getValue());
            if (s == null) {
                skipped++;
            } else {
                out.put(e.getKey(), s);
            }
        }
        if (skipped > 0) {
            System.err.println("[Persist] skipped " + skipped + " unreadable session record(s)");
        }
        return out;
    }

    private Session decodeSession(String token, JsonElement value) {
        if (token == null || token.isEmpty() || value == null || !value.isJsonObject()) {
            return null;
        }
        JsonObject o = value.getAsJsonObject();
        try {
            Instant createdAt = parseRequired(optString(o, "created_at"));
            Instant expiresAt = parseRequired(optString(o, "expires_at"));
            if (createdAt == null || expiresAt == null || !expiresAt.isAfter(createdAt)) {
                return null;
            }
            String lastSeenText = optString(o, "last_seen");
            Instant lastSeen = lastSeenText == null ? null : parseRequired(lastSeenText);
            if (lastSeenText != null && lastSeen == null) {
                return null;
            }

            List<Update> history = new ArrayList<>();
            JsonElement updates = o.get("updates");
            if (updates != null && updates.isJsonArray()) {
                for (JsonElement el : updates.getAsJsonArray()) {
                    Update u = decodeUpdate(el);
                    if (u != null) {
                        history.add(u);
                    }
                }
            }
            return Session.restore(token, createdAt, expiresAt, lastSeen, history, capacity);
        } catch (RuntimeException ex) {
            // any shape surprise inside one record only costs that record
            return null;
        }
    }

    private static Update decodeUpdate(JsonElement el) {
        if (el == null || !el.isJsonObject()) {
            return null;
        }
        JsonObject o = el.getAsJsonObject();
        Instant ts = parseRequired(optString(o, "ts"));
        if (ts == null) {
            return null;
        }
        JsonObject l = optObject(o, "location");
        Location location = l == null ? null
                : new Location(optDouble(l, "lat"), optDouble(l, "lng"),
                               optDouble(l, "accuracy"), optDouble(l, "speed"));
        String frame = Update.imageFrameOrNull(optString(o, "frame"));
        if (location == null && frame == null) {
            return null;
        }
        JsonObject m = optObject(o, "meta");
        UpdateMeta meta = m == null ? UpdateMeta.EMPTY
                : new UpdateMeta(optString(m, "ua"), optInteger(m, "tzOffsetMinutes"));
        return new Update(ts, location, frame, meta);
    }

    /** Parses ISO-8601 with any offset; returns null if absent or unparsable. */
    static Instant parseRequired(String text) {
        if (text == null) {
            return null;
        }
        try {
            return OffsetDateTime.parse(text, ISO).toInstant();
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
