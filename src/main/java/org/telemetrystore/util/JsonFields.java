package org.telemetrystore.util;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;

/**
 * Typed, lenient readers for optional members of a Gson {@link JsonObject}.
 * A member that is missing, null, or of the wrong JSON type reads as null.
 */
public final class JsonFields {

    private JsonFields() {}

    public static String optString(JsonObject obj, String name) {
        JsonPrimitive p = primitive(obj, name);
        return p != null && p.isString() ? p.getAsString() : null;
    }

    public static Double optDouble(JsonObject obj, String name) {
        JsonPrimitive p = primitive(obj, name);
        if (p == null || !p.isNumber()) {
            return null;
        }
        double d = p.getAsDouble();
        return Double.isFinite(d) ? d : null;
    }

    /** Whole numbers within int range only; 5.5 or 1e12 read as null. */
    public static Integer optInteger(JsonObject obj, String name) {
        Double d = optDouble(obj, name);
        if (d == null || d != Math.rint(d) || d < Integer.MIN_VALUE || d > Integer.MAX_VALUE) {
            return null;
        }
        return d.intValue();
    }

    public static JsonObject optObject(JsonObject obj, String name) {
        JsonElement e = obj == null ? null : obj.get(name);
        return e != null && e.isJsonObject() ? e.getAsJsonObject() : null;
    }

    private static JsonPrimitive primitive(JsonObject obj, String name) {
        JsonElement e = obj == null ? null : obj.get(name);
        return e != null && e.isJsonPrimitive() ? e.getAsJsonPrimitive() : null;
    }
}
