package org.telemetrystore.util;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class JsonFieldsTest {

    private final JsonObject o = JsonParser.parseString(
            "{\"s\":\"x\",\"n\":1.5,\"i\":-120,\"big\":1e12,\"frac\":5.5,\"nul\":null,\"obj\":{},\"arr\":[1]}")
            .getAsJsonObject();

    @Test
    void readsMatchingTypes() {
        assertEquals("x", JsonFields.optString(o, "s"));
        assertEquals(1.5, JsonFields.optDouble(o, "n"));
        assertEquals(-120, JsonFields.optInteger(o, "i"));
        assertNotNull(JsonFields.optObject(o, "obj"));
    }

    @Test
    void mismatchesReadAsNull() {
        assertNull(JsonFields.optString(o, "n"));
        assertNull(JsonFields.optDouble(o, "s"));
        assertNull(JsonFields.optInteger(o, "frac"));
        assertNull(JsonFields.optInteger(o, "big"));
        assertNull(JsonFields.optString(o, "nul"));
        assertNull(JsonFields.optObject(o, "arr"));
        assertNull(JsonFields.optDouble(o, "missing"));
        assertNull(JsonFields.optString(null, "s"));
    }
}
