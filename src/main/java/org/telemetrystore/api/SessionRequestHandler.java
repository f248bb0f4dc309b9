package org.telemetrystore.api;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import org.telemetrystore.errors.InvalidPayloadException;
import org.telemetrystore.errors.PersistenceException;
import org.telemetrystore.errors.SessionExpiredException;
import org.telemetrystore.errors.SessionNotFoundException;
import org.telemetrystore.interfaces.SessionStore;
import org.telemetrystore.model.CreatedSession;
import org.telemetrystore.model.SessionStatus;
import org.telemetrystore.model.Update;

import java.util.List;
import java.util.function.Supplier;

import static org.telemetrystore.persistence.SessionSnapshotCodec.encodeUpdate;
import static org.telemetrystore.persistence.SessionSnapshotCodec.format;

/**
 * Maps the store operations onto JSON responses with HTTP-style status codes,
 * so a transport only has to route and write bytes.
 * <ul>
 *   <li>unknown token → 404, expired token → 410</li>
 *   <li>update with neither location nor frame → 400</li>
 *   <li>snapshot write failure (FAIL policy only) → 500</li>
 * </ul>
 */
public final class SessionRequestHandler {

    private final Gson gson = new GsonBuilder().serializeNulls().create();
    private final SessionStore store;
    private final UpdateRequestParser parser;

    public SessionRequestHandler(SessionStore store) {
        this(store, new UpdateRequestParser());
    }

    public SessionRequestHandler(SessionStore store, UpdateRequestParser parser) {
        this.store = store;
        this.parser = parser;
    }

    /** {@code {token, expires_at, ttl_seconds}} */
    public ApiResponse create() {
        return guarded(() -> {
            CreatedSession c = store.create();
            JsonObject o = new JsonObject();
            o.addProperty("token", c.token());
            o.addProperty("expires_at", format(c.expiresAt()));
            o.addProperty("ttl_seconds", c.ttlSeconds());
            return ok(o);
        });
    }

    /** {@code {status: "closed", token}} */
    public ApiResponse close(String token) {
        return guarded(() -> {
            store.close(token);
            JsonObject o = new JsonObject();
            o.addProperty("status", "closed");
            o.addProperty("token", token);
            return ok(o);
        });
    }

    /** {@code {status: "ok"}} */
    public ApiResponse append(String token, String body) {
        return guarded(() -> {
            store.append(token, parser.parse(body));
            JsonObject o = new JsonObject();
            o.addProperty("status", "ok");
            return ok(o);
        });
    }

    /** {@code {token, created, expires_at, last_seen, history_count, latest, ttl_seconds}} */
    public ApiResponse status(String token) {
        return guarded(() -> {
            SessionStatus s = store.status(token);
            JsonObject o = new JsonObject();
            o.addProperty("token", s.token());
            o.addProperty("created", format(s.createdAt()));
            o.addProperty("expires_at", format(s.expiresAt()));
            o.addProperty("last_seen", format(s.lastSeen()));
            o.addProperty("history_count", s.historyCount());
            o.add("latest", s.latest() == null ? null : encodeUpdate(s.latest()));
            o.addProperty("ttl_seconds", s.ttlSeconds());
            return ok(o);
        });
    }

    /** {@code {token, history_count, updates: [...]}}, oldest first. */
    public ApiResponse history(String token) {
        return guarded(() -> {
            List<Update> updates = store.history(token);
            JsonArray arr = new JsonArray();
            updates.forEach(u -> arr.add(encodeUpdate(u)));
            JsonObject o = new JsonObject();
            o.addProperty("token", token);
            o.addProperty("history_count", updates.size());
            o.add("updates", arr);
            return ok(o);
        });
    }

    private ApiResponse guarded(Supplier<ApiResponse> op) {
        try {
            return op.get();
        } catch (SessionNotFoundException e) {
            return error(ApiResponse.NOT_FOUND, e.getMessage());
        } catch (SessionExpiredException e) {
            return error(ApiResponse.GONE, e.getMessage());
        } catch (InvalidPayloadException e) {
            return error(ApiResponse.BAD_REQUEST, e.getMessage());
        } catch (PersistenceException e) {
            System.err.println("[Api] " + e.getMessage() + ": " + e.getCause());
            return error(ApiResponse.INTERNAL_SERVER_ERROR, "Session state could not be saved");
        }
    }

    private ApiResponse ok(JsonObject body) {
        return new ApiResponse(ApiResponse.OK, gson.toJson(body));
    }

    private ApiResponse error(int status, String message) {
        JsonObject o = new JsonObject();
        o.addProperty("error", message);
        return new ApiResponse(status, gson.toJson(o));
    }
}
