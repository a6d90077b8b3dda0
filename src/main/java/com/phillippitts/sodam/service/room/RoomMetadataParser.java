package com.phillippitts.sodam.service.room;

import com.phillippitts.sodam.domain.CallDirection;
import com.phillippitts.sodam.domain.RoomMetadata;
import com.phillippitts.sodam.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.Optional;

/**
 * Parses room / dispatch metadata of the shape {@code {wardId?, callId?, direction?, takeover?}}.
 *
 * <p>Parsing never throws: an absent, malformed or non-object payload yields
 * {@link RoomMetadata#EMPTY}, and a field of the wrong type is treated as absent.
 *
 * <p>Thread-safe: All methods are static and stateless.
 */
public final class RoomMetadataParser {

    private static final Logger LOG = LogManager.getLogger(RoomMetadataParser.class);

    /** Cap on payload size accepted for parsing. */
    private static final int MAX_METADATA_SIZE = 64 * 1024;

    private RoomMetadataParser() {
        // Utility class - prevent instantiation
    }

    public static RoomMetadata parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return RoomMetadata.EMPTY;
        }
        if (raw.length() > MAX_METADATA_SIZE) {
            LOG.warn("Ignoring oversized room metadata ({} chars)", raw.length());
            return RoomMetadata.EMPTY;
        }
        JSONObject obj;
        try {
            obj = new JSONObject(raw);
        } catch (JSONException e) {
            LOG.warn("Ignoring malformed room metadata: '{}'", LogSanitizer.truncate(raw, 120));
            return RoomMetadata.EMPTY;
        }
        return new RoomMetadata(
                nonBlankString(obj, "wardId"),
                nonBlankString(obj, "callId"),
                nonBlankString(obj, "direction").flatMap(CallDirection::parse),
                strictBoolean(obj, "takeover"));
    }

    private static Optional<String> nonBlankString(JSONObject obj, String key) {
        Object value = obj.opt(key);
        if (value instanceof String s && !s.isBlank()) {
            return Optional.of(s);
        }
        if (value instanceof Number n) {
            // numeric ids are common for wardId
            return Optional.of(n.toString());
        }
        return Optional.empty();
    }

    private static Optional<Boolean> strictBoolean(JSONObject obj, String key) {
        Object value = obj.opt(key);
        if (value instanceof Boolean b) {
            return Optional.of(b);
        }
        if (value != null && value != JSONObject.NULL) {
            LOG.warn("Ignoring non-boolean '{}' in room metadata: {}", key, value);
        }
        return Optional.empty();
    }
}
