package com.phillippitts.sodam.service.session;

import com.phillippitts.sodam.config.properties.BackendApiProperties;
import com.phillippitts.sodam.domain.RoomMetadata;
import com.phillippitts.sodam.service.backend.BackendApiClient;
import com.phillippitts.sodam.service.room.RoomMetadataParser;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Asks the backend which call a room belongs to:
 * {@code GET /v1/calls/lookup?roomName=...} returning {@code {"wardId":...,"callId":...,"direction":...}}.
 *
 * <p>Any failure (disabled, unreachable, non-2xx, malformed or incomplete body) yields empty;
 * identity resolution then falls through to room-name parsing.
 */
@Component
public class CallLookupClient {

    private static final Logger LOG = LogManager.getLogger(CallLookupClient.class);

    static final String PATH = "/v1/calls/lookup?roomName={roomName}";

    private final BackendApiClient client;
    private final boolean enabled;

    @Autowired
    public CallLookupClient(RestTemplateBuilder builder, BackendApiProperties props) {
        this(BackendApiClient.create(builder, props, props.getLookupTimeout()), props.isLookupEnabled());
    }

    CallLookupClient(BackendApiClient client, boolean enabled) {
        this.client = client;
        this.enabled = enabled;
    }

    /**
     * @return the backend's identity for the room, only when both ward and call ids are present
     */
    public Optional<RoomMetadata> lookup(String roomName) {
        if (!enabled || roomName == null || roomName.isBlank()) {
            return Optional.empty();
        }
        try {
            RoomMetadata metadata = RoomMetadataParser.parse(client.getJson(PATH, roomName).toString());
            if (!metadata.hasIdentity()) {
                LOG.debug("Backend lookup for room {} returned no identity", roomName);
                return Optional.empty();
            }
            return Optional.of(metadata);
        } catch (RuntimeException e) {
            LOG.info("Backend call lookup unavailable for room {}: {}", roomName, e.getMessage());
            return Optional.empty();
        }
    }
}
