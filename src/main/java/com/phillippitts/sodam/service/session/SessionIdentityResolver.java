package com.phillippitts.sodam.service.session;

import com.phillippitts.sodam.domain.CallDirection;
import com.phillippitts.sodam.domain.IdentitySource;
import com.phillippitts.sodam.domain.RoomMetadata;
import com.phillippitts.sodam.domain.SessionIdentity;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.Optional;

/**
 * Resolves the {@link SessionIdentity} of a room, once, at session start.
 *
 * <p>Resolution order (the first path that yields an identity wins):
 * <ol>
 *   <li>Room metadata carrying both {@code wardId} and {@code callId}; used verbatim.</li>
 *   <li>Backend lookup by room name.</li>
 *   <li>Room name of the form {@code call_{wardId}_{suffix}}; the room name is the call id.</li>
 *   <li>The raw room name as both ward id and call id.</li>
 * </ol>
 *
 * <p>Direction comes from the winning source's {@code direction} field when present; otherwise
 * {@link CallDirection#OUTBOUND} for every path except the raw room name, which is
 * {@link CallDirection#INBOUND}.
 */
@Component
public class SessionIdentityResolver {

    private static final Logger LOG = LogManager.getLogger(SessionIdentityResolver.class);

    static final String CALL_ROOM_PREFIX = "call";

    private final CallLookupClient lookupClient;

    public SessionIdentityResolver(CallLookupClient lookupClient) {
        this.lookupClient = Objects.requireNonNull(lookupClient, "lookupClient must not be null");
    }

    public SessionIdentity resolve(String roomName, RoomMetadata metadata) {
        if (roomName == null || roomName.isBlank()) {
            throw new IllegalArgumentException("roomName must not be blank");
        }
        RoomMetadata meta = metadata == null ? RoomMetadata.EMPTY : metadata;

        SessionIdentity identity;
        if (meta.hasIdentity()) {
            identity = fromMetadata(meta, IdentitySource.METADATA);
        } else {
            identity = lookupClient.lookup(roomName)
                    .map(m -> fromMetadata(m, IdentitySource.BACKEND_LOOKUP))
                    .or(() -> parseRoomName(roomName))
                    .orElseGet(() -> new SessionIdentity(roomName, roomName, CallDirection.INBOUND,
                            IdentitySource.ROOM_NAME));
        }
        LOG.info("Session identity resolved via {}: ward={}, call={}, direction={}",
                identity.source(), identity.wardId(), identity.callId(), identity.direction());
        return identity;
    }

    private static SessionIdentity fromMetadata(RoomMetadata m, IdentitySource source) {
        return new SessionIdentity(m.wardId().orElseThrow(), m.callId().orElseThrow(),
                m.direction().orElse(CallDirection.OUTBOUND), source);
    }

    /**
     * Parses {@code call_{wardId}_...}. A missing or empty ward segment is not a match.
     */
    static Optional<SessionIdentity> parseRoomName(String roomName) {
        String[] parts = roomName.split("_", -1);
        if (parts.length < 2 || !CALL_ROOM_PREFIX.equals(parts[0]) || parts[1].isBlank()) {
            return Optional.empty();
        }
        return Optional.of(new SessionIdentity(parts[1], roomName, CallDirection.OUTBOUND,
                IdentitySource.ROOM_NAME_PATTERN));
    }
}
