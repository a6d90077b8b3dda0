package com.phillippitts.sodam.domain;

import java.util.Optional;

/**
 * Leniently parsed room metadata. Every field is optional; an absent or malformed payload
 * yields {@link #EMPTY}.
 *
 * @param wardId ward identifier, if present and non-blank
 * @param callId call identifier, if present and non-blank
 * @param direction call direction, if present and recognised
 * @param takeover explicit takeover flag, if present and boolean
 */
public record RoomMetadata(Optional<String> wardId,
                           Optional<String> callId,
                           Optional<CallDirection> direction,
                           Optional<Boolean> takeover) {

    public static final RoomMetadata EMPTY =
            new RoomMetadata(Optional.empty(), Optional.empty(), Optional.empty(), Optional.empty());

    /** True when both ward and call identifiers are present. */
    public boolean hasIdentity() {
        return wardId.isPresent() && callId.isPresent();
    }
}
