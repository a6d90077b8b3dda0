package com.phillippitts.sodam.domain;

import java.util.Objects;

/**
 * Immutable identity of the logical call a room instance represents.
 *
 * <p>Resolved once at session start by
 * {@link com.phillippitts.sodam.service.session.SessionIdentityResolver} and never re-resolved.
 *
 * @param wardId care-recipient identifier
 * @param callId call identifier; also the transcript store key
 * @param direction inbound or outbound
 * @param source the resolution path that won
 */
public record SessionIdentity(String wardId, String callId, CallDirection direction, IdentitySource source) {

    public SessionIdentity {
        if (wardId == null || wardId.isBlank()) {
            throw new IllegalArgumentException("wardId must not be blank");
        }
        if (callId == null || callId.isBlank()) {
            throw new IllegalArgumentException("callId must not be blank");
        }
        Objects.requireNonNull(direction, "direction");
        Objects.requireNonNull(source, "source");
    }
}
