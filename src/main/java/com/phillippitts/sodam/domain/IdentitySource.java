package com.phillippitts.sodam.domain;

/**
 * Which resolution path produced a {@link SessionIdentity}.
 */
public enum IdentitySource {
    METADATA,
    BACKEND_LOOKUP,
    ROOM_NAME_PATTERN,
    ROOM_NAME
}
