package com.phillippitts.sodam.domain;

import java.util.Locale;
import java.util.Optional;

/**
 * Direction of the call a session represents.
 */
public enum CallDirection {
    /** Ward-initiated call (the ward opened the room from the app). */
    INBOUND,
    /** Platform-initiated scheduled call placed to the ward. */
    OUTBOUND;

    /**
     * Lenient parse used for metadata and backend payloads.
     *
     * @param value raw value such as {@code "inbound"} or {@code "OUTBOUND"}; may be null
     * @return parsed direction, or empty if the value is blank or unknown
     */
    public static Optional<CallDirection> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(value.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
