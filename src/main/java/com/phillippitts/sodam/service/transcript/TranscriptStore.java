package com.phillippitts.sodam.service.transcript;

import com.phillippitts.sodam.domain.TranscriptEntry;
import com.phillippitts.sodam.exception.TranscriptStoreException;

/**
 * External side-store that mirrors transcript entries for downstream analysis.
 *
 * <p>Implementations must be thread-safe; one instance is shared by every session in the
 * worker. Per-session ordering is the caller's responsibility.
 */
public interface TranscriptStore {

    /**
     * Appends one entry to the call's transcript.
     *
     * @throws TranscriptStoreException if the write fails
     */
    void append(String callId, TranscriptEntry entry);

    /**
     * Sets (or refreshes) the expiry of the call's transcript.
     *
     * @throws TranscriptStoreException if the write fails
     */
    void setExpiry(String callId, long seconds);

    /**
     * Appends and refreshes the expiry. Implementations that can do both in one round trip
     * should override this.
     */
    default void appendAndRefreshExpiry(String callId, TranscriptEntry entry, long expirySeconds) {
        append(callId, entry);
        setExpiry(callId, expirySeconds);
    }

    /** Whether entries actually leave the process. */
    default boolean isPersistent() {
        return true;
    }
}
