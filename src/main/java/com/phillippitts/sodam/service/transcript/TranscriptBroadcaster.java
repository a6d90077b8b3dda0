package com.phillippitts.sodam.service.transcript;

import com.phillippitts.sodam.domain.TranscriptEntry;

/**
 * Pushes transcript entries to live viewers. Best-effort; callers absorb failures.
 */
@FunctionalInterface
public interface TranscriptBroadcaster {

    /** Broadcaster that sends nothing. */
    TranscriptBroadcaster NONE = entry -> { };

    void broadcast(TranscriptEntry entry);
}
