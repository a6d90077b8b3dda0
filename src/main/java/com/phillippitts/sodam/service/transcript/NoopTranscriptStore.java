package com.phillippitts.sodam.service.transcript;

import com.phillippitts.sodam.domain.TranscriptEntry;

/**
 * Store used when no Redis URL is configured. Transcripts then live only in the recorder.
 */
public final class NoopTranscriptStore implements TranscriptStore {

    @Override
    public void append(String callId, TranscriptEntry entry) {
        // nothing to mirror
    }

    @Override
    public void setExpiry(String callId, long seconds) {
        // nothing to expire
    }

    @Override
    public boolean isPersistent() {
        return false;
    }
}
