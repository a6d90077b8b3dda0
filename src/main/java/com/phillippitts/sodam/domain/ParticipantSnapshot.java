package com.phillippitts.sodam.domain;

import java.util.Objects;

/**
 * Point-in-time view of a remote participant.
 *
 * @param identity participant identity
 * @param publishedAudioTracks number of audio tracks the participant currently publishes
 */
public record ParticipantSnapshot(String identity, int publishedAudioTracks) {

    public ParticipantSnapshot {
        Objects.requireNonNull(identity, "identity");
        if (publishedAudioTracks < 0) {
            throw new IllegalArgumentException("publishedAudioTracks must be >= 0");
        }
    }

    public boolean isPublishingAudio() {
        return publishedAudioTracks > 0;
    }
}
