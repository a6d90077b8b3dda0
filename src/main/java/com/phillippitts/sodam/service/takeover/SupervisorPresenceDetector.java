package com.phillippitts.sodam.service.takeover;

import com.phillippitts.sodam.domain.ParticipantSnapshot;

import java.util.Collection;
import java.util.Objects;

/**
 * Decides supervisor presence from a participant snapshot: a supervisor is present when a
 * participant with the privileged identity prefix publishes at least one audio track.
 * A privileged participant who is connected but not publishing does not count.
 */
public final class SupervisorPresenceDetector {

    private final String privilegedPrefix;

    public SupervisorPresenceDetector(String privilegedPrefix) {
        this.privilegedPrefix = Objects.requireNonNull(privilegedPrefix, "privilegedPrefix");
        if (privilegedPrefix.isEmpty()) {
            throw new IllegalArgumentException("privilegedPrefix must not be empty");
        }
    }

    public boolean isPrivileged(String identity) {
        return identity != null && identity.startsWith(privilegedPrefix);
    }

    public boolean isSupervisorPresent(Collection<ParticipantSnapshot> participants) {
        return isSupervisorPresentExcluding(participants, null);
    }

    /**
     * Same as {@link #isSupervisorPresent(Collection)} but ignores one identity, used when a
     * leave event may arrive before the snapshot drops the participant.
     */
    public boolean isSupervisorPresentExcluding(Collection<ParticipantSnapshot> participants, String excluded) {
        if (participants == null) {
            return false;
        }
        for (ParticipantSnapshot p : participants) {
            if (p == null || p.identity().equals(excluded)) {
                continue;
            }
            if (isPrivileged(p.identity()) && p.isPublishingAudio()) {
                return true;
            }
        }
        return false;
    }

    public String privilegedPrefix() {
        return privilegedPrefix;
    }
}
