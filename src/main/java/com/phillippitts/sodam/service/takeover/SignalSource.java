package com.phillippitts.sodam.service.takeover;

/**
 * Channel a takeover signal came from.
 *
 * <p>{@link #METADATA} carries an explicit flag set by the supervisor console. The other
 * channels infer presence from participants and their audio tracks.
 */
public enum SignalSource {
    METADATA(true),
    PARTICIPANT_EVENT(false),
    TRACK_EVENT(false),
    POLL(false);

    private final boolean explicit;

    SignalSource(boolean explicit) {
        this.explicit = explicit;
    }

    public boolean isExplicit() {
        return explicit;
    }

    /** Lower-case name used for metric tags. */
    public String tag() {
        return name().toLowerCase(java.util.Locale.ROOT);
    }
}
