package com.phillippitts.sodam.domain;

/**
 * Party that produced a transcript entry.
 */
public enum Speaker {
    USER("user", "어르신"),
    AGENT("agent", "AI");

    private final String wireName;
    private final String label;

    Speaker(String wireName, String label) {
        this.wireName = wireName;
        this.label = label;
    }

    /** Lower-case name used in stored and broadcast JSON. */
    public String wireName() {
        return wireName;
    }

    /** Label used when formatting transcript lines. */
    public String label() {
        return label;
    }
}
