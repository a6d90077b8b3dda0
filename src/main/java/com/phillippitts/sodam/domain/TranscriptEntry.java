package com.phillippitts.sodam.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * One finalized utterance. Never mutated after creation.
 *
 * @param speaker who spoke
 * @param text trimmed, non-empty text
 * @param timestamp when the utterance was recorded
 * @param isFinal whether the speech pipeline marked the utterance final
 */
public record TranscriptEntry(Speaker speaker, String text, Instant timestamp, boolean isFinal) {

    public TranscriptEntry {
        Objects.requireNonNull(speaker, "speaker");
        Objects.requireNonNull(timestamp, "timestamp");
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("text must not be blank");
        }
        text = text.trim();
    }

    /**
     * Formats the entry as a speaker-labelled line, e.g. {@code "AI: 안녕하세요"}.
     */
    public String toLine() {
        return speaker.label() + ": " + text;
    }
}
