package com.phillippitts.sodam.domain;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Content of an agent conversation item: either flat text or a list of fragments.
 *
 * <p>{@link #normalize()} is the single place that flattens either shape into one string.
 * Fragments that carry no text ({@link Opaque}) and blank text fragments are dropped; the
 * remaining texts are trimmed and joined with a single space.
 */
public sealed interface MessageContent permits MessageContent.Text, MessageContent.Fragments {

    /** Flattens the content; returns an empty string when nothing is extractable. */
    String normalize();

    static MessageContent text(String value) {
        return new Text(value);
    }

    static MessageContent fragments(List<? extends ContentFragment> fragments) {
        return new Fragments(List.copyOf(fragments));
    }

    /** A fragment inside {@link Fragments}. */
    sealed interface ContentFragment permits Text, Opaque {
    }

    /** Plain text, used both as whole content and as a fragment. */
    record Text(String value) implements MessageContent, ContentFragment {
        @Override
        public String normalize() {
            return value == null ? "" : value.trim();
        }
    }

    /** Non-text fragment (audio, image, tool payload); carries only its kind for logging. */
    record Opaque(String kind) implements ContentFragment {
    }

    record Fragments(List<ContentFragment> parts) implements MessageContent {
        public Fragments {
            Objects.requireNonNull(parts, "parts");
        }

        @Override
        public String normalize() {
            return parts.stream()
                    .filter(Text.class::isInstance)
                    .map(p -> ((Text) p).normalize())
                    .filter(s -> !s.isEmpty())
                    .collect(Collectors.joining(" "));
        }
    }
}
