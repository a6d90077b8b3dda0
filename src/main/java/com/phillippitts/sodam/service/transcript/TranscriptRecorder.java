package com.phillippitts.sodam.service.transcript;

import com.phillippitts.sodam.domain.MessageContent;
import com.phillippitts.sodam.domain.Speaker;
import com.phillippitts.sodam.domain.TranscriptEntry;
import com.phillippitts.sodam.service.events.SessionDegradedEvent;
import com.phillippitts.sodam.service.metrics.SessionMetrics;
import com.phillippitts.sodam.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Bounded, ordered transcript of one session.
 *
 * <p><b>Capacity:</b> at most {@code capacity} entries are retained. Appending beyond that
 * evicts the oldest entry; the retained entries are always the most recent ones in insertion
 * order.
 *
 * <p><b>Mirroring:</b> every accepted entry is written to the {@link TranscriptStore} and then
 * broadcast to the room, off the calling thread. Writes for one session form a single chain on
 * the store executor, so the stored order matches the recorded order. Store and broadcast
 * failures are logged, counted and published as {@link SessionDegradedEvent}s; they never reach
 * the caller of {@link #record(Speaker, String)}.
 *
 * <p><b>Thread Safety:</b> all methods may be called concurrently. Appends and snapshots are
 * serialized by one lock.
 */
public final class TranscriptRecorder {

    private static final Logger LOG = LogManager.getLogger(TranscriptRecorder.class);

    static final String ASSISTANT_ROLE = "assistant";
    private static final int LOG_TEXT_LIMIT = 60;

    private final String sessionId;
    private final String callId;
    private final int capacity;
    private final TranscriptStore store;
    private final long expirySeconds;
    private final TranscriptBroadcaster broadcaster;
    private final Executor storeExecutor;
    private final Predicate<String> userSpeechGate;
    private final ApplicationEventPublisher publisher;
    private final SessionMetrics metrics;
    private final Clock clock;

    private final Lock lock = new ReentrantLock();
    private final Deque<TranscriptEntry> entries;
    private CompletableFuture<Void> storeTail = CompletableFuture.completedFuture(null);

    private TranscriptRecorder(Builder b) {
        this.sessionId = Objects.requireNonNull(b.sessionId, "sessionId must not be null");
        this.callId = Objects.requireNonNull(b.callId, "callId must not be null");
        if (b.capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = b.capacity;
        this.store = Objects.requireNonNull(b.store, "store must not be null");
        this.expirySeconds = Objects.requireNonNull(b.expiry, "expiry must not be null").toSeconds();
        this.broadcaster = Objects.requireNonNull(b.broadcaster, "broadcaster must not be null");
        this.storeExecutor = Objects.requireNonNull(b.storeExecutor, "storeExecutor must not be null");
        this.userSpeechGate = Objects.requireNonNull(b.userSpeechGate, "userSpeechGate must not be null");
        this.publisher = Objects.requireNonNull(b.publisher, "publisher must not be null");
        this.metrics = Objects.requireNonNull(b.metrics, "metrics must not be null");
        this.clock = Objects.requireNonNull(b.clock, "clock must not be null");
        this.entries = new ArrayDeque<>(Math.min(capacity, 64));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Handles a transcribed user utterance. Interim hypotheses are ignored, and so is speech the
     * user-speech gate rejects (for example while a supervisor has taken over).
     */
    public void onUserSpeechFinalized(String text, boolean isFinal) {
        if (!isFinal) {
            return;
        }
        if (!userSpeechGate.test(text)) {
            return;
        }
        record(Speaker.USER, text);
    }

    /**
     * Handles a conversation item added by the agent runtime. Only assistant items are recorded;
     * fragment content is flattened with {@link MessageContent#normalize()}.
     */
    public void onAgentOutputAdded(String role, MessageContent content) {
        if (!ASSISTANT_ROLE.equals(role) || content == null) {
            return;
        }
        record(Speaker.AGENT, content.normalize());
    }

    /**
     * Records one utterance.
     *
     * @return the stored entry, or empty when the text was blank
     */
    public Optional<TranscriptEntry> record(Speaker speaker, String text) {
        Objects.requireNonNull(speaker, "speaker must not be null");
        if (text == null || text.isBlank()) {
            LOG.debug("Ignoring blank {} utterance", speaker.wireName());
            return Optional.empty();
        }
        TranscriptEntry entry = new TranscriptEntry(speaker, text, clock.instant(), true);
        lock.lock();
        try {
            if (entries.size() == capacity) {
                entries.pollFirst();
            }
            entries.addLast(entry);
            storeTail = storeTail
                    .thenRunAsync(() -> mirror(entry), storeExecutor)
                    .exceptionally(t -> null);
        } finally {
            lock.unlock();
        }
        metrics.incrementTranscriptEntry(speaker.wireName());
        LOG.debug("{}: {}", speaker.label(), LogSanitizer.truncate(entry.text(), LOG_TEXT_LIMIT));
        return Optional.of(entry);
    }

    private void mirror(TranscriptEntry entry) {
        try {
            store.appendAndRefreshExpiry(callId, entry, expirySeconds);
        } catch (RuntimeException e) {
            LOG.warn("Transcript store write failed; entry kept in memory only: {}", e.toString());
            metrics.incrementStoreFailure();
            degraded(SessionDegradedEvent.Component.TRANSCRIPT_STORE, e);
        }
        try {
            broadcaster.broadcast(entry);
        } catch (RuntimeException e) {
            LOG.debug("Transcript broadcast failed: {}", e.toString());
            metrics.incrementBroadcastFailure();
            degraded(SessionDegradedEvent.Component.TRANSCRIPT_BROADCAST, e);
        }
    }

    private void degraded(SessionDegradedEvent.Component component, RuntimeException e) {
        publisher.publishEvent(new SessionDegradedEvent(sessionId, component,
                e.getClass().getSimpleName(), clock.instant()));
    }

    /**
     * Completes once every entry recorded so far has been mirrored (or has failed to be).
     * The returned future is independent of the internal chain; completing it has no effect
     * on pending writes.
     */
    public CompletableFuture<Void> flush() {
        lock.lock();
        try {
            return storeTail.copy();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Speaker-labelled lines in insertion order, e.g. {@code "어르신: 네"} and
     * {@code "AI: 안녕하세요"}. Each call streams a fresh snapshot, so the stream can be
     * consumed again by calling this method again with identical results while no new entry
     * is recorded.
     */
    public Stream<String> fullTranscript() {
        return entries().stream().map(TranscriptEntry::toLine);
    }

    /** {@link #fullTranscript()} joined with newlines; empty string when nothing was recorded. */
    public String fullTranscriptText() {
        return fullTranscript().collect(Collectors.joining("\n"));
    }

    /** Texts of the retained user entries, oldest first. */
    public List<String> userTranscripts() {
        List<String> result = new ArrayList<>();
        for (TranscriptEntry e : entries()) {
            if (e.speaker() == Speaker.USER) {
                result.add(e.text());
            }
        }
        return result;
    }

    /** Immutable snapshot of the retained entries, oldest first. */
    public List<TranscriptEntry> entries() {
        lock.lock();
        try {
            return List.copyOf(entries);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return capacity;
    }

    /**
     * Builder for {@link TranscriptRecorder}. Session id, call id, store, store executor,
     * publisher and metrics are required.
     */
    public static final class Builder {
        private String sessionId;
        private String callId;
        private int capacity = 500;
        private TranscriptStore store;
        private Duration expiry = Duration.ofHours(24);
        private TranscriptBroadcaster broadcaster = TranscriptBroadcaster.NONE;
        private Executor storeExecutor;
        private Predicate<String> userSpeechGate = text -> true;
        private ApplicationEventPublisher publisher;
        private SessionMetrics metrics;
        private Clock clock = Clock.systemUTC();

        private Builder() {
        }

        public Builder sessionId(String sessionId) {
            this.sessionId = sessionId;
            return this;
        }

        public Builder callId(String callId) {
            this.callId = callId;
            return this;
        }

        public Builder capacity(int capacity) {
            this.capacity = capacity;
            return this;
        }

        public Builder store(TranscriptStore store) {
            this.store = store;
            return this;
        }

        public Builder expiry(Duration expiry) {
            this.expiry = expiry;
            return this;
        }

        public Builder broadcaster(TranscriptBroadcaster broadcaster) {
            this.broadcaster = broadcaster;
            return this;
        }

        public Builder storeExecutor(Executor storeExecutor) {
            this.storeExecutor = storeExecutor;
            return this;
        }

        public Builder userSpeechGate(Predicate<String> userSpeechGate) {
            this.userSpeechGate = userSpeechGate;
            return this;
        }

        public Builder publisher(ApplicationEventPublisher publisher) {
            this.publisher = publisher;
            return this;
        }

        public Builder metrics(SessionMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public TranscriptRecorder build() {
            return new TranscriptRecorder(this);
        }
    }
}
