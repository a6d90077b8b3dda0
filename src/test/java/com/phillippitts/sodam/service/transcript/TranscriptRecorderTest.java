package com.phillippitts.sodam.service.transcript;

import com.phillippitts.sodam.domain.MessageContent;
import com.phillippitts.sodam.domain.Speaker;
import com.phillippitts.sodam.domain.TranscriptEntry;
import com.phillippitts.sodam.exception.TranscriptStoreException;
import com.phillippitts.sodam.service.events.SessionDegradedEvent;
import com.phillippitts.sodam.service.metrics.SessionMetrics;
import com.phillippitts.sodam.testutil.EventCapturingPublisher;
import com.phillippitts.sodam.testutil.SyncExecutor;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Predicate;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

class TranscriptRecorderTest {

    private RecordingStore store;
    private EventCapturingPublisher publisher;
    private SimpleMeterRegistry registry;

    @BeforeEach
    void setUp() {
        store = new RecordingStore();
        publisher = new EventCapturingPublisher();
        registry = new SimpleMeterRegistry();
    }

    private TranscriptRecorder.Builder builder() {
        return TranscriptRecorder.builder()
                .sessionId("s-1")
                .callId("c-1")
                .store(store)
                .storeExecutor(new SyncExecutor())
                .publisher(publisher)
                .metrics(new SessionMetrics(registry));
    }

    @Test
    void keepsMostRecentEntriesWhenCapacityExceeded() {
        TranscriptRecorder recorder = builder().capacity(500).build();

        for (int i = 0; i < 520; i++) {
            recorder.record(i % 2 == 0 ? Speaker.USER : Speaker.AGENT, "line " + i);
        }

        List<TranscriptEntry> entries = recorder.entries();
        assertThat(recorder.size()).isEqualTo(500);
        assertThat(entries.get(0).text()).isEqualTo("line 20");
        assertThat(entries.get(499).text()).isEqualTo("line 519");
        assertThat(store.texts()).hasSize(520);
    }

    @Test
    void fullTranscriptIsLabelledOrderedAndRepeatable() {
        TranscriptRecorder recorder = builder().build();
        recorder.record(Speaker.AGENT, "안녕하세요, 어르신.");
        recorder.record(Speaker.USER, "  네, 잘 지냈어요  ");

        List<String> first = recorder.fullTranscript().collect(Collectors.toList());
        List<String> second = recorder.fullTranscript().collect(Collectors.toList());

        assertThat(first).containsExactly("AI: 안녕하세요, 어르신.", "어르신: 네, 잘 지냈어요");
        assertThat(second).isEqualTo(first);
        assertThat(recorder.fullTranscriptText()).isEqualTo("AI: 안녕하세요, 어르신.\n어르신: 네, 잘 지냈어요");
    }

    @Test
    void emptyRecorderHasEmptyTranscript() {
        TranscriptRecorder recorder = builder().build();
        assertThat(recorder.fullTranscript()).isEmpty();
        assertThat(recorder.fullTranscriptText()).isEmpty();
    }

    @Test
    void blankTextIsIgnored() {
        TranscriptRecorder recorder = builder().build();

        assertThat(recorder.record(Speaker.USER, "   ")).isEmpty();
        assertThat(recorder.record(Speaker.AGENT, null)).isEmpty();

        assertThat(recorder.size()).isZero();
        assertThat(store.texts()).isEmpty();
    }

    @Test
    void storeFailureNeverReachesCaller() {
        store.failing.set(true);
        TranscriptRecorder recorder = builder().build();

        assertThat(recorder.record(Speaker.USER, "허리가 아파요")).isPresent();
        assertThat(recorder.record(Speaker.AGENT, "많이 아프세요?")).isPresent();

        assertThat(recorder.size()).isEqualTo(2);
        assertThat(registry.get("sodam.transcript.store.failures").counter().count()).isEqualTo(2.0);
        assertThat(publisher.eventsOfType(SessionDegradedEvent.class))
                .extracting(SessionDegradedEvent::component)
                .containsOnly(SessionDegradedEvent.Component.TRANSCRIPT_STORE);
    }

    @Test
    void broadcastFailureIsIgnored() {
        TranscriptRecorder recorder = builder()
                .broadcaster(entry -> {
                    throw new IllegalStateException("room closed");
                })
                .build();

        assertThat(recorder.record(Speaker.AGENT, "오늘 날씨가 좋네요")).isPresent();
        assertThat(store.texts()).containsExactly("오늘 날씨가 좋네요");
        assertThat(registry.get("sodam.transcript.broadcast.failures").counter().count()).isEqualTo(1.0);
    }

    @Test
    void interimAndGatedUserSpeechIsNotRecorded() {
        AtomicBoolean paused = new AtomicBoolean(false);
        Predicate<String> gate = text -> !paused.get();
        TranscriptRecorder recorder = builder().userSpeechGate(gate).build();

        recorder.onUserSpeechFinalized("안녕", false);
        recorder.onUserSpeechFinalized("안녕하세요", true);
        paused.set(true);
        recorder.onUserSpeechFinalized("누구세요?", true);

        assertThat(recorder.userTranscripts()).containsExactly("안녕하세요");
    }

    @Test
    void onlyAssistantOutputIsRecordedAndFragmentsAreNormalized() {
        TranscriptRecorder recorder = builder().build();

        recorder.onAgentOutputAdded("user", MessageContent.text("ignored"));
        recorder.onAgentOutputAdded("assistant", MessageContent.fragments(List.of(
                new MessageContent.Text(" 식사는 "),
                new MessageContent.Opaque("audio"),
                new MessageContent.Text(""),
                new MessageContent.Text("하셨어요? "))));
        recorder.onAgentOutputAdded("assistant", MessageContent.fragments(List.of(new MessageContent.Opaque("image"))));

        assertThat(recorder.fullTranscript()).containsExactly("AI: 식사는 하셨어요?");
    }

    @Test
    void storeWritesKeepRecordedOrderOnAPool() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            store.delayMs = 2;
            TranscriptRecorder recorder = builder().storeExecutor(pool).build();
            for (int i = 0; i < 50; i++) {
                recorder.record(Speaker.USER, "u" + i);
            }

            recorder.flush().get(5, TimeUnit.SECONDS);

            assertThat(store.texts()).hasSize(50);
            assertThat(store.texts().get(0)).isEqualTo("u0");
            assertThat(store.texts().get(49)).isEqualTo("u49");
            assertThat(store.texts()).isSortedAccordingTo((a, b) ->
                    Integer.compare(Integer.parseInt(a.substring(1)), Integer.parseInt(b.substring(1))));
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void completingFlushFutureDoesNotAffectPendingWrites() throws Exception {
        ExecutorService single = Executors.newSingleThreadExecutor();
        try {
            store.delayMs = 50;
            TranscriptRecorder recorder = builder().storeExecutor(single).build();
            recorder.record(Speaker.USER, "a");
            recorder.flush().complete(null);
            recorder.record(Speaker.USER, "b");

            recorder.flush().get(5, TimeUnit.SECONDS);

            assertThat(store.texts()).containsExactly("a", "b");
        } finally {
            single.shutdownNow();
        }
    }

    @Test
    void usesConfiguredExpiry() {
        TranscriptRecorder recorder = builder().expiry(java.time.Duration.ofHours(2)).build();
        recorder.record(Speaker.USER, "hi");
        assertThat(store.lastExpirySeconds).isEqualTo(7200L);
    }

    /** Store double recording texts in write order. */
    static class RecordingStore implements TranscriptStore {
        final List<TranscriptEntry> appended = new CopyOnWriteArrayList<>();
        final AtomicBoolean failing = new AtomicBoolean(false);
        volatile long delayMs;
        volatile long lastExpirySeconds;

        @Override
        public void append(String callId, TranscriptEntry entry) {
            if (delayMs > 0) {
                try {
                    Thread.sleep(delayMs);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            if (failing.get()) {
                throw new TranscriptStoreException(callId, "redis down", new RuntimeException("connection refused"));
            }
            appended.add(entry);
        }

        @Override
        public void setExpiry(String callId, long seconds) {
            lastExpirySeconds = seconds;
        }

        List<String> texts() {
            return appended.stream().map(TranscriptEntry::text).toList();
        }
    }
}
