package com.phillippitts.sodam.service.takeover;

import com.phillippitts.sodam.service.events.SessionDegradedEvent;
import com.phillippitts.sodam.service.metrics.SessionMetrics;
import com.phillippitts.sodam.service.takeover.event.TakeoverChangedEvent;
import com.phillippitts.sodam.testutil.EventCapturingPublisher;
import com.phillippitts.sodam.testutil.FakeConversationAgent;
import com.phillippitts.sodam.testutil.FakeRoomTransport;
import com.phillippitts.sodam.testutil.SyncExecutor;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class TakeoverMonitorTest {

    private static final String RESUME = "say:" + AgentPauseController.RESUME_ANNOUNCEMENT;

    private FakeRoomTransport room;
    private FakeConversationAgent agent;
    private EventCapturingPublisher publisher;
    private SimpleMeterRegistry registry;
    private TakeoverStateMachine stateMachine;
    private TaskScheduler scheduler;
    private ScheduledFuture<?> pollFuture;
    private TakeoverMonitor monitor;

    @BeforeEach
    void setUp() {
        room = new FakeRoomTransport("call_42_20240101");
        agent = new FakeConversationAgent();
        publisher = new EventCapturingPublisher();
        registry = new SimpleMeterRegistry();
        stateMachine = new TakeoverStateMachine();
        scheduler = mock(TaskScheduler.class);
        pollFuture = mock(ScheduledFuture.class);
        doReturn(pollFuture).when(scheduler).scheduleAtFixedRate(any(Runnable.class), any(Duration.class));
    }

    @AfterEach
    void tearDown() {
        if (monitor != null) {
            monitor.stop();
        }
    }

    private TakeoverMonitor newMonitor(java.util.concurrent.Executor reconciler, TakeoverListener listener) {
        SessionMetrics metrics = new SessionMetrics(registry);
        return TakeoverMonitor.builder()
                .sessionId("s-1")
                .room(room)
                .stateMachine(stateMachine)
                .detector(new SupervisorPresenceDetector("admin_"))
                .listener(listener)
                .reconciler(reconciler)
                .scheduler(scheduler)
                .pollInterval(Duration.ofSeconds(2))
                .publisher(publisher)
                .metrics(metrics)
                .build();
    }

    private AgentPauseController runningAgentController() {
        AgentPauseController controller = new AgentPauseController("s-1", agent, stateMachine, publisher,
                new SessionMetrics(registry));
        controller.onAgentStarted(() -> { });
        return controller;
    }

    private TakeoverMonitor startSyncMonitor() {
        monitor = newMonitor(new SyncExecutor(), runningAgentController());
        monitor.start();
        return monitor;
    }

    @Test
    void supervisorPublishAndUnpublishPausesAndResumesOnce() {
        startSyncMonitor();

        room.join("admin_1");
        assertThat(agent.calls).isEmpty();

        room.publishAudio("admin_1");
        assertThat(monitor.isTakeoverActive()).isTrue();

        monitor.pollOnce();
        monitor.pollOnce();

        room.unpublishAudio("admin_1");
        monitor.pollOnce();

        assertThat(agent.calls).containsExactly("interrupt", RESUME);
        assertThat(monitor.isTakeoverActive()).isFalse();
    }

    @Test
    void pollDetectsSupervisorWhenEventsAreMissed() {
        startSyncMonitor();

        room.addParticipant("admin_1", 1);
        monitor.pollOnce();
        assertThat(monitor.isTakeoverActive()).isTrue();

        room.addParticipant("admin_1", 0);
        monitor.pollOnce();

        assertThat(monitor.isTakeoverActive()).isFalse();
        assertThat(agent.calls).containsExactly("interrupt", RESUME);
    }

    @Test
    void participantLeftWhileStillInSnapshotEndsTakeover() {
        startSyncMonitor();
        room.addParticipant("admin_1", 1);
        monitor.pollOnce();

        // Leave event delivered before the snapshot drops the participant
        room.fire(new com.phillippitts.sodam.service.room.RoomEvent.ParticipantLeft("admin_1"));

        assertThat(monitor.isTakeoverActive()).isFalse();
        assertThat(agent.count(RESUME)).isEqualTo(1);
    }

    @Test
    void metadataFlagIsAuthoritativeOverSteadyPoll() {
        startSyncMonitor();

        room.changeMetadata("{\"takeover\": true}");
        monitor.pollOnce();
        monitor.pollOnce();
        assertThat(monitor.isTakeoverActive()).isTrue();

        room.changeMetadata("{\"takeover\": false}");
        assertThat(monitor.isTakeoverActive()).isFalse();
        assertThat(agent.calls).containsExactly("interrupt", RESUME);
    }

    @Test
    void initialRoomMetadataIsAppliedOnStart() {
        room.metadata = "{\"wardId\":\"42\",\"callId\":\"c-1\",\"takeover\":true}";
        startSyncMonitor();

        assertThat(monitor.isTakeoverActive()).isTrue();
        assertThat(agent.calls).containsExactly("interrupt");
        assertThat(agent.inputEnabled).isFalse();
    }

    @Test
    void supervisorAlreadyPublishingIsDetectedOnStart() {
        room.addParticipant("admin_1", 1);
        startSyncMonitor();

        assertThat(monitor.isTakeoverActive()).isTrue();
        assertThat(agent.calls).containsExactly("interrupt");
    }

    @Test
    void awaitReconciledDrainsQueuedSignals() {
        room.metadata = "{\"takeover\":true}";
        ExecutorService reconciler = Executors.newSingleThreadExecutor();
        monitor = newMonitor(reconciler, runningAgentController());
        monitor.start();

        assertThat(monitor.awaitReconciled(Duration.ofSeconds(2))).isTrue();
        assertThat(monitor.isTakeoverActive()).isTrue();

        monitor.stop();
        assertThat(monitor.awaitReconciled(Duration.ofMillis(100))).isFalse();
    }

    @Test
    void signalsQueuedBeforeStopAreDroppedAfterIt() {
        List<Runnable> queued = new CopyOnWriteArrayList<>();
        monitor = newMonitor(queued::add, runningAgentController());
        monitor.start();
        room.join("admin_1");
        room.publishAudio("admin_1");

        monitor.stop();
        queued.forEach(Runnable::run);

        assertThat(monitor.isTakeoverActive()).isFalse();
        assertThat(agent.calls).isEmpty();
        assertThat(publisher.eventsOfType(TakeoverChangedEvent.class)).isEmpty();
    }

    @Test
    void malformedMetadataIsIgnored() {
        startSyncMonitor();

        room.changeMetadata("{not json");
        room.changeMetadata("{\"takeover\": \"yes\"}");
        room.changeMetadata("[true]");

        assertThat(monitor.isTakeoverActive()).isFalse();
        assertThat(agent.calls).isEmpty();
    }

    @Test
    void nonPrivilegedAndNonAudioTracksAreIgnored() {
        startSyncMonitor();

        room.join("ward-7");
        room.publishAudio("ward-7");
        room.fire(new com.phillippitts.sodam.service.room.RoomEvent.TrackPublished("admin_1",
                com.phillippitts.sodam.service.room.RoomEvent.TrackKind.VIDEO));

        assertThat(monitor.isTakeoverActive()).isFalse();
        assertThat(agent.calls).isEmpty();
    }

    @Test
    void transitionsArePublishedAndCounted() {
        startSyncMonitor();
        room.join("admin_1");
        room.publishAudio("admin_1");
        room.unpublishAudio("admin_1");

        List<TakeoverChangedEvent> events = publisher.eventsOfType(TakeoverChangedEvent.class);
        assertThat(events).extracting(TakeoverChangedEvent::active).containsExactly(true, false);
        assertThat(events).extracting(TakeoverChangedEvent::source)
                .containsExactly(SignalSource.TRACK_EVENT, SignalSource.TRACK_EVENT);
        assertThat(registry.get("sodam.takeover.transitions").tag("direction", "pause").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void pollFailureIsCountedAndLoopContinues() {
        startSyncMonitor();

        room.participantsFailure = new IllegalStateException("transport hiccup");
        monitor.pollOnce();

        room.participantsFailure = null;
        room.addParticipant("admin_1", 1);
        monitor.pollOnce();

        assertThat(monitor.isTakeoverActive()).isTrue();
        assertThat(registry.get("sodam.takeover.signal.errors").tag("source", "poll").counter().count())
                .isEqualTo(1.0);
        assertThat(publisher.eventsOfType(SessionDegradedEvent.class))
                .extracting(SessionDegradedEvent::component)
                .containsExactly(SessionDegradedEvent.Component.TAKEOVER_SIGNAL);
    }

    @Test
    void listenerFailureDoesNotStopLaterTransitions() {
        TakeoverListener throwingOnStart = new TakeoverListener() {
            @Override
            public void onTakeoverStarted(TakeoverSignal cause) {
                throw new IllegalStateException("boom");
            }

            @Override
            public void onTakeoverEnded(TakeoverSignal cause) {
                agent.say("resumed");
            }
        };
        monitor = newMonitor(new SyncExecutor(), throwingOnStart);
        monitor.start();

        room.join("admin_1");
        room.publishAudio("admin_1");
        room.unpublishAudio("admin_1");

        assertThat(monitor.isTakeoverActive()).isFalse();
        assertThat(agent.calls).containsExactly("say:resumed");
        assertThat(registry.get("sodam.takeover.signal.errors").counter().count()).isEqualTo(1.0);
    }

    @Test
    void startSchedulesPollAndStopCancelsIt() {
        startSyncMonitor();
        verify(scheduler).scheduleAtFixedRate(any(Runnable.class), eq(Duration.ofSeconds(2)));
        assertThat(room.listenerCount()).isEqualTo(1);

        monitor.stop();

        verify(pollFuture).cancel(false);
        assertThat(room.listenerCount()).isZero();
        assertThat(monitor.isRunning()).isFalse();

        room.addParticipant("admin_1", 1);
        monitor.pollOnce();
        assertThat(agent.calls).isEmpty();
    }

    @Test
    void concurrentEventAndPollProduceSinglePause() throws Exception {
        ExecutorService reconciler = Executors.newSingleThreadExecutor();
        monitor = newMonitor(reconciler, runningAgentController());
        monitor.start();

        room.join("admin_1");
        CountDownLatch go = new CountDownLatch(1);
        Thread eventThread = new Thread(() -> {
            awaitQuietly(go);
            room.publishAudio("admin_1");
        });
        Thread pollThread = new Thread(() -> {
            awaitQuietly(go);
            for (int i = 0; i < 20; i++) {
                monitor.pollOnce();
            }
        });
        eventThread.start();
        pollThread.start();
        go.countDown();
        eventThread.join(5000);
        pollThread.join(5000);

        await().atMost(2, TimeUnit.SECONDS).until(monitor::isTakeoverActive);
        await().during(200, TimeUnit.MILLISECONDS).atMost(1, TimeUnit.SECONDS)
                .until(() -> agent.count("interrupt") == 1);
        assertThat(agent.calls).containsOnly("interrupt");
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
