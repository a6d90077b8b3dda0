package com.phillippitts.sodam.service.takeover;

import com.phillippitts.sodam.config.logging.SessionMdc;
import com.phillippitts.sodam.domain.RoomMetadata;
import com.phillippitts.sodam.service.events.SessionDegradedEvent;
import com.phillippitts.sodam.service.metrics.SessionMetrics;
import com.phillippitts.sodam.service.room.RoomEvent;
import com.phillippitts.sodam.service.room.RoomEventListener;
import com.phillippitts.sodam.service.room.RoomMetadataParser;
import com.phillippitts.sodam.service.room.RoomTransport;
import com.phillippitts.sodam.service.takeover.event.TakeoverChangedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;

/**
 * Tracks whether a supervisor has taken over one session, from two unreliable channels.
 *
 * <p><b>Channels:</b>
 * <ul>
 *   <li><b>Events:</b> room metadata changes (explicit {@code takeover} flag) and
 *       participant/track events concerning privileged identities.</li>
 *   <li><b>Poll:</b> every {@code pollInterval} the participant snapshot is scanned with
 *       {@link SupervisorPresenceDetector}. This backs up event delivery, which is not
 *       guaranteed to be exhaustive.</li>
 * </ul>
 *
 * <p><b>Reconciliation:</b> both channels only push {@link TakeoverSignal} messages into one
 * serial {@code reconciler} executor. Participant snapshots behind a signal are read on that
 * executor, which applies each signal to the {@link TakeoverStateMachine} and runs the pause or
 * resume side effect for the resulting transition. Transitions for one session are therefore
 * strictly serialized and a change seen by both channels produces exactly one side effect.
 *
 * <p><b>Error Handling:</b> malformed metadata is ignored. Exceptions in an event handler, a
 * poll iteration or a side effect are caught, logged and counted; the subscription and the
 * poll loop keep running.
 *
 * @since 1.0
 */
public final class TakeoverMonitor implements RoomEventListener, AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(TakeoverMonitor.class);

    private final String sessionId;
    private final RoomTransport room;
    private final TakeoverStateMachine stateMachine;
    private final SupervisorPresenceDetector detector;
    private final TakeoverListener listener;
    private final Executor reconciler;
    private final TaskScheduler scheduler;
    private final Duration pollInterval;
    private final ApplicationEventPublisher publisher;
    private final SessionMetrics metrics;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile Map<String, String> sessionContext = Map.of();
    private volatile RoomTransport.Subscription subscription;
    private volatile ScheduledFuture<?> pollTask;

    private TakeoverMonitor(Builder b) {
        this.sessionId = Objects.requireNonNull(b.sessionId, "sessionId must not be null");
        this.room = Objects.requireNonNull(b.room, "room must not be null");
        this.stateMachine = Objects.requireNonNull(b.stateMachine, "stateMachine must not be null");
        this.detector = Objects.requireNonNull(b.detector, "detector must not be null");
        this.listener = Objects.requireNonNull(b.listener, "listener must not be null");
        this.reconciler = Objects.requireNonNull(b.reconciler, "reconciler must not be null");
        this.scheduler = Objects.requireNonNull(b.scheduler, "scheduler must not be null");
        this.pollInterval = Objects.requireNonNull(b.pollInterval, "pollInterval must not be null");
        this.publisher = Objects.requireNonNull(b.publisher, "publisher must not be null");
        this.metrics = Objects.requireNonNull(b.metrics, "metrics must not be null");
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Subscribes to room events, queues the room's current metadata and an initial participant
     * scan, and starts the poll loop. Call from the session thread so the session MDC is carried
     * into reconciliation logs.
     */
    public void start() {
        if (!running.compareAndSet(false, true)) {
            LOG.debug("Takeover monitor already running (session={})", sessionId);
            return;
        }
        sessionContext = SessionMdc.snapshot();
        subscription = room.subscribe(this);
        handleMetadata(room.metadata());
        pollOnce();
        Runnable poll = SessionMdc.withContext(sessionContext, this::pollOnce);
        pollTask = scheduler.scheduleAtFixedRate(poll, pollInterval);
        LOG.info("Takeover monitor started (prefix='{}', pollInterval={}ms)",
                detector.privilegedPrefix(), pollInterval.toMillis());
    }

    /**
     * Waits until every signal queued so far has been reconciled.
     *
     * @return false if the wait timed out, was interrupted or the reconciler is closed
     */
    public boolean awaitReconciled(Duration timeout) {
        CountDownLatch drained = new CountDownLatch(1);
        try {
            reconciler.execute(drained::countDown);
            return drained.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * Cancels the poll, unsubscribes and stops the reconciler. Signals still queued are dropped.
     * Idempotent.
     */
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        ScheduledFuture<?> task = pollTask;
        if (task != null) {
            task.cancel(false);
        }
        RoomTransport.Subscription sub = subscription;
        if (sub != null) {
            try {
                sub.close();
            } catch (RuntimeException e) {
                LOG.debug("Error closing room subscription: {}", e.toString());
            }
        }
        if (reconciler instanceof ExecutorService es) {
            es.shutdown();
        }
        LOG.info("Takeover monitor stopped (takeoverActive={})", stateMachine.isActive());
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isTakeoverActive() {
        return stateMachine.isActive();
    }

    public boolean isRunning() {
        return running.get();
    }

    @Override
    public void onEvent(RoomEvent event) {
        if (!running.get() || event == null) {
            return;
        }
        try {
            if (event instanceof RoomEvent.RoomMetadataChanged changed) {
                handleMetadata(changed.metadata());
            } else if (event instanceof RoomEvent.TrackPublished published) {
                if (detector.isPrivileged(published.identity()) && published.kind() == RoomEvent.TrackKind.AUDIO) {
                    submit(SignalSource.TRACK_EVENT, () -> true);
                }
            } else if (event instanceof RoomEvent.TrackUnpublished unpublished) {
                if (detector.isPrivileged(unpublished.identity()) && unpublished.kind() == RoomEvent.TrackKind.AUDIO) {
                    submit(SignalSource.TRACK_EVENT, () -> detector.isSupervisorPresent(room.participants()));
                }
            } else if (event instanceof RoomEvent.ParticipantLeft left) {
                if (detector.isPrivileged(left.identity())) {
                    submit(SignalSource.PARTICIPANT_EVENT,
                            () -> detector.isSupervisorPresentExcluding(room.participants(), left.identity()));
                }
            } else if (event instanceof RoomEvent.ParticipantJoined joined) {
                if (detector.isPrivileged(joined.identity())) {
                    LOG.info("Privileged participant joined: {}", joined.identity());
                    submit(SignalSource.PARTICIPANT_EVENT, () -> detector.isSupervisorPresent(room.participants()));
                }
            }
        } catch (RuntimeException e) {
            signalError(sourceOf(event), e);
        }
    }

    /**
     * One poll iteration. Never throws; the scheduler keeps the loop alive across failures.
     */
    void pollOnce() {
        if (!running.get()) {
            return;
        }
        try {
            submit(SignalSource.POLL, () -> detector.isSupervisorPresent(room.participants()));
        } catch (RuntimeException e) {
            signalError(SignalSource.POLL, e);
        }
    }

    private void handleMetadata(String raw) {
        RoomMetadata metadata = RoomMetadataParser.parse(raw);
        if (metadata.takeover().isPresent()) {
            boolean takeover = metadata.takeover().get();
            submit(SignalSource.METADATA, () -> takeover);
        } else {
            LOG.debug("Room metadata carries no takeover flag; ignoring");
        }
    }

    /**
     * Queues a signal whose presence value is read on the reconciler thread, so snapshot reads
     * happen in the same order as the transitions they drive.
     */
    private void submit(SignalSource source, BooleanSupplier presence) {
        try {
            reconciler.execute(SessionMdc.withContext(sessionContext, () -> reconcile(source, presence)));
        } catch (RejectedExecutionException e) {
            LOG.debug("Reconciler closed; dropping {} signal", source);
        }
    }

    private void reconcile(SignalSource source, BooleanSupplier presence) {
        if (!running.get()) {
            LOG.debug("Monitor stopped; dropping queued {} signal", source);
            return;
        }
        try {
            TakeoverSignal signal = new TakeoverSignal(source, presence.getAsBoolean());
            TakeoverStateMachine.Transition transition = stateMachine.apply(signal);
            switch (transition) {
                case STARTED -> {
                    LOG.info("Supervisor takeover detected via {}; pausing agent", source);
                    listener.onTakeoverStarted(signal);
                    onTransition(true, signal);
                }
                case ENDED -> {
                    LOG.info("Supervisor takeover ended via {}; resuming agent", source);
                    listener.onTakeoverEnded(signal);
                    onTransition(false, signal);
                }
                default -> LOG.trace("No transition for {}", signal);
            }
        } catch (RuntimeException e) {
            signalError(source, e);
        }
    }

    private void onTransition(boolean active, TakeoverSignal signal) {
        metrics.recordTakeoverTransition(active, signal.source().tag());
        publisher.publishEvent(new TakeoverChangedEvent(sessionId, active, signal.source(), Instant.now()));
    }

    private void signalError(SignalSource source, RuntimeException e) {
        LOG.warn("Takeover signal handling failed (source={}): {}", source, e.toString(), e);
        metrics.incrementSignalError(source.tag());
        publisher.publishEvent(new SessionDegradedEvent(sessionId, SessionDegradedEvent.Component.TAKEOVER_SIGNAL,
                e.getClass().getSimpleName(), Instant.now()));
    }

    private static SignalSource sourceOf(RoomEvent event) {
        if (event instanceof RoomEvent.RoomMetadataChanged) {
            return SignalSource.METADATA;
        }
        if (event instanceof RoomEvent.TrackPublished || event instanceof RoomEvent.TrackUnpublished) {
            return SignalSource.TRACK_EVENT;
        }
        return SignalSource.PARTICIPANT_EVENT;
    }

    /**
     * Builder for {@link TakeoverMonitor}. All fields are required.
     */
    public static final class Builder {
        private String sessionId;
        private RoomTransport room;
        private TakeoverStateMachine stateMachine;
        private SupervisorPresenceDetector detector;
        private TakeoverListener listener;
        private Executor reconciler;
        private TaskScheduler scheduler;
        private Duration pollInterval;
        private ApplicationEventPublisher publisher;
        private SessionMetrics metrics;

        private Builder() {
        }

        public Builder sessionId(String sessionId) {
            this.sessionId = sessionId;
            return this;
        }

        public Builder room(RoomTransport room) {
            this.room = room;
            return this;
        }

        public Builder stateMachine(TakeoverStateMachine stateMachine) {
            this.stateMachine = stateMachine;
            return this;
        }

        public Builder detector(SupervisorPresenceDetector detector) {
            this.detector = detector;
            return this;
        }

        public Builder listener(TakeoverListener listener) {
            this.listener = listener;
            return this;
        }

        /**
         * Serial executor that owns reconciliation. Must run tasks one at a time in submission
         * order; an {@link ExecutorService} is shut down by {@link TakeoverMonitor#stop()}.
         */
        public Builder reconciler(Executor reconciler) {
            this.reconciler = reconciler;
            return this;
        }

        public Builder scheduler(TaskScheduler scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        public Builder pollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
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

        public TakeoverMonitor build() {
            return new TakeoverMonitor(this);
        }
    }
}
