package com.phillippitts.sodam.service.session;

import com.phillippitts.sodam.config.logging.SessionMdc;
import com.phillippitts.sodam.config.properties.PostSessionProperties;
import com.phillippitts.sodam.config.properties.SessionProperties;
import com.phillippitts.sodam.config.properties.TakeoverProperties;
import com.phillippitts.sodam.config.properties.TranscriptProperties;
import com.phillippitts.sodam.domain.SessionIdentity;
import com.phillippitts.sodam.domain.SessionOutcome;
import com.phillippitts.sodam.service.agent.ConversationAgent;
import com.phillippitts.sodam.service.metrics.SessionMetrics;
import com.phillippitts.sodam.service.postsession.PostSessionCoordinator;
import com.phillippitts.sodam.service.postsession.PostSessionTask;
import com.phillippitts.sodam.service.room.RoomMetadataParser;
import com.phillippitts.sodam.service.room.RoomTransport;
import com.phillippitts.sodam.service.takeover.AgentPauseController;
import com.phillippitts.sodam.service.takeover.SupervisorPresenceDetector;
import com.phillippitts.sodam.service.takeover.TakeoverMonitor;
import com.phillippitts.sodam.service.takeover.TakeoverStateMachine;
import com.phillippitts.sodam.service.transcript.RoomTranscriptBroadcaster;
import com.phillippitts.sodam.service.transcript.TranscriptBroadcaster;
import com.phillippitts.sodam.service.transcript.TranscriptRecorder;
import com.phillippitts.sodam.service.transcript.TranscriptStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONObject;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Drives one session from room join to post-session completion.
 *
 * <p><b>Lifecycle</b> of {@link #runSession(RoomTransport, ConversationAgent)}:
 * <ol>
 *   <li>Publish the agent's participant metadata (best-effort).</li>
 *   <li>Resolve the {@link SessionIdentity}.</li>
 *   <li>Discover the counterpart to listen to (bounded, non-fatal).</li>
 *   <li>Wire the per-session takeover monitor, pause controller, transcript recorder and
 *       post-session coordinator, and register the session.</li>
 *   <li>Reconcile the room's initial takeover state, then start the agent. The greeting is
 *       skipped when a supervisor has already taken over.</li>
 *   <li>Block until the post-session completion signal fires, then tear down.</li>
 * </ol>
 *
 * <p><b>Thread Model:</b> the calling thread owns the session for its whole life; use
 * {@link #startSession(RoomTransport, ConversationAgent)} to run it on the session executor.
 * Each session gets its own single-threaded takeover reconciler; everything else is shared.
 *
 * <p><b>Error Handling:</b> only a failure before the components are wired (for example a
 * broken transport) propagates. After that, agent start-up failures end the session through
 * the normal post-session path.
 */
@Service
public class SessionOrchestrator {

    private static final Logger LOG = LogManager.getLogger(SessionOrchestrator.class);

    private final SessionProperties sessionProps;
    private final TakeoverProperties takeoverProps;
    private final TranscriptProperties transcriptProps;
    private final PostSessionProperties postSessionProps;
    private final SessionIdentityResolver identityResolver;
    private final CounterpartDiscovery counterpartDiscovery;
    private final ActiveSessionRegistry registry;
    private final TranscriptStore transcriptStore;
    private final List<PostSessionTask> postSessionTasks;
    private final Executor sessionExecutor;
    private final Executor notificationExecutor;
    private final Executor transcriptExecutor;
    private final TaskScheduler takeoverScheduler;
    private final ApplicationEventPublisher publisher;
    private final SessionMetrics metrics;

    public SessionOrchestrator(SessionProperties sessionProps,
                               TakeoverProperties takeoverProps,
                               TranscriptProperties transcriptProps,
                               PostSessionProperties postSessionProps,
                               SessionIdentityResolver identityResolver,
                               CounterpartDiscovery counterpartDiscovery,
                               ActiveSessionRegistry registry,
                               TranscriptStore transcriptStore,
                               List<PostSessionTask> postSessionTasks,
                               @Qualifier("sessionExecutor") Executor sessionExecutor,
                               @Qualifier("notificationExecutor") Executor notificationExecutor,
                               @Qualifier("transcriptExecutor") Executor transcriptExecutor,
                               @Qualifier("takeoverScheduler") TaskScheduler takeoverScheduler,
                               ApplicationEventPublisher publisher,
                               SessionMetrics metrics) {
        this.sessionProps = Objects.requireNonNull(sessionProps);
        this.takeoverProps = Objects.requireNonNull(takeoverProps);
        this.transcriptProps = Objects.requireNonNull(transcriptProps);
        this.postSessionProps = Objects.requireNonNull(postSessionProps);
        this.identityResolver = Objects.requireNonNull(identityResolver);
        this.counterpartDiscovery = Objects.requireNonNull(counterpartDiscovery);
        this.registry = Objects.requireNonNull(registry);
        this.transcriptStore = Objects.requireNonNull(transcriptStore);
        this.postSessionTasks = List.copyOf(postSessionTasks);
        this.sessionExecutor = Objects.requireNonNull(sessionExecutor);
        this.notificationExecutor = Objects.requireNonNull(notificationExecutor);
        this.transcriptExecutor = Objects.requireNonNull(transcriptExecutor);
        this.takeoverScheduler = Objects.requireNonNull(takeoverScheduler);
        this.publisher = Objects.requireNonNull(publisher);
        this.metrics = Objects.requireNonNull(metrics);
    }

    /**
     * Runs {@link #runSession(RoomTransport, ConversationAgent)} on the session executor.
     */
    public CompletableFuture<SessionOutcome> startSession(RoomTransport room, ConversationAgent agent) {
        return CompletableFuture.supplyAsync(() -> runSession(room, agent), sessionExecutor);
    }

    /**
     * Runs a session on the calling thread and returns once post-session work has completed.
     *
     * @param room room the agent has joined
     * @param agent conversational agent for this session
     * @return summary of the finished session
     */
    public SessionOutcome runSession(RoomTransport room, ConversationAgent agent) {
        Objects.requireNonNull(room, "room must not be null");
        Objects.requireNonNull(agent, "agent must not be null");
        String sessionId = UUID.randomUUID().toString();
        long t0 = System.nanoTime();
        SessionMdc.begin(sessionId, room.roomName());
        TakeoverMonitor monitor = null;
        AgentPauseController pauseController = null;
        boolean registered = false;
        try {
            LOG.info("Session starting in room {}", room.roomName());
            publishAgentMetadata(room);

            SessionIdentity identity = identityResolver.resolve(room.roomName(),
                    RoomMetadataParser.parse(room.metadata()));
            SessionMdc.identify(identity);
            Optional<String> counterpart = counterpartDiscovery.discover(room);

            TakeoverStateMachine stateMachine = new TakeoverStateMachine();
            pauseController = new AgentPauseController(sessionId, agent, stateMachine, publisher, metrics);
            monitor = TakeoverMonitor.builder()
                    .sessionId(sessionId)
                    .room(room)
                    .stateMachine(stateMachine)
                    .detector(new SupervisorPresenceDetector(takeoverProps.getPrivilegedIdentityPrefix()))
                    .listener(pauseController)
                    .reconciler(newReconciler(sessionId))
                    .scheduler(takeoverScheduler)
                    .pollInterval(takeoverProps.getPollInterval())
                    .publisher(publisher)
                    .metrics(metrics)
                    .build();
            TranscriptRecorder recorder = TranscriptRecorder.builder()
                    .sessionId(sessionId)
                    .callId(identity.callId())
                    .capacity(transcriptProps.getCapacity())
                    .store(transcriptStore)
                    .expiry(transcriptProps.getTtl())
                    .broadcaster(broadcasterFor(room))
                    .storeExecutor(transcriptExecutor)
                    .userSpeechGate(pauseController::acceptUserSpeech)
                    .publisher(publisher)
                    .metrics(metrics)
                    .build();
            PostSessionCoordinator coordinator = new PostSessionCoordinator(postSessionTasks,
                    notificationExecutor, postSessionProps.getTimeout(), publisher, metrics);
            SessionEventRouter router = new SessionEventRouter(sessionId, identity, recorder, coordinator,
                    transcriptProps.getFlushTimeout());

            registry.register(new SessionHandle(sessionId, room.roomName(), identity, counterpart,
                    monitor, recorder, coordinator, Instant.now()));
            registered = true;
            monitor.start();
            if (!monitor.awaitReconciled(takeoverProps.getPollInterval())) {
                LOG.warn("Initial takeover state not reconciled within {} ms; starting agent anyway",
                        takeoverProps.getPollInterval().toMillis());
            }

            if (startAgent(agent, identity, counterpart, router)) {
                if (!pauseController.onAgentStarted(() -> greet(agent))) {
                    LOG.info("Greeting skipped; supervisor has taken over");
                }
            } else {
                router.endSession();
            }

            boolean completed = awaitCompletion(coordinator, router);
            Duration duration = Duration.ofNanos(System.nanoTime() - t0);
            LOG.info("Session finished after {} s (entries={}, postSessionCompleted={})",
                    duration.toSeconds(), recorder.size(), completed);
            return new SessionOutcome(sessionId, identity, counterpart, recorder.size(), completed, duration);
        } finally {
            if (pauseController != null) {
                pauseController.onAgentStopped();
            }
            if (monitor != null) {
                monitor.stop();
            }
            if (registered) {
                registry.unregister(sessionId);
            }
            SessionMdc.clear();
        }
    }

    private boolean startAgent(ConversationAgent agent,
                               SessionIdentity identity,
                               Optional<String> counterpart,
                               SessionEventRouter router) {
        try {
            agent.start(identity, counterpart, router);
            LOG.info("Agent started (counterpart={})", counterpart.orElse("<all>"));
            return true;
        } catch (RuntimeException e) {
            LOG.error("Agent failed to start; ending session", e);
            return false;
        }
    }

    private void greet(ConversationAgent agent) {
        try {
            agent.say(sessionProps.getGreeting());
        } catch (RuntimeException e) {
            LOG.warn("Greeting failed: {}", e.toString());
        }
    }

    private boolean awaitCompletion(PostSessionCoordinator coordinator, SessionEventRouter router) {
        try {
            coordinator.awaitCompletion();
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Session thread interrupted; running post-session tasks before exit");
            router.endSession();
            return awaitBounded(coordinator);
        }
    }

    private boolean awaitBounded(PostSessionCoordinator coordinator) {
        Duration maxWait = postSessionProps.getTimeout().plus(transcriptProps.getFlushTimeout());
        boolean interrupted = Thread.interrupted();
        try {
            return coordinator.awaitCompletion(maxWait);
        } catch (InterruptedException e) {
            interrupted = true;
            return coordinator.isComplete();
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private void publishAgentMetadata(RoomTransport room) {
        String metadata = new JSONObject()
                .put("type", "agent")
                .put("name", sessionProps.getAgentName())
                .put("language", sessionProps.getLanguage())
                .toString();
        try {
            room.setLocalMetadata(metadata);
        } catch (RuntimeException e) {
            LOG.warn("Could not publish agent metadata: {}", e.toString());
        }
    }

    private TranscriptBroadcaster broadcasterFor(RoomTransport room) {
        return transcriptProps.isBroadcastEnabled()
                ? new RoomTranscriptBroadcaster(room, transcriptProps.getBroadcastTopic())
                : TranscriptBroadcaster.NONE;
    }

    private static ExecutorService newReconciler(String sessionId) {
        CustomizableThreadFactory factory =
                new CustomizableThreadFactory("takeover-" + sessionId.substring(0, 8) + "-");
        factory.setDaemon(true);
        return Executors.newSingleThreadExecutor(factory);
    }
}
