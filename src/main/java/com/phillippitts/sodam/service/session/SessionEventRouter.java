package com.phillippitts.sodam.service.session;

import com.phillippitts.sodam.config.logging.SessionMdc;
import com.phillippitts.sodam.domain.MessageContent;
import com.phillippitts.sodam.domain.SessionIdentity;
import com.phillippitts.sodam.service.agent.AgentEventListener;
import com.phillippitts.sodam.service.postsession.PostSessionCoordinator;
import com.phillippitts.sodam.service.transcript.TranscriptRecorder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Routes agent runtime events for one session: speech and output go to the transcript recorder,
 * session end flushes pending transcript writes and starts the post-session tasks.
 *
 * <p>Callbacks arrive on the runtime's threads, so each one runs with the session MDC captured
 * when the router was created, and none of them throws back into the runtime.
 */
final class SessionEventRouter implements AgentEventListener {

    private static final Logger LOG = LogManager.getLogger(SessionEventRouter.class);

    private final String sessionId;
    private final SessionIdentity identity;
    private final TranscriptRecorder recorder;
    private final PostSessionCoordinator coordinator;
    private final Duration flushTimeout;
    private final Map<String, String> sessionContext;

    SessionEventRouter(String sessionId,
                       SessionIdentity identity,
                       TranscriptRecorder recorder,
                       PostSessionCoordinator coordinator,
                       Duration flushTimeout) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId must not be null");
        this.identity = Objects.requireNonNull(identity, "identity must not be null");
        this.recorder = Objects.requireNonNull(recorder, "recorder must not be null");
        this.coordinator = Objects.requireNonNull(coordinator, "coordinator must not be null");
        this.flushTimeout = Objects.requireNonNull(flushTimeout, "flushTimeout must not be null");
        this.sessionContext = SessionMdc.snapshot();
    }

    @Override
    public void onUserSpeechFinalized(String text, boolean isFinal) {
        inContext(() -> recorder.onUserSpeechFinalized(text, isFinal), "user speech");
    }

    @Override
    public void onAgentOutputAdded(String role, MessageContent content) {
        inContext(() -> recorder.onAgentOutputAdded(role, content), "agent output");
    }

    @Override
    public void onSessionEnded(String runtimeSessionId) {
        inContext(() -> {
            LOG.info("Agent session ended (runtime session={}, transcript entries={})",
                    runtimeSessionId, recorder.size());
            endSession();
        }, "session end");
    }

    /**
     * Waits up to the flush timeout for pending transcript writes, then starts the post-session
     * tasks. Safe to call more than once; the tasks run only once.
     *
     * @return the coordinator's completion signal
     */
    CompletableFuture<Void> endSession() {
        return recorder.flush()
                .completeOnTimeout(null, flushTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .thenCompose(v -> coordinator.runPostSessionTasks(sessionId, identity));
    }

    private void inContext(Runnable action, String what) {
        SessionMdc.withContext(sessionContext, () -> {
            try {
                action.run();
            } catch (RuntimeException e) {
                LOG.error("Failed to handle {} event", what, e);
            }
        }).run();
    }
}
