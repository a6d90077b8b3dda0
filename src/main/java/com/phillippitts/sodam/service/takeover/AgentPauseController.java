package com.phillippitts.sodam.service.takeover;

import com.phillippitts.sodam.service.agent.ConversationAgent;
import com.phillippitts.sodam.service.events.SessionDegradedEvent;
import com.phillippitts.sodam.service.metrics.SessionMetrics;
import com.phillippitts.sodam.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Pauses and resumes the conversation agent on takeover transitions and gates user speech
 * while a supervisor is speaking.
 *
 * <p>On takeover start response generation is disabled, the agent's current output is
 * interrupted and, when the runtime supports it, the pending user turn is cleared. On takeover
 * end generation is enabled again and the agent speaks {@link #RESUME_ANNOUNCEMENT}. Output
 * already spoken is never rolled back.
 *
 * <p>No agent call is made before {@link #onAgentStarted(Runnable)} or after
 * {@link #onAgentStopped()}. A takeover that is already active when the agent starts leaves the
 * agent paused and suppresses the greeting; the resume announcement replaces it.
 *
 * <p>Agent-side failures are logged and published as {@link SessionDegradedEvent}s; they never
 * propagate to the reconciliation thread.
 */
public final class AgentPauseController implements TakeoverListener {

    private static final Logger LOG = LogManager.getLogger(AgentPauseController.class);

    /** Spoken by the agent whenever it resumes after a takeover, whichever channel ended it. */
    public static final String RESUME_ANNOUNCEMENT = "다시 소담이가 함께할게요. 이야기 계속 나눠요.";

    private static final int LOG_TEXT_LIMIT = 40;

    private final String sessionId;
    private final ConversationAgent agent;
    private final TakeoverStateMachine stateMachine;
    private final ApplicationEventPublisher publisher;
    private final SessionMetrics metrics;

    private final Lock agentLock = new ReentrantLock();
    private boolean agentRunning;

    public AgentPauseController(String sessionId,
                                ConversationAgent agent,
                                TakeoverStateMachine stateMachine,
                                ApplicationEventPublisher publisher,
                                SessionMetrics metrics) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId must not be null");
        this.agent = Objects.requireNonNull(agent, "agent must not be null");
        this.stateMachine = Objects.requireNonNull(stateMachine, "stateMachine must not be null");
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
    }

    @Override
    public void onTakeoverStarted(TakeoverSignal cause) {
        agentLock.lock();
        try {
            if (!agentRunning) {
                LOG.info("Supervisor takeover before agent start; agent will start paused");
                return;
            }
            pause();
        } finally {
            agentLock.unlock();
        }
    }

    @Override
    public void onTakeoverEnded(TakeoverSignal cause) {
        agentLock.lock();
        try {
            if (!agentRunning) {
                LOG.debug("Takeover ended while agent not running; nothing to resume");
                return;
            }
            resume();
        } finally {
            agentLock.unlock();
        }
    }

    /**
     * Marks the agent as started and runs the greeting unless a takeover is active, in which
     * case the agent is left paused until the takeover ends.
     *
     * @param greeting action that speaks the opening utterance
     * @return true if the greeting ran
     */
    public boolean onAgentStarted(Runnable greeting) {
        Objects.requireNonNull(greeting, "greeting must not be null");
        agentLock.lock();
        try {
            agentRunning = true;
            if (stateMachine.isActive()) {
                setInput(false);
                LOG.info("Agent started under supervisor takeover; greeting suppressed");
                return false;
            }
            greeting.run();
            return true;
        } finally {
            agentLock.unlock();
        }
    }

    /** Stops forwarding takeover transitions to the agent. Idempotent. */
    public void onAgentStopped() {
        agentLock.lock();
        try {
            agentRunning = false;
        } finally {
            agentLock.unlock();
        }
    }

    private void pause() {
        setInput(false);
        try {
            agent.interrupt();
            if (agent.supportsClearUserTurn()) {
                agent.clearUserTurn();
            }
            LOG.info("Agent paused for supervisor takeover");
        } catch (RuntimeException e) {
            agentFailed("pause", e);
        }
    }

    private void resume() {
        setInput(true);
        try {
            agent.say(RESUME_ANNOUNCEMENT);
            LOG.info("Agent resumed after supervisor takeover");
        } catch (RuntimeException e) {
            agentFailed("resume", e);
        }
    }

    private void setInput(boolean enabled) {
        try {
            agent.setInputEnabled(enabled);
        } catch (RuntimeException e) {
            agentFailed(enabled ? "input enable" : "input disable", e);
        }
    }

    /**
     * Decides whether a finalized user utterance should reach the agent's transcript. The
     * takeover state is read when the utterance is processed, not when it started.
     *
     * @param text finalized utterance
     * @return false while a takeover is active
     */
    public boolean acceptUserSpeech(String text) {
        if (!stateMachine.isActive()) {
            return true;
        }
        metrics.incrementDiscardedUserSpeech();
        LOG.info("Discarding user speech during takeover: '{}'", LogSanitizer.truncate(text, LOG_TEXT_LIMIT));
        return false;
    }

    private void agentFailed(String action, RuntimeException e) {
        LOG.warn("Agent {} failed during takeover handling: {}", action, e.toString(), e);
        publisher.publishEvent(new SessionDegradedEvent(sessionId, SessionDegradedEvent.Component.AGENT_CONTROL,
                e.getClass().getSimpleName(), Instant.now()));
    }
}
