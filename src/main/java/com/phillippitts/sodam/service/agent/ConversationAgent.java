package com.phillippitts.sodam.service.agent;

import com.phillippitts.sodam.domain.SessionIdentity;

import java.util.Optional;

/**
 * Control surface of the conversational agent runtime (speech recognition, language
 * generation and speech synthesis live behind it).
 *
 * <p>Implementations must be safe to call from the session thread, the takeover
 * reconciliation thread and the runtime's own event thread.
 */
public interface ConversationAgent {

    /**
     * Starts the agent for the resolved session.
     *
     * @param identity resolved session identity
     * @param counterpart participant identity to listen to; empty means listen to everyone
     * @param listener receiver for speech, output and session-end events
     */
    void start(SessionIdentity identity, Optional<String> counterpart, AgentEventListener listener);

    /** Stops current synthesis and generation immediately. */
    void interrupt();

    /**
     * Enables or disables response generation. While disabled, finalized user speech is still
     * reported to the listener but is not forwarded to language generation, so the agent
     * produces no new reply.
     *
     * @param enabled false to pause the agent, true to resume it
     */
    void setInputEnabled(boolean enabled);

    /** Whether {@link #clearUserTurn()} is implemented by this runtime. */
    default boolean supportsClearUserTurn() {
        return false;
    }

    /** Drops any pending partial user utterance. */
    default void clearUserTurn() {
        throw new UnsupportedOperationException("clearUserTurn not supported");
    }

    /** Speaks a fixed utterance. */
    void say(String text);
}
