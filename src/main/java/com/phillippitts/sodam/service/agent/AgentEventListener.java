package com.phillippitts.sodam.service.agent;

import com.phillippitts.sodam.domain.MessageContent;

/**
 * Events emitted by the conversational agent runtime.
 */
public interface AgentEventListener {

    /**
     * A user utterance was transcribed.
     *
     * @param text transcribed text
     * @param isFinal true for a finalized utterance, false for an interim hypothesis
     */
    void onUserSpeechFinalized(String text, boolean isFinal);

    /**
     * A conversation item was added by the runtime.
     *
     * @param role item role, e.g. {@code "assistant"} or {@code "user"}
     * @param content text or fragment content
     */
    void onAgentOutputAdded(String role, MessageContent content);

    /** The runtime closed the session. */
    void onSessionEnded(String sessionId);
}
