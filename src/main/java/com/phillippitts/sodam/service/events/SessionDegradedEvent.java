package com.phillippitts.sodam.service.events;

import java.time.Instant;

/**
 * Published when an in-session operation failed and was skipped. The session stays alive;
 * the event only feeds logs and alerting.
 *
 * @param sessionId session in which the failure happened
 * @param component component that absorbed the failure
 * @param reason short, non-PII reason (exception class or status)
 * @param timestamp when the failure was observed
 */
public record SessionDegradedEvent(String sessionId, Component component, String reason, Instant timestamp) {

    public enum Component {
        TAKEOVER_SIGNAL,
        AGENT_CONTROL,
        TRANSCRIPT_STORE,
        TRANSCRIPT_BROADCAST,
        NOTIFICATION
    }
}
