package com.phillippitts.sodam.domain;

import java.time.Duration;
import java.util.Optional;

/**
 * Summary returned when a session finishes.
 *
 * @param sessionId orchestrator-assigned session id
 * @param identity resolved identity
 * @param counterpart identity the agent listened to, empty when listening to all
 * @param transcriptEntries entries retained by the recorder at teardown
 * @param postSessionCompleted whether the post-session completion signal fired
 * @param duration wall-clock session duration
 */
public record SessionOutcome(String sessionId,
                             SessionIdentity identity,
                             Optional<String> counterpart,
                             int transcriptEntries,
                             boolean postSessionCompleted,
                             Duration duration) {
}
