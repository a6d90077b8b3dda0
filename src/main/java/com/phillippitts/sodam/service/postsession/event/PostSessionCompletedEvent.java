package com.phillippitts.sodam.service.postsession.event;

import java.time.Instant;

/**
 * Emitted when a session's post-session task set finished or hit its deadline.
 *
 * @param sessionId orchestrator session id
 * @param callId call the notifications were about
 * @param succeeded tasks that completed without error
 * @param failed tasks that raised an error
 * @param timedOut whether the overall deadline expired before every task finished
 * @param elapsedMs time from start to completion signal
 * @param timestamp when the completion signal fired
 */
public record PostSessionCompletedEvent(String sessionId,
                                        String callId,
                                        int succeeded,
                                        int failed,
                                        boolean timedOut,
                                        long elapsedMs,
                                        Instant timestamp) {
}
