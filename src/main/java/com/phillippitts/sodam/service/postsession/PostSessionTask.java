package com.phillippitts.sodam.service.postsession;

import com.phillippitts.sodam.domain.SessionIdentity;

/**
 * One notification fired after a session ends. Implementations are shared Spring beans and
 * must be thread-safe.
 *
 * <p>{@link #execute(String, SessionIdentity)} may throw; the coordinator catches, logs and
 * counts the failure without affecting the other tasks.
 */
public interface PostSessionTask {

    /** Short name used in logs and metric tags. */
    String name();

    void execute(String sessionId, SessionIdentity identity);
}
