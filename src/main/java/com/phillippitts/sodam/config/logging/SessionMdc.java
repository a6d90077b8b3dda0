package com.phillippitts.sodam.config.logging;

import com.phillippitts.sodam.domain.SessionIdentity;
import org.apache.logging.log4j.ThreadContext;

import java.util.Map;

/**
 * Adds session-scoped values to Log4j2's MDC (ThreadContext) for structured logging.
 *
 * <p>Values added:</p>
 * <ul>
 *   <li>sessionId: orchestrator-assigned session id</li>
 *   <li>room: room name</li>
 *   <li>wardId / callId: once the session identity is resolved</li>
 * </ul>
 *
 * <p>The session thread clears the context when the session ends to avoid leakage across
 * sessions sharing a pool thread.</p>
 */
public final class SessionMdc {

    public static final String SESSION_ID = "sessionId";
    public static final String ROOM = "room";
    public static final String WARD_ID = "wardId";
    public static final String CALL_ID = "callId";

    private SessionMdc() {
    }

    public static void begin(String sessionId, String roomName) {
        ThreadContext.put(SESSION_ID, sessionId);
        ThreadContext.put(ROOM, roomName);
    }

    public static void identify(SessionIdentity identity) {
        ThreadContext.put(WARD_ID, identity.wardId());
        ThreadContext.put(CALL_ID, identity.callId());
    }

    public static void clear() {
        ThreadContext.clearAll();
    }

    /**
     * Wraps a task so it runs with the MDC captured from the submitting thread, restoring the
     * worker's previous context afterwards.
     */
    public static Runnable propagating(Runnable runnable) {
        return withContext(ThreadContext.getImmutableContext(), runnable);
    }

    /**
     * Wraps a task so it runs with the given MDC snapshot. Used for work submitted from threads
     * that carry no session context, such as transport callbacks.
     */
    public static Runnable withContext(Map<String, String> contextMap, Runnable runnable) {
        return () -> {
            Map<String, String> previous = ThreadContext.getImmutableContext();
            try {
                if (contextMap != null && !contextMap.isEmpty()) {
                    ThreadContext.putAll(contextMap);
                }
                runnable.run();
            } finally {
                ThreadContext.clearAll();
                if (previous != null && !previous.isEmpty()) {
                    ThreadContext.putAll(previous);
                }
            }
        };
    }

    /** Snapshot of the calling thread's MDC. */
    public static Map<String, String> snapshot() {
        return Map.copyOf(ThreadContext.getImmutableContext());
    }
}
