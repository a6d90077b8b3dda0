package com.phillippitts.sodam.service.session;

import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Live sessions hosted by this worker. Read by the health indicator; written only by the
 * session threads.
 */
@Component
public class ActiveSessionRegistry {

    private final Map<String, SessionHandle> sessions = new ConcurrentHashMap<>();

    void register(SessionHandle handle) {
        SessionHandle previous = sessions.putIfAbsent(handle.sessionId(), handle);
        if (previous != null) {
            throw new IllegalStateException("Session already registered: " + handle.sessionId());
        }
    }

    void unregister(String sessionId) {
        sessions.remove(sessionId);
    }

    public Optional<SessionHandle> find(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    public Collection<SessionHandle> sessions() {
        return List.copyOf(sessions.values());
    }

    public int activeCount() {
        return sessions.size();
    }

    public long takeoverCount() {
        return sessions.values().stream().filter(SessionHandle::isTakeoverActive).count();
    }
}
