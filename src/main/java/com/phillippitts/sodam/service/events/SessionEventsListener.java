package com.phillippitts.sodam.service.events;

import com.phillippitts.sodam.service.postsession.event.PostSessionCompletedEvent;
import com.phillippitts.sodam.service.takeover.event.TakeoverChangedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized handler for session lifecycle and degradation events. Privacy-safe and
 * throttled to avoid log spam when a dependency (Redis, backend) is down for every session.
 */
@Component
class SessionEventsListener {
    private static final Logger LOG = LogManager.getLogger(SessionEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    @EventListener
    void onDegraded(SessionDegradedEvent e) {
        String key = "degraded-" + e.component() + '-' + e.reason();
        if (shouldLog(key)) {
            LOG.warn("Session degraded: component={}, reason={}, session={}. Session continues; "
                    + "repeats of this reason are suppressed for {}s.",
                    e.component(), e.reason(), e.sessionId(), THROTTLE.toSeconds());
        }
    }

    @EventListener
    void onTakeoverChanged(TakeoverChangedEvent e) {
        LOG.info("Takeover {} (session={}, source={})",
                e.active() ? "started" : "ended", e.sessionId(), e.source());
    }

    @EventListener
    void onPostSessionCompleted(PostSessionCompletedEvent e) {
        if (e.timedOut() || e.failed() > 0) {
            LOG.warn("Post-session work degraded: call={}, succeeded={}, failed={}, timedOut={}, elapsedMs={}",
                    e.callId(), e.succeeded(), e.failed(), e.timedOut(), e.elapsedMs());
        } else {
            LOG.info("Post-session work complete: call={}, succeeded={}, elapsedMs={}",
                    e.callId(), e.succeeded(), e.elapsedMs());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
