package com.phillippitts.sodam.service.events;

import com.phillippitts.sodam.service.postsession.event.PostSessionCompletedEvent;
import com.phillippitts.sodam.service.takeover.SignalSource;
import com.phillippitts.sodam.service.takeover.event.TakeoverChangedEvent;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class SessionEventsListenerTest {

    @Test
    void throttlesRepeatLogs() {
        SessionEventsListener l = new SessionEventsListener();
        assertThat(l.shouldLog("degraded-TRANSCRIPT_STORE-JedisConnectionException")).isTrue();
        assertThat(l.shouldLog("degraded-TRANSCRIPT_STORE-JedisConnectionException")).isFalse();
        assertThat(l.shouldLog("degraded-NOTIFICATION-call-ended")).isTrue();
    }

    @Test
    void handlersDoNotThrow() {
        SessionEventsListener l = new SessionEventsListener();
        assertThatCode(() -> {
            l.onDegraded(new SessionDegradedEvent("s-1", SessionDegradedEvent.Component.NOTIFICATION,
                    "rag-indexing", Instant.now()));
            l.onTakeoverChanged(new TakeoverChangedEvent("s-1", true, SignalSource.POLL, Instant.now()));
            l.onPostSessionCompleted(new PostSessionCompletedEvent("s-1", "c-1", 2, 1, true, 10_000L, Instant.now()));
            l.onPostSessionCompleted(new PostSessionCompletedEvent("s-1", "c-1", 3, 0, false, 120L, Instant.now()));
        }).doesNotThrowAnyException();
    }
}
