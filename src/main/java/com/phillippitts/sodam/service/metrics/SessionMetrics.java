package com.phillippitts.sodam.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for the session core.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Takeover transitions by direction and detecting channel</li>
 *   <li>Signal-handler errors and discarded user speech during takeover</li>
 *   <li>Transcript entries, store failures and broadcast failures</li>
 *   <li>Post-session task outcomes, timeouts and duration</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/metrics.
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class SessionMetrics {

    private static final String METRIC_PREFIX = "sodam";

    private final MeterRegistry registry;

    public SessionMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records one takeover transition.
     *
     * @param active new takeover state
     * @param source channel that detected the change (metadata, track_event, poll, ...)
     */
    public void recordTakeoverTransition(boolean active, String source) {
        Counter.builder(METRIC_PREFIX + ".takeover.transitions")
                .description("Takeover state transitions")
                .tag("direction", active ? "pause" : "resume")
                .tag("source", source)
                .register(registry)
                .increment();
    }

    /**
     * Counts an exception caught inside a takeover signal handler or poll iteration.
     */
    public void incrementSignalError(String source) {
        Counter.builder(METRIC_PREFIX + ".takeover.signal.errors")
                .description("Errors caught while processing takeover signals")
                .tag("source", source)
                .register(registry)
                .increment();
    }

    public void incrementDiscardedUserSpeech() {
        Counter.builder(METRIC_PREFIX + ".transcript.discarded")
                .description("User utterances discarded while a supervisor had taken over")
                .register(registry)
                .increment();
    }

    public void incrementTranscriptEntry(String speaker) {
        Counter.builder(METRIC_PREFIX + ".transcript.entries")
                .description("Transcript entries recorded")
                .tag("speaker", speaker)
                .register(registry)
                .increment();
    }

    public void incrementStoreFailure() {
        Counter.builder(METRIC_PREFIX + ".transcript.store.failures")
                .description("Transcript side-store writes that failed")
                .register(registry)
                .increment();
    }

    public void incrementBroadcastFailure() {
        Counter.builder(METRIC_PREFIX + ".transcript.broadcast.failures")
                .description("Transcript room broadcasts that failed")
                .register(registry)
                .increment();
    }

    /**
     * Records the outcome of one post-session task.
     *
     * @param task task name
     * @param outcome success, failure or timeout
     */
    public void recordPostSessionTask(String task, String outcome) {
        Counter.builder(METRIC_PREFIX + ".postsession.tasks")
                .description("Post-session notification outcomes")
                .tag("task", task)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    /**
     * Records how long the post-session task set took, including timeouts.
     */
    public void recordPostSessionDuration(long durationNanos, boolean timedOut) {
        Timer.builder(METRIC_PREFIX + ".postsession.duration")
                .description("Time from session end to post-session completion signal")
                .tag("timedOut", Boolean.toString(timedOut))
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }
}
