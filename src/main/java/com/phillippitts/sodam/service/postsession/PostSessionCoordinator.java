package com.phillippitts.sodam.service.postsession;

import com.phillippitts.sodam.config.logging.SessionMdc;
import com.phillippitts.sodam.domain.SessionIdentity;
import com.phillippitts.sodam.service.events.SessionDegradedEvent;
import com.phillippitts.sodam.service.metrics.SessionMetrics;
import com.phillippitts.sodam.service.postsession.event.PostSessionCompletedEvent;
import com.phillippitts.sodam.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs the post-session notification tasks of one session, once.
 *
 * <p><b>Parallel Execution:</b> every {@link PostSessionTask} is started on the notification
 * executor at the same time; each task catches and logs its own failure, so one failing task
 * never prevents the others from running.
 *
 * <p><b>Timeout Protection:</b> the whole set is bounded by one overall timeout. When it
 * expires, unfinished tasks are cancelled best-effort, a warning is logged and the session still
 * completes normally. Nothing is retried.
 *
 * <p><b>Completion Signal:</b> {@link #completion()} completes exactly once, after every task
 * finished or the timeout fired. The session thread blocks on it before tearing down.
 *
 * <p>{@link #runPostSessionTasks(String, SessionIdentity)} does not block; the caller may be a
 * transport or runtime callback thread. The executor is expected to reject work when saturated
 * rather than run it on the caller; a rejected task counts as failed.
 */
public final class PostSessionCoordinator {

    private static final Logger LOG = LogManager.getLogger(PostSessionCoordinator.class);

    private final List<PostSessionTask> tasks;
    private final Executor executor;
    private final Duration timeout;
    private final ApplicationEventPublisher publisher;
    private final SessionMetrics metrics;
    private final Map<String, String> sessionContext;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final CompletableFuture<Void> completion = new CompletableFuture<>();

    /**
     * Creates a coordinator and captures the calling thread's MDC for task logging.
     *
     * @param tasks tasks to run, in start order
     * @param executor executor the tasks run on
     * @param timeout overall deadline for the task set; must be positive
     */
    public PostSessionCoordinator(List<PostSessionTask> tasks,
                                  Executor executor,
                                  Duration timeout,
                                  ApplicationEventPublisher publisher,
                                  SessionMetrics metrics) {
        this.tasks = List.copyOf(Objects.requireNonNull(tasks, "tasks must not be null"));
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.sessionContext = SessionMdc.snapshot();
    }

    /**
     * Starts every task. Only the first call has an effect; later calls return the same
     * completion future.
     *
     * @return the completion signal
     */
    public CompletableFuture<Void> runPostSessionTasks(String sessionId, SessionIdentity identity) {
        Objects.requireNonNull(identity, "identity must not be null");
        if (!started.compareAndSet(false, true)) {
            LOG.debug("Post-session tasks already started for session {}", sessionId);
            return completion;
        }
        long t0 = System.nanoTime();
        LOG.info("Running {} post-session task(s) for call {} (timeout={}ms)",
                tasks.size(), identity.callId(), timeout.toMillis());

        List<CompletableFuture<Boolean>> futures = new ArrayList<>(tasks.size());
        for (int i = 0; i < tasks.size(); i++) {
            futures.add(new CompletableFuture<>());
        }
        // deadline is armed before any task is handed to the executor
        CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new))
                .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .whenComplete((v, t) -> SessionMdc.withContext(sessionContext,
                        () -> finish(sessionId, identity, futures, t, t0)).run());
        for (int i = 0; i < tasks.size(); i++) {
            submit(tasks.get(i), futures.get(i), sessionId, identity);
        }
        return completion;
    }

    private void finish(String sessionId,
                        SessionIdentity identity,
                        List<CompletableFuture<Boolean>> futures,
                        Throwable failure,
                        long t0) {
        try {
            boolean timedOut = failure instanceof TimeoutException;
            if (timedOut) {
                LOG.warn("Post-session tasks timed out after {} ms; cancelling unfinished tasks",
                        timeout.toMillis());
            }
            int succeeded = 0;
            int failed = 0;
            for (int i = 0; i < futures.size(); i++) {
                CompletableFuture<Boolean> f = futures.get(i);
                Boolean ok = getResultSilently(f);
                if (ok == null) {
                    f.cancel(true);
                    metrics.recordPostSessionTask(tasks.get(i).name(), "timeout");
                } else if (ok) {
                    succeeded++;
                } else {
                    failed++;
                }
            }
            long elapsedNanos = System.nanoTime() - t0;
            metrics.recordPostSessionDuration(elapsedNanos, timedOut);
            publisher.publishEvent(new PostSessionCompletedEvent(sessionId, identity.callId(), succeeded, failed,
                    timedOut, elapsedNanos / TimeUtils.NANOS_PER_MILLI, Instant.now()));
        } catch (RuntimeException e) {
            LOG.error("Error while finishing post-session work", e);
        } finally {
            completion.complete(null);
        }
    }

    private boolean runTask(PostSessionTask task, String sessionId, SessionIdentity identity) {
        long t0 = System.nanoTime();
        try {
            task.execute(sessionId, identity);
            metrics.recordPostSessionTask(task.name(), "success");
            LOG.debug("Post-session task {} finished in {} ms", task.name(), TimeUtils.elapsedMillis(t0));
            return true;
        } catch (RuntimeException e) {
            LOG.warn("Post-session task {} failed: {}", task.name(), e.getMessage());
            metrics.recordPostSessionTask(task.name(), "failure");
            publisher.publishEvent(new SessionDegradedEvent(sessionId, SessionDegradedEvent.Component.NOTIFICATION,
                    task.name(), Instant.now()));
            return false;
        }
    }

    private void submit(PostSessionTask task,
                        CompletableFuture<Boolean> result,
                        String sessionId,
                        SessionIdentity identity) {
        try {
            executor.execute(SessionMdc.withContext(sessionContext,
                    () -> result.complete(runTask(task, sessionId, identity))));
        } catch (RejectedExecutionException e) {
            LOG.warn("Post-session task {} rejected by saturated executor; not retried", task.name());
            metrics.recordPostSessionTask(task.name(), "rejected");
            publisher.publishEvent(new SessionDegradedEvent(sessionId, SessionDegradedEvent.Component.NOTIFICATION,
                    task.name(), Instant.now()));
            result.complete(false);
        }
    }

    private static Boolean getResultSilently(CompletableFuture<Boolean> f) {
        try {
            return f.isDone() && !f.isCompletedExceptionally() && !f.isCancelled() ? f.get() : null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return null;
        } catch (ExecutionException e) {
            return null;
        }
    }

    /** One-shot completion signal; completes normally even when tasks failed or timed out. */
    public CompletableFuture<Void> completion() {
        return completion;
    }

    public boolean hasStarted() {
        return started.get();
    }

    public boolean isComplete() {
        return completion.isDone();
    }

    /**
     * Blocks until the completion signal fires.
     *
     * @throws InterruptedException if the waiting thread is interrupted
     */
    public void awaitCompletion() throws InterruptedException {
        try {
            completion.get();
        } catch (ExecutionException e) {
            throw new IllegalStateException("Completion signal failed", e.getCause());
        }
    }

    /**
     * Blocks until the completion signal fires or {@code maxWait} elapses.
     *
     * @return true if the signal fired
     * @throws InterruptedException if the waiting thread is interrupted
     */
    public boolean awaitCompletion(Duration maxWait) throws InterruptedException {
        try {
            completion.get(maxWait.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (ExecutionException e) {
            throw new IllegalStateException("Completion signal failed", e.getCause());
        }
    }
}
