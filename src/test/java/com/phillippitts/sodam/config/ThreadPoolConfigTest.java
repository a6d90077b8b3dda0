package com.phillippitts.sodam.config;

import com.phillippitts.sodam.config.logging.SessionMdc;
import com.phillippitts.sodam.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class ThreadPoolConfigTest {

    private final ThreadPoolConfig config = new ThreadPoolConfig(new ThreadPoolProperties());

    @AfterEach
    void clearContext() {
        ThreadContext.clearMap();
    }

    @Test
    void shouldCreateExecutorsWithDefaultSizing() {
        ThreadPoolTaskExecutor notification = (ThreadPoolTaskExecutor) config.notificationExecutor();
        ThreadPoolTaskExecutor session = (ThreadPoolTaskExecutor) config.sessionExecutor();

        assertThat(notification.getCorePoolSize()).isEqualTo(4);
        assertThat(notification.getMaxPoolSize()).isEqualTo(8);
        assertThat(notification.getThreadNamePrefix()).isEqualTo("notify-");
        assertThat(session.getMaxPoolSize()).isEqualTo(16);
        assertThat(session.getThreadNamePrefix()).isEqualTo("session-");

        notification.shutdown();
        session.shutdown();
    }

    @Test
    void notificationExecutorRejectsInsteadOfRunningOnCaller() {
        ThreadPoolTaskExecutor notification = (ThreadPoolTaskExecutor) config.notificationExecutor();
        ThreadPoolTaskExecutor transcript = (ThreadPoolTaskExecutor) config.transcriptExecutor();

        assertThat(notification.getThreadPoolExecutor().getRejectedExecutionHandler())
                .isInstanceOf(ThreadPoolExecutor.AbortPolicy.class);
        assertThat(transcript.getThreadPoolExecutor().getRejectedExecutionHandler())
                .isInstanceOf(ThreadPoolExecutor.CallerRunsPolicy.class);

        notification.shutdown();
        transcript.shutdown();
    }

    @Test
    void shouldHandleConcurrentTasks() throws InterruptedException {
        Executor executor = config.transcriptExecutor();

        int taskCount = 10;
        CountDownLatch latch = new CountDownLatch(taskCount);
        AtomicInteger completedTasks = new AtomicInteger(0);

        for (int i = 0; i < taskCount; i++) {
            executor.execute(() -> {
                try {
                    Thread.sleep(10);
                    completedTasks.incrementAndGet();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    latch.countDown();
                }
            });
        }

        assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(completedTasks.get()).isEqualTo(taskCount);
        ((ThreadPoolTaskExecutor) executor).shutdown();
    }

    @Test
    void shouldPropagateSessionContextToWorkerThreads() throws InterruptedException {
        ThreadPoolTaskExecutor executor = (ThreadPoolTaskExecutor) config.notificationExecutor();
        SessionMdc.begin("s-123", "call_42_20240101");

        CountDownLatch latch = new CountDownLatch(1);
        AtomicReference<String> seen = new AtomicReference<>();
        AtomicReference<String> thread = new AtomicReference<>();
        executor.execute(() -> {
            seen.set(ThreadContext.get(SessionMdc.SESSION_ID));
            thread.set(Thread.currentThread().getName());
            latch.countDown();
        });

        assertThat(latch.await(1, TimeUnit.SECONDS)).isTrue();
        assertThat(seen.get()).isEqualTo("s-123");
        assertThat(thread.get()).startsWith("notify-");
        executor.shutdown();
    }

    @Test
    void shouldCreateInitializedScheduler() {
        ThreadPoolTaskScheduler scheduler = config.takeoverScheduler();

        assertThat(scheduler.getScheduledThreadPoolExecutor().getCorePoolSize()).isEqualTo(2);
        assertThat(scheduler.getThreadNamePrefix()).isEqualTo("takeover-poll-");

        scheduler.shutdown();
        assertThat(scheduler.getScheduledThreadPoolExecutor().isShutdown()).isTrue();
    }
}
