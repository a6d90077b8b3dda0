package com.phillippitts.sodam.config;

import com.phillippitts.sodam.config.logging.SessionMdc;
import com.phillippitts.sodam.config.properties.ThreadPoolProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for thread pools shared by every session hosted in this worker.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} and can be tuned
 * in application.properties based on how many concurrent sessions one worker hosts.
 *
 * <p>Rejection policy: session and transcript executors use
 * {@link ThreadPoolExecutor.CallerRunsPolicy}, so a saturated pool slows the submitter instead
 * of dropping a session or a transcript write. The notification executor uses
 * {@link ThreadPoolExecutor.AbortPolicy}; its submitter must never block, and the post-session
 * coordinator counts a rejected notification as failed.
 *
 * <p>MDC propagation: every executor copies the Log4j2 ThreadContext from the submitting
 * thread via {@link SessionMdc#propagating(Runnable)}, so session and call ids appear in
 * async logs.
 */
@Configuration
@EnableAsync
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Runs one orchestrating thread per live session.
     *
     * <p>The queue defaults to zero so a saturated worker runs the session on the caller
     * rather than parking it behind sessions that may last for many minutes.
     *
     * @return executor for session orchestration
     */
    @Bean(name = "sessionExecutor")
    public Executor sessionExecutor() {
        return buildExecutor(threadPoolProperties.getSession(), new ThreadPoolExecutor.CallerRunsPolicy());
    }

    /**
     * Runs post-session notification calls concurrently.
     *
     * @return executor for notification fan-out
     */
    @Bean(name = "notificationExecutor")
    public Executor notificationExecutor() {
        return buildExecutor(threadPoolProperties.getNotification(), new ThreadPoolExecutor.AbortPolicy());
    }

    /**
     * Mirrors transcript entries to the side store off the speech-event thread.
     *
     * @return executor for transcript persistence
     */
    @Bean(name = "transcriptExecutor")
    public Executor transcriptExecutor() {
        return buildExecutor(threadPoolProperties.getTranscript(), new ThreadPoolExecutor.CallerRunsPolicy());
    }

    /**
     * Scheduler shared by the takeover poll loops of all sessions.
     *
     * @return scheduler for periodic participant polling
     */
    @Bean(name = "takeoverScheduler")
    public ThreadPoolTaskScheduler takeoverScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(threadPoolProperties.getSchedulerPoolSize());
        scheduler.setThreadNamePrefix("takeover-poll-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.initialize();
        return scheduler;
    }

    private Executor buildExecutor(ThreadPoolProperties.PoolProperties props, RejectedExecutionHandler rejectionPolicy) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(Math.max(props.getCorePoolSize(), props.getMaxPoolSize()));
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(rejectionPolicy);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(SessionMdc::propagating);
        executor.initialize();
        return executor;
    }
}
