package com.phillippitts.callagent.config;

import com.phillippitts.callagent.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pools for the call engine.
 *
 * <ul>
 *   <li>{@code callExecutor}: backs the per-call serial lanes</li>
 *   <li>{@code responseExecutor}: generation, synthesis and paced streaming</li>
 *   <li>{@code recordingExecutor}: one thread, strict FIFO recording finalization</li>
 *   <li>{@code callScheduler}: per-call silence polls and disconnect grace timers</li>
 * </ul>
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties}. Every executor copies the Log4j2
 * ThreadContext (MDC) from the submitting thread so that {@code callId} follows the work.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Pool backing the per-call lanes. Lane tasks are short; a full queue makes the submitting
     * thread run the task ({@link ThreadPoolExecutor.CallerRunsPolicy}) rather than drop call events.
     */
    @Bean(name = "callExecutor")
    public ThreadPoolTaskExecutor callExecutor() {
        ThreadPoolProperties.PoolProperties props = threadPoolProperties.getCall();
        return pool(props, props.getCorePoolSize(), false);
    }

    /**
     * Pool for response work that may block on remote services or on pacing sleeps.
     *
     * <p>Threads are added up to the maximum before anything is queued, so one call's slow
     * generation never holds up another call's reply. Idle threads time out down to zero.
     */
    @Bean(name = "responseExecutor")
    public ThreadPoolTaskExecutor responseExecutor() {
        ThreadPoolProperties.PoolProperties props = threadPoolProperties.getResponse();
        return pool(props, Math.max(props.getCorePoolSize(), props.getMaxPoolSize()), true);
    }

    @Bean(name = "recordingExecutor")
    public ThreadPoolTaskExecutor recordingExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setThreadNamePrefix(threadPoolProperties.getRecordingThreadName());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.setTaskDecorator(mdcPropagatingDecorator());
        executor.initialize();
        return executor;
    }

    @Bean(name = "callScheduler")
    public ThreadPoolTaskScheduler callScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(threadPoolProperties.getSchedulerPoolSize());
        scheduler.setThreadNamePrefix("call-poll-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.initialize();
        return scheduler;
    }

    /**
     * Copies the submitting thread's ThreadContext into the worker for the duration of a task and
     * restores the worker's own context afterwards.
     */
    public static TaskDecorator mdcPropagatingDecorator() {
        return runnable -> {
            Map<String, String> contextMap = ThreadContext.getImmutableContext();
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
        };
    }

    private static ThreadPoolTaskExecutor pool(ThreadPoolProperties.PoolProperties props, int corePoolSize,
                                               boolean coreThreadTimeOut) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(Math.max(corePoolSize, props.getMaxPoolSize()));
        executor.setAllowCoreThreadTimeOut(coreThreadTimeOut);
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(mdcPropagatingDecorator());
        executor.initialize();
        return executor;
    }
}
