package com.phillippitts.callagent.config;

import com.phillippitts.callagent.service.recording.DualStreamRecorder;
import com.phillippitts.callagent.service.session.SessionManager;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Exposes pool and call-registry gauges via Micrometer.
 *
 * <p>For each of the {@code call} and {@code response} pools:
 * <ul>
 *   <li>callagent.pool.size - current number of threads</li>
 *   <li>callagent.pool.active - threads executing tasks</li>
 *   <li>callagent.pool.queued - tasks waiting in the queue</li>
 *   <li>callagent.pool.completed - cumulative completed tasks</li>
 * </ul>
 * tagged {@code pool=call|response}, plus {@code callagent.calls.active} and
 * {@code callagent.recordings.active}.
 *
 * <p>Also logs a health summary every 5 minutes.
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final ObjectProvider<ThreadPoolTaskExecutor> callExecutorProvider;
    private final ObjectProvider<ThreadPoolTaskExecutor> responseExecutorProvider;
    private final ObjectProvider<SessionManager> sessionManagerProvider;
    private final ObjectProvider<DualStreamRecorder> recorderProvider;

    public ThreadPoolMetricsConfig(
            @Qualifier("callExecutor") ObjectProvider<ThreadPoolTaskExecutor> callExecutorProvider,
            @Qualifier("responseExecutor") ObjectProvider<ThreadPoolTaskExecutor> responseExecutorProvider,
            ObjectProvider<SessionManager> sessionManagerProvider,
            ObjectProvider<DualStreamRecorder> recorderProvider) {
        this.callExecutorProvider = callExecutorProvider;
        this.responseExecutorProvider = responseExecutorProvider;
        this.sessionManagerProvider = sessionManagerProvider;
        this.recorderProvider = recorderProvider;
    }

    @Bean
    public MeterBinder callEngineMetrics() {
        return registry -> {
            bindPool(registry, "call", callExecutorProvider.getObject().getThreadPoolExecutor());
            bindPool(registry, "response", responseExecutorProvider.getObject().getThreadPoolExecutor());

            SessionManager sessions = sessionManagerProvider.getObject();
            Gauge.builder("callagent.calls.active", sessions, SessionManager::activeCount)
                    .description("Number of calls with a live session")
                    .register(registry);

            DualStreamRecorder recorder = recorderProvider.getObject();
            Gauge.builder("callagent.recordings.active", recorder, DualStreamRecorder::activeCount)
                    .description("Number of calls currently being recorded")
                    .register(registry);

            LOG.info("Call engine metrics registered: callagent.pool.*, callagent.calls.active");
        };
    }

    /**
     * Logs pool and call health every 5 minutes.
     */
    @Scheduled(fixedRate = 300_000)
    public void logThreadPoolHealth() {
        ThreadPoolExecutor call = callExecutorProvider.getObject().getThreadPoolExecutor();
        ThreadPoolExecutor response = responseExecutorProvider.getObject().getThreadPoolExecutor();
        LOG.info("Call engine health: calls={}, callPool={}/{} active={} queued={}, "
                        + "responsePool={}/{} active={} queued={}",
                sessionManagerProvider.getObject().activeCount(),
                call.getPoolSize(), call.getMaximumPoolSize(), call.getActiveCount(), call.getQueue().size(),
                response.getPoolSize(), response.getMaximumPoolSize(), response.getActiveCount(),
                response.getQueue().size());
    }

    private static void bindPool(MeterRegistry registry, String pool, ThreadPoolExecutor executor) {
        Gauge.builder("callagent.pool.size", executor, ThreadPoolExecutor::getPoolSize)
                .description("Current number of threads in the pool")
                .tag("pool", pool)
                .register(registry);
        Gauge.builder("callagent.pool.active", executor, ThreadPoolExecutor::getActiveCount)
                .description("Number of threads actively executing tasks")
                .tag("pool", pool)
                .register(registry);
        Gauge.builder("callagent.pool.queued", executor, e -> e.getQueue().size())
                .description("Number of tasks waiting in the queue")
                .tag("pool", pool)
                .register(registry);
        Gauge.builder("callagent.pool.completed", executor, ThreadPoolExecutor::getCompletedTaskCount)
                .description("Cumulative count of completed tasks")
                .tag("pool", pool)
                .register(registry);
    }
}
