package com.phillippitts.callagent.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for call handling.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Calls started and ended, by end status</li>
 *   <li>Completed utterances and responses, by response type</li>
 *   <li>Response latency from utterance completion to first audio</li>
 *   <li>Barge-ins and recording outcomes</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available under /actuator/metrics.
 */
public class CallMetrics {

    private static final String METRIC_PREFIX = "callagent";

    private final MeterRegistry registry;

    public CallMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void callStarted(String clientId) {
        Counter.builder(METRIC_PREFIX + ".calls.started")
                .description("Number of calls whose media stream started")
                .tag("client", clientId)
                .register(registry)
                .increment();
    }

    public void callEnded(String clientId, String endStatus) {
        Counter.builder(METRIC_PREFIX + ".calls.ended")
                .description("Number of calls ended, by end status")
                .tag("client", clientId)
                .tag("status", endStatus)
                .register(registry)
                .increment();
    }

    public void utteranceCompleted() {
        Counter.builder(METRIC_PREFIX + ".utterances")
                .description("Number of completed caller utterances")
                .register(registry)
                .increment();
    }

    /**
     * @param responseType audio, tts or apology
     */
    public void responseSent(String responseType, long latencyNanos) {
        Counter.builder(METRIC_PREFIX + ".responses")
                .description("Number of responses streamed, by type")
                .tag("type", responseType)
                .register(registry)
                .increment();
        Timer.builder(METRIC_PREFIX + ".response.latency")
                .description("Time from utterance completion to response start")
                .tag("type", responseType)
                .register(registry)
                .record(latencyNanos, TimeUnit.NANOSECONDS);
    }

    public void bargeIn() {
        Counter.builder(METRIC_PREFIX + ".barge.ins")
                .description("Number of times the caller interrupted the assistant")
                .register(registry)
                .increment();
    }

    /**
     * @param outcome completed, empty or failed
     */
    public void recording(String outcome) {
        Counter.builder(METRIC_PREFIX + ".recordings")
                .description("Number of finalized recordings, by outcome")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    /**
     * @param stage generation, synthesis, snippet or transport
     */
    public void failure(String stage) {
        Counter.builder(METRIC_PREFIX + ".failures")
                .description("Number of recovered failures, by stage")
                .tag("stage", stage)
                .register(registry)
                .increment();
    }
}
