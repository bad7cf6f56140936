package com.phillippitts.callagent.service.orchestration;

import com.phillippitts.callagent.service.streaming.MediaStreamConnection;

import java.util.Objects;

/**
 * Creates one {@link CallOrchestrator} per call over shared {@link CallDependencies}.
 */
public class CallOrchestratorFactory {

    private final CallDependencies deps;

    public CallOrchestratorFactory(CallDependencies deps) {
        this.deps = Objects.requireNonNull(deps, "deps must not be null");
    }

    /**
     * @param callId provider call identifier
     * @param connection media connection of the call
     * @param onClosed invoked once on the call lane after the call has closed
     */
    public CallOrchestrator create(String callId, MediaStreamConnection connection, Runnable onClosed) {
        return new CallOrchestrator(callId, connection, deps, onClosed);
    }
}
