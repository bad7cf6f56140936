package com.phillippitts.callagent.service.orchestration;

/**
 * Lifecycle of one call as seen by {@link CallOrchestrator}.
 */
public enum CallState {
    /** Connection accepted, no {@code start} frame yet. */
    IDLE,
    /** Listening to the caller. */
    STREAMING,
    /** A completed utterance is being answered. */
    DISPATCHING,
    /** Streaming a cached snippet. */
    RESPONDING_AUDIO,
    /** Streaming synthesized speech. */
    RESPONDING_SPEECH,
    /** Final response played; waiting to hang up. */
    DISCONNECTING,
    /** Terminal. */
    CLOSED
}
