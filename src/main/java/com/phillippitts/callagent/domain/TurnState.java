package com.phillippitts.callagent.domain;

/**
 * Turn-taking state of a call.
 *
 * <pre>
 * LISTENING      → ACCUMULATING  (final speech fragment)
 * ACCUMULATING   → SILENCE_WAIT  (poll below silence threshold)
 * SILENCE_WAIT   → DISPATCHED    (silence ≥ threshold and enough words)
 * DISPATCHED     → SPEAKING      (response starts streaming)
 * SPEAKING       → LISTENING     (response finished or barge-in)
 * </pre>
 */
public enum TurnState {
    LISTENING,
    ACCUMULATING,
    SILENCE_WAIT,
    DISPATCHED,
    SPEAKING
}
