package com.phillippitts.callagent.service.orchestration;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Thread-safe guard for {@link CallState} transitions.
 *
 * <p><b>State Transitions:</b>
 * <pre>
 * IDLE → STREAMING (start frame)
 * STREAMING → DISPATCHING (completed utterance)
 * STREAMING → RESPONDING_AUDIO (greeting)
 * DISPATCHING → RESPONDING_AUDIO | RESPONDING_SPEECH (response ready)
 * DISPATCHING → STREAMING (nothing could be played)
 * DISPATCHING → DISCONNECTING (hang up without a final response)
 * RESPONDING_* → STREAMING | DISCONNECTING
 * any → CLOSED (via close)
 * </pre>
 *
 * <p><b>Thread Safety:</b> All public methods are thread-safe and use a
 * {@link ReentrantLock} to protect the current state.
 */
public final class CallStateMachine {

    private static final Map<CallState, Set<CallState>> ALLOWED = new EnumMap<>(CallState.class);

    static {
        ALLOWED.put(CallState.IDLE, EnumSet.of(CallState.STREAMING));
        ALLOWED.put(CallState.STREAMING, EnumSet.of(CallState.DISPATCHING, CallState.RESPONDING_AUDIO));
        ALLOWED.put(CallState.DISPATCHING,
                EnumSet.of(CallState.RESPONDING_AUDIO, CallState.RESPONDING_SPEECH,
                        CallState.STREAMING, CallState.DISCONNECTING));
        ALLOWED.put(CallState.RESPONDING_AUDIO, EnumSet.of(CallState.STREAMING, CallState.DISCONNECTING));
        ALLOWED.put(CallState.RESPONDING_SPEECH, EnumSet.of(CallState.STREAMING, CallState.DISCONNECTING));
        ALLOWED.put(CallState.DISCONNECTING, EnumSet.noneOf(CallState.class));
        ALLOWED.put(CallState.CLOSED, EnumSet.noneOf(CallState.class));
    }

    private final Lock lock = new ReentrantLock();
    private CallState state = CallState.IDLE;

    /**
     * Moves from {@code expected} to {@code target}.
     *
     * @return {@code true} if the machine was in {@code expected} and the move is allowed,
     *         {@code false} otherwise (state unchanged)
     */
    public boolean transition(CallState expected, CallState target) {
        lock.lock();
        try {
            if (state != expected || !ALLOWED.get(expected).contains(target)) {
                return false;
            }
            state = target;
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Moves to CLOSED from any state.
     *
     * @return {@code true} only for the call that actually closed the machine
     */
    public boolean close() {
        lock.lock();
        try {
            if (state == CallState.CLOSED) {
                return false;
            }
            state = CallState.CLOSED;
            return true;
        } finally {
            lock.unlock();
        }
    }

    public CallState current() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        return current() == CallState.CLOSED;
    }

    static boolean isAllowed(CallState from, CallState to) {
        return ALLOWED.get(from).contains(to);
    }
}
