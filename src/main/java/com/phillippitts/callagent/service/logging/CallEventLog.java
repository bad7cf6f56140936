package com.phillippitts.callagent.service.logging;

import com.phillippitts.callagent.domain.CallSession;
import com.phillippitts.callagent.domain.CallSummary;
import com.phillippitts.callagent.domain.ConversationTurn;

import java.nio.file.Path;
import java.time.Instant;

/**
 * Append-only record of call activity: call, conversation, usage and recording rows.
 *
 * <p>Implementations must be thread-safe and must not throw; a logging failure never affects a call.
 */
public interface CallEventLog {

    void callStarted(CallSession session);

    void turn(String callId, ConversationTurn turn);

    /**
     * Writes the call row and the usage (billing) row for a finished call.
     */
    void callEnded(CallSummary summary);

    void recordingCompleted(String callId, Path file, Instant startedAt, Instant endedAt);
}
