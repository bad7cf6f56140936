package com.phillippitts.callagent.domain;

import java.util.Map;
import java.util.Objects;

/**
 * Summary written when a call ends; the source of the call and usage log rows.
 *
 * @param callId provider call identifier
 * @param clientId client the call was answered for
 * @param callerNumber caller (From) number
 * @param calledNumber called (To) number
 * @param direction inbound or outbound
 * @param durationSeconds whole seconds from session creation to end
 * @param uniqueSnippetsUsed distinct library snippets played
 * @param synthesizedResponses synthesized responses spoken
 * @param bargeIns number of caller interruptions
 * @param flags final feature flags
 * @param variables final session variables
 * @param endStatus why the call ended ({@code completed}, {@code timeout}, {@code disconnected},
 *                  {@code transport_error})
 */
public record CallSummary(String callId,
                          String clientId,
                          String callerNumber,
                          String calledNumber,
                          CallDirection direction,
                          long durationSeconds,
                          int uniqueSnippetsUsed,
                          int synthesizedResponses,
                          int bargeIns,
                          Map<String, Boolean> flags,
                          Map<String, String> variables,
                          String endStatus) {

    public CallSummary {
        Objects.requireNonNull(callId, "callId must not be null");
        flags = flags == null ? Map.of() : Map.copyOf(flags);
        variables = variables == null ? Map.of() : Map.copyOf(variables);
        durationSeconds = Math.max(0, durationSeconds);
    }

    /**
     * Minutes billed for the call: zero for a zero-length call, otherwise at least one,
     * rounded up to the next whole minute.
     */
    public long billedMinutes() {
        if (durationSeconds <= 0) {
            return 0;
        }
        return Math.max(1, (durationSeconds + 59) / 60);
    }
}
