package com.phillippitts.callagent.exception;

/**
 * Thrown when a call recording cannot be merged or written.
 * Raised only inside the finalization worker; a failure drops that one recording.
 */
public class RecordingException extends CallAgentException {

    private final String callId;

    public RecordingException(String message, String callId) {
        super(message + " (call: " + callId + ")");
        this.callId = callId;
    }

    public RecordingException(String message, String callId, Throwable cause) {
        super(message + " (call: " + callId + ")", cause);
        this.callId = callId;
    }

    public String getCallId() {
        return callId;
    }
}
