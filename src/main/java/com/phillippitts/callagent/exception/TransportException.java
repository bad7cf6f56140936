package com.phillippitts.callagent.exception;

/**
 * Thrown when the media-stream connection to the telephony provider is lost or refuses a frame.
 * This is the only failure (besides an inactivity timeout) that ends a call.
 */
public class TransportException extends CallAgentException {

    private final String callId;

    public TransportException(String message, String callId) {
        super(message + " (call: " + callId + ")");
        this.callId = callId;
    }

    public TransportException(String message, String callId, Throwable cause) {
        super(message + " (call: " + callId + ")", cause);
        this.callId = callId;
    }

    public String getCallId() {
        return callId;
    }
}
