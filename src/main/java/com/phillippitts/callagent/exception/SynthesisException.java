package com.phillippitts.callagent.exception;

/**
 * Thrown when text-to-speech synthesis fails or returns unusable audio.
 */
public class SynthesisException extends CallAgentException {

    private final String voiceId;

    public SynthesisException(String message) {
        super(message);
        this.voiceId = "unknown";
    }

    public SynthesisException(String message, String voiceId) {
        super(message + " (voice: " + voiceId + ")");
        this.voiceId = voiceId;
    }

    public SynthesisException(String message, String voiceId, Throwable cause) {
        super(message + " (voice: " + voiceId + ")", cause);
        this.voiceId = voiceId;
    }

    public String getVoiceId() {
        return voiceId;
    }
}
