package com.phillippitts.callagent.exception;

/**
 * Thrown when the streaming speech recognizer cannot be opened or rejects audio.
 */
public class RecognitionException extends CallAgentException {

    public RecognitionException(String message) {
        super(message);
    }

    public RecognitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
