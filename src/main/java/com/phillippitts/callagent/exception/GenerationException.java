package com.phillippitts.callagent.exception;

/**
 * Thrown when the response generator fails to produce a reply for an utterance.
 */
public class GenerationException extends CallAgentException {

    public GenerationException(String message) {
        super(message);
    }

    public GenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
