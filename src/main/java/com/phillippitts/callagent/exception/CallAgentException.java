package com.phillippitts.callagent.exception;

/**
 * Base exception for all call-agent application errors.
 * Every domain exception extends this class so the orchestrator and HTTP layer can handle them uniformly.
 */
public class CallAgentException extends RuntimeException {

    public CallAgentException(String message) {
        super(message);
    }

    public CallAgentException(String message, Throwable cause) {
        super(message, cause);
    }

    public CallAgentException(Throwable cause) {
        super(cause);
    }
}
