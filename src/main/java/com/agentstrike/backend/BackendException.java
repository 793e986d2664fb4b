package com.agentstrike.backend;

/**
 * Typed exception for backend errors, categorized by error type
 * so callers can take appropriate action (e.g., retry on UNAVAILABLE).
 * May carry whatever output the backend produced before failing.
 */
public class BackendException extends Exception {

    public enum ErrorType {
        UNAVAILABLE,
        TIMEOUT,
        PROTOCOL_ERROR,
        AUTH_ERROR
    }

    private final ErrorType errorType;
    private final String partialOutput;

    public BackendException(ErrorType errorType, String message) {
        this(errorType, message, "", null);
    }

    public BackendException(ErrorType errorType, String message, Throwable cause) {
        this(errorType, message, "", cause);
    }

    public BackendException(ErrorType errorType, String message, String partialOutput) {
        this(errorType, message, partialOutput, null);
    }

    public BackendException(ErrorType errorType, String message, String partialOutput, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
        this.partialOutput = partialOutput != null ? partialOutput : "";
    }

    public ErrorType getErrorType() { return errorType; }
    public String getPartialOutput() { return partialOutput; }
}
