package com.smurthy.ai.assistant.reasoning;

/**
 * A classified failure inside the dispatch pipeline.
 */
public class DispatchException extends RuntimeException {

    private final ErrorCode errorCode;

    public DispatchException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public DispatchException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
