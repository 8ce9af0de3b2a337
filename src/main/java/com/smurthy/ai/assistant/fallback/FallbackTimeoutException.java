package com.smurthy.ai.assistant.fallback;

/**
 * The fallback call did not finish in time and was cancelled.
 */
public class FallbackTimeoutException extends RuntimeException {

    public FallbackTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
