package com.smurthy.ai.assistant.tools;

/**
 * Raised by a tool that could not complete its action
 */
public class ToolExecutionException extends RuntimeException {

    public ToolExecutionException(String message) {
        super(message);
    }

    public ToolExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
