package com.smurthy.ai.assistant.activity;

/**
 * Receives progress notifications from the orchestrator and dispatcher.
 * <p>
 * Fire-and-forget. Implementations may fail; callers wrap them in {@link SafeActivitySink} so a failing
 * sink never changes the outcome of a request.
 */
public interface ActivitySink {

    void log(String message);

    void setState(AssistantState state, String message);
}
