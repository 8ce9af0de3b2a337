package com.smurthy.ai.assistant.fallback;

import java.time.Duration;

/**
 * General-purpose reasoning agent used when no tool answers a request well enough.
 */
public interface FallbackAgent {

    /**
     * @throws FallbackTimeoutException if the call does not finish within {@code timeout}
     */
    String invoke(String query, Duration timeout);
}
