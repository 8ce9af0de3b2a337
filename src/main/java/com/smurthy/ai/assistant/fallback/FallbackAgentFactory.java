package com.smurthy.ai.assistant.fallback;

/**
 * Builds a new fallback agent. Construction is expensive, so callers cache the result.
 */
@FunctionalInterface
public interface FallbackAgentFactory {

    FallbackAgent create();
}
