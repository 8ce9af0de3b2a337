package com.smurthy.ai.assistant.reasoning;

import java.time.Duration;

/**
 * Immutable snapshot of the runtime-tunable dispatcher parameters.
 */
public record RuntimeConfig(
        int maxRetries,             // Additional attempts after the first
        Duration retryBaseDelay,    // Delay before retry n is baseDelay * 2^n
        Duration fallbackTimeout,
        int sufficiencyThreshold,   // Orchestrator responses must be longer than this
        Duration cacheTtl,
        int minQueryLength,
        int maxQueryLength,
        boolean fallbackEnabled
) {

    public RuntimeConfig {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative");
        }
        requireNonNegative("retryBaseDelay", retryBaseDelay);
        requireNonNegative("cacheTtl", cacheTtl);
        if (fallbackTimeout == null || fallbackTimeout.isZero() || fallbackTimeout.isNegative()) {
            throw new IllegalArgumentException("fallbackTimeout must be positive");
        }
        if (sufficiencyThreshold < 0) {
            throw new IllegalArgumentException("sufficiencyThreshold must not be negative");
        }
        if (minQueryLength < 0) {
            throw new IllegalArgumentException("minQueryLength must not be negative");
        }
        if (maxQueryLength < minQueryLength) {
            throw new IllegalArgumentException("maxQueryLength (" + maxQueryLength
                    + ") must not be below minQueryLength (" + minQueryLength + ")");
        }
    }

    public static RuntimeConfig defaults() {
        return new RuntimeConfig(3, Duration.ofSeconds(1), Duration.ofSeconds(30), 10,
                Duration.ofMinutes(5), 1, 1000, true);
    }

    private static void requireNonNegative(String name, Duration value) {
        if (value == null || value.isNegative()) {
            throw new IllegalArgumentException(name + " must not be negative");
        }
    }
}
