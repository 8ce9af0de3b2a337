package com.smurthy.ai.assistant.config;

import com.smurthy.ai.assistant.reasoning.RuntimeConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Initial dispatcher settings. They can be changed at runtime through the monitoring endpoint.
 */
@ConfigurationProperties(prefix = "assistant.reasoning")
public record ReasoningProperties(
        @DefaultValue("3") int maxRetries,
        @DefaultValue("1s") Duration retryBaseDelay,
        @DefaultValue("30s") Duration fallbackTimeout,
        @DefaultValue("10") int sufficiencyThreshold,
        @DefaultValue("5m") Duration cacheTtl,
        @DefaultValue("1") int minQueryLength,
        @DefaultValue("1000") int maxQueryLength,
        @DefaultValue("true") boolean fallbackEnabled,
        @DefaultValue("4") int workerThreads
) {

    public RuntimeConfig toRuntimeConfig() {
        return new RuntimeConfig(maxRetries, retryBaseDelay, fallbackTimeout, sufficiencyThreshold, cacheTtl,
                minQueryLength, maxQueryLength, fallbackEnabled);
    }
}
