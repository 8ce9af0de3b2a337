package com.smurthy.ai.assistant.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.smurthy.ai.assistant.activity.ActivityLog;
import com.smurthy.ai.assistant.intent.IntentClassifier;
import com.smurthy.ai.assistant.intent.LexicalIntentClassifier;
import com.smurthy.ai.assistant.fallback.FallbackAgentFactory;
import com.smurthy.ai.assistant.fallback.LangchainFallbackAgentFactory;
import com.smurthy.ai.assistant.observability.PerformanceMetrics;
import com.smurthy.ai.assistant.orchestration.ToolOrchestrator;
import com.smurthy.ai.assistant.reasoning.BackoffRetryExecutor;
import com.smurthy.ai.assistant.reasoning.CachedFallbackAgent;
import com.smurthy.ai.assistant.reasoning.ReasoningDispatcher;
import com.smurthy.ai.assistant.reasoning.RuntimeSettings;
import com.smurthy.ai.assistant.tools.ToolProvider;
import com.smurthy.ai.assistant.tools.ToolRegistry;
import dev.langchain4j.model.chat.ChatLanguageModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Wires the reasoning pipeline:
 * ReasoningDispatcher → ToolOrchestrator → ToolRegistry (tools from every ToolProvider bean)
 *                     → CachedFallbackAgent → LangChain4j GeneralAgent
 */
@Configuration
public class AssistantConfiguration {

    private static final Logger log = LoggerFactory.getLogger(AssistantConfiguration.class);

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public ToolRegistry toolRegistry(List<ToolProvider> toolProviders) {
        return new ToolRegistry(toolProviders);
    }

    @Bean
    public IntentClassifier intentClassifier() {
        return new LexicalIntentClassifier();
    }

    @Bean
    public ActivityLog activityLog(Clock clock) {
        return new ActivityLog(ActivityLog.DEFAULT_CAPACITY, clock);
    }

    @Bean
    public ToolOrchestrator toolOrchestrator(ToolRegistry toolRegistry, IntentClassifier intentClassifier,
                                             ActivityLog activityLog) {
        return new ToolOrchestrator(toolRegistry, intentClassifier, activityLog);
    }

    @Bean
    public PerformanceMetrics performanceMetrics() {
        return new PerformanceMetrics();
    }

    @Bean
    public RuntimeSettings runtimeSettings(ReasoningProperties properties) {
        return new RuntimeSettings(properties.toRuntimeConfig());
    }

    @Bean
    public BackoffRetryExecutor backoffRetryExecutor() {
        return new BackoffRetryExecutor();
    }

    /**
     * Runs submitted dispatches.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService dispatcherExecutor(ReasoningProperties properties) {
        int threads = Math.max(1, properties.workerThreads());
        log.info("Creating dispatcher pool with {} threads", threads);
        return Executors.newFixedThreadPool(threads);
    }

    /**
     * Runs fallback agent calls so they can be abandoned on timeout.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService fallbackExecutor() {
        return Executors.newCachedThreadPool();
    }

    @Bean
    public FallbackAgentFactory fallbackAgentFactory(ChatLanguageModel chatLanguageModel,
                                                     ToolRegistry toolRegistry,
                                                     @Qualifier("fallbackExecutor") ExecutorService fallbackExecutor,
                                                     ObjectMapper objectMapper) {
        return new LangchainFallbackAgentFactory(chatLanguageModel, toolRegistry, fallbackExecutor, objectMapper);
    }

    @Bean
    public CachedFallbackAgent cachedFallbackAgent(FallbackAgentFactory fallbackAgentFactory, Clock clock) {
        return new CachedFallbackAgent(fallbackAgentFactory, clock);
    }

    @Bean
    public ReasoningDispatcher reasoningDispatcher(ToolOrchestrator toolOrchestrator,
                                                   ToolRegistry toolRegistry,
                                                   CachedFallbackAgent cachedFallbackAgent,
                                                   BackoffRetryExecutor backoffRetryExecutor,
                                                   RuntimeSettings runtimeSettings,
                                                   PerformanceMetrics performanceMetrics,
                                                   ActivityLog activityLog,
                                                   @Qualifier("dispatcherExecutor") ExecutorService dispatcherExecutor) {
        return new ReasoningDispatcher(toolOrchestrator, toolRegistry, cachedFallbackAgent, backoffRetryExecutor,
                runtimeSettings, performanceMetrics, activityLog, dispatcherExecutor);
    }
}
