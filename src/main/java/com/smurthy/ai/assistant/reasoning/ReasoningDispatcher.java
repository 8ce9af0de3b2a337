package com.smurthy.ai.assistant.reasoning;

import com.smurthy.ai.assistant.activity.ActivitySink;
import com.smurthy.ai.assistant.activity.AssistantState;
import com.smurthy.ai.assistant.activity.SafeActivitySink;
import com.smurthy.ai.assistant.fallback.FallbackAgent;
import com.smurthy.ai.assistant.fallback.FallbackTimeoutException;
import com.smurthy.ai.assistant.observability.PerformanceMetrics;
import com.smurthy.ai.assistant.orchestration.OrchestrationResult;
import com.smurthy.ai.assistant.orchestration.ToolOrchestrator;
import com.smurthy.ai.assistant.tools.ToolMetadata;
import com.smurthy.ai.assistant.tools.ToolRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Public entry point of the assistant's reasoning.
 *
 * Flow:
 * 1. Validate the query (never retried)
 * 2. Orchestrator path, retried with exponential backoff
 * 3. If the orchestrator answer is missing or too short and fallback is enabled, ask the cached
 *    general agent under a timeout
 *
 * {@link #dispatch(String)} never throws: every outcome is a {@link DispatchResult} and is counted in the
 * metrics.
 */
public class ReasoningDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ReasoningDispatcher.class);

    private final ToolOrchestrator orchestrator;
    private final ToolRegistry toolRegistry;
    private final CachedFallbackAgent fallbackAgent;
    private final BackoffRetryExecutor retryExecutor;
    private final RuntimeSettings settings;
    private final PerformanceMetrics metrics;
    private final ActivitySink activity;
    private final ExecutorService executor;

    public ReasoningDispatcher(ToolOrchestrator orchestrator,
                               ToolRegistry toolRegistry,
                               CachedFallbackAgent fallbackAgent,
                               BackoffRetryExecutor retryExecutor,
                               RuntimeSettings settings,
                               PerformanceMetrics metrics,
                               ActivitySink activity,
                               ExecutorService executor) {
        this.orchestrator = orchestrator;
        this.toolRegistry = toolRegistry;
        this.fallbackAgent = fallbackAgent;
        this.retryExecutor = retryExecutor;
        this.settings = settings;
        this.metrics = metrics;
        this.activity = SafeActivitySink.wrap(activity);
        this.executor = executor;
    }

    public DispatchResult dispatch(String query) {
        long start = System.nanoTime();
        RuntimeConfig config = settings.current();
        try {
            String validated = QueryValidator.validate(query, config);
            log.info("Dispatching query: {}", validated);
            activity.setState(AssistantState.THINKING, "Working on: " + validated);

            OrchestrationResult primary = null;
            DispatchException primaryFailure = null;
            try {
                primary = retryExecutor.execute("Orchestrator",
                        () -> orchestrator.process(validated), config.maxRetries(), config.retryBaseDelay());
            } catch (DispatchException e) {
                if (e.getErrorCode() == ErrorCode.CANCELLED) {
                    throw e;
                }
                primaryFailure = e;
                log.warn("Orchestrator path failed: {}", e.getMessage());
            }

            if (primary != null && isSufficient(primary, config)) {
                return succeed(primary.response(), DispatchMethod.ORCHESTRATOR, start);
            }

            if (!config.fallbackEnabled()) {
                if (primaryFailure != null) {
                    throw new DispatchException(ErrorCode.ORCHESTRATOR_FAILED,
                            "Orchestrator failed and fallback is disabled: " + primaryFailure.getMessage(), primaryFailure);
                }
                throw new DispatchException(ErrorCode.NO_METHOD_AVAILABLE,
                        "No tool could answer the request and fallback is disabled");
            }

            log.debug("Orchestrator answer insufficient, using fallback agent");
            return succeed(runFallback(validated, config), DispatchMethod.FALLBACK, start);

        } catch (DispatchException e) {
            return fail(e.getErrorCode(), e.getMessage(), start);
        } catch (CancellationException e) {
            return fail(ErrorCode.CANCELLED, "Request cancelled", start);
        } catch (RuntimeException e) {
            log.error("Unexpected error while dispatching '{}'", query, e);
            return fail(ErrorCode.UNEXPECTED_ERROR, "Unexpected error: " + e.getMessage(), start);
        }
    }

    /**
     * Dispatch on the dispatcher's executor. {@code cancel(true)} on the returned future interrupts the
     * request, including a pending backoff sleep or fallback call.
     */
    public Future<DispatchResult> submit(String query) {
        return executor.submit(() -> dispatch(query));
    }

    private String runFallback(String query, RuntimeConfig config) {
        FallbackAgent agent = fallbackAgent.get(config.cacheTtl());
        String response;
        try {
            response = agent.invoke(query, config.fallbackTimeout());
        } catch (FallbackTimeoutException e) {
            throw new DispatchException(ErrorCode.EXECUTION_TIMEOUT,
                    "Fallback agent timed out after " + describe(config.fallbackTimeout()), e);
        } catch (CancellationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new DispatchException(ErrorCode.FALLBACK_FAILED, "Fallback agent failed: " + e.getMessage(), e);
        }
        if (response == null || response.isBlank()) {
            throw new DispatchException(ErrorCode.EMPTY_RESPONSE, "Fallback agent returned an empty response");
        }
        return response;
    }

    private static boolean isSufficient(OrchestrationResult result, RuntimeConfig config) {
        return result.matched() && result.response().strip().length() > config.sufficiencyThreshold();
    }

    private DispatchResult succeed(String response, DispatchMethod method, long start) {
        long elapsed = System.nanoTime() - start;
        metrics.recordSuccess(method == DispatchMethod.FALLBACK, elapsed);
        activity.setState(AssistantState.IDLE, "Answered via " + method.label());
        log.info("Query answered via {} in {}ms", method.label(), elapsed / 1_000_000);
        return DispatchResult.success(response, method, elapsed / 1e9);
    }

    private DispatchResult fail(ErrorCode code, String message, long start) {
        long elapsed = System.nanoTime() - start;
        metrics.recordFailure(message, elapsed);
        activity.setState(AssistantState.ERROR, message);
        log.info("Query failed with {} in {}ms: {}", code.code(), elapsed / 1_000_000, message);
        return DispatchResult.failure(code, message, elapsed / 1e9);
    }

    public PerformanceMetrics.MetricsSummary getMetrics() {
        return metrics.getMetricsSummary();
    }

    /**
     * Logs the final summary, then clears all counters.
     */
    public void resetMetrics() {
        metrics.logMetricsSummary();
        metrics.resetMetrics();
    }

    public RuntimeConfig getConfig() {
        return settings.current();
    }

    /**
     * @see RuntimeSettings#update(Map)
     */
    public RuntimeConfig updateConfig(Map<String, ?> changes) {
        return settings.update(changes);
    }

    /**
     * Register or replace tool metadata. The cached fallback agent is dropped so its tool set is rebuilt.
     */
    public void registerTool(String name, ToolMetadata metadata) {
        toolRegistry.register(name, metadata);
        fallbackAgent.invalidate();
    }

    public void invalidateAgentCache() {
        fallbackAgent.invalidate();
    }

    static String describe(Duration timeout) {
        long millis = timeout.toMillis();
        return millis % 1000 == 0 ? (millis / 1000) + "s" : millis + "ms";
    }
}
