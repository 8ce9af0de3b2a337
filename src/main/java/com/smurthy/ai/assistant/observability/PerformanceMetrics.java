package com.smurthy.ai.assistant.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.LongAdder;

/**
 * Dispatcher performance metrics
 *
 * Process-wide counters updated on every terminal dispatch outcome:
 * - total / successful / failed queries
 * - which path answered (orchestrator or fallback)
 * - average response time over all completed queries
 * - the most recent error
 *
 * Usage:
 * 1. Call recordSuccess() or recordFailure() once per dispatch
 * 2. Call getMetricsSummary() for a consistent-enough snapshot
 * 3. Call resetMetrics() to start over
 */
public class PerformanceMetrics {

    private static final Logger log = LoggerFactory.getLogger(PerformanceMetrics.class);

    // Counters
    private final LongAdder totalQueries = new LongAdder();
    private final LongAdder successfulQueries = new LongAdder();
    private final LongAdder orchestratorUsage = new LongAdder();
    private final LongAdder fallbackUsage = new LongAdder();
    private final LongAdder errorCount = new LongAdder();

    // Timing (nanoseconds)
    private final LongAdder totalResponseNanos = new LongAdder();

    private final AtomicReference<String> lastError = new AtomicReference<>();

    /**
     * Record a query answered by the orchestrator ({@code viaFallback == false}) or the fallback agent
     */
    public void recordSuccess(boolean viaFallback, long responseNanos) {
        totalQueries.increment();
        successfulQueries.increment();
        if (viaFallback) {
            fallbackUsage.increment();
        } else {
            orchestratorUsage.increment();
        }
        totalResponseNanos.add(responseNanos);
    }

    /**
     * Record a failed query
     */
    public void recordFailure(String error, long responseNanos) {
        totalQueries.increment();
        errorCount.increment();
        totalResponseNanos.add(responseNanos);
        lastError.set(error);
    }

    public MetricsSummary getMetricsSummary() {
        long total = totalQueries.sum();
        long successful = successfulQueries.sum();
        double averageSeconds = total > 0 ? totalResponseNanos.sum() / 1e9 / total : 0.0;

        return new MetricsSummary(
                total,
                successful,
                orchestratorUsage.sum(),
                fallbackUsage.sum(),
                errorCount.sum(),
                lastError.get(),
                averageSeconds,
                total > 0 ? successful * 100.0 / total : 0.0
        );
    }

    /**
     * Reset all metrics
     */
    public void resetMetrics() {
        totalQueries.reset();
        successfulQueries.reset();
        orchestratorUsage.reset();
        fallbackUsage.reset();
        errorCount.reset();
        totalResponseNanos.reset();
        lastError.set(null);
        log.info("Performance metrics reset");
    }

    /**
     * Log current metrics summary
     */
    public void logMetricsSummary() {
        MetricsSummary summary = getMetricsSummary();
        log.info("""

                ╔═══════════════════════════════════════════════════════════════╗
                ║              DISPATCHER METRICS SUMMARY                       ║
                ╠═══════════════════════════════════════════════════════════════╣
                ║ Total Queries:          {}
                ║ Successful:             {} ({} %)
                ║ Orchestrator:           {}
                ║ Fallback:               {}
                ║ Errors:                 {}
                ║ Avg Response Time:      {} s
                ║ Last Error:             {}
                ╚═══════════════════════════════════════════════════════════════╝
                """,
                summary.totalQueries,
                summary.successfulQueries,
                String.format("%.1f", summary.successRate),
                summary.orchestratorUsage,
                summary.fallbackUsage,
                summary.errorCount,
                String.format("%.3f", summary.averageResponseTime),
                summary.lastError == null ? "-" : summary.lastError
        );
    }

    public record MetricsSummary(
            long totalQueries,
            long successfulQueries,
            long orchestratorUsage,
            long fallbackUsage,
            long errorCount,
            String lastError,
            double averageResponseTime,     // seconds
            double successRate              // percent
    ) {}
}
