package com.smurthy.ai.assistant.reasoning;

import com.smurthy.ai.assistant.fallback.FallbackAgent;
import com.smurthy.ai.assistant.fallback.FallbackAgentFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Reuses one fallback agent for a time-to-live window.
 *
 * Concurrent callers that find the entry expired or missing wait on a single rebuild instead of each
 * constructing their own agent.
 */
public class CachedFallbackAgent {

    private static final Logger log = LoggerFactory.getLogger(CachedFallbackAgent.class);

    private final FallbackAgentFactory factory;
    private final Clock clock;
    private final Object rebuildLock = new Object();
    private volatile Entry entry;

    public CachedFallbackAgent(FallbackAgentFactory factory, Clock clock) {
        this.factory = factory;
        this.clock = clock;
    }

    /**
     * @throws DispatchException {@link ErrorCode#AGENT_CREATION_FAILED} if the agent cannot be built
     */
    public FallbackAgent get(Duration ttl) {
        Entry cached = entry;
        if (isFresh(cached, ttl)) {
            return cached.agent();
        }
        synchronized (rebuildLock) {
            cached = entry;
            if (isFresh(cached, ttl)) {
                return cached.agent();
            }
            log.info("{} fallback agent", cached == null ? "Creating" : "Refreshing expired");
            long start = System.nanoTime();
            FallbackAgent agent;
            try {
                agent = factory.create();
            } catch (RuntimeException e) {
                throw new DispatchException(ErrorCode.AGENT_CREATION_FAILED,
                        "Failed to create fallback agent: " + e.getMessage(), e);
            }
            if (agent == null) {
                throw new DispatchException(ErrorCode.AGENT_CREATION_FAILED, "Agent factory returned no agent");
            }
            entry = new Entry(agent, clock.instant());
            log.info("Fallback agent ready in {}ms", (System.nanoTime() - start) / 1_000_000);
            return agent;
        }
    }

    public void invalidate() {
        synchronized (rebuildLock) {
            entry = null;
        }
        log.info("Fallback agent cache invalidated");
    }

    public boolean isCached(Duration ttl) {
        return isFresh(entry, ttl);
    }

    private boolean isFresh(Entry cached, Duration ttl) {
        return cached != null && Duration.between(cached.createdAt(), clock.instant()).compareTo(ttl) < 0;
    }

    private record Entry(FallbackAgent agent, Instant createdAt) {}
}
