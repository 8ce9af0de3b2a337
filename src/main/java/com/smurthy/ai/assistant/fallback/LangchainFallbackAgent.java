package com.smurthy.ai.assistant.fallback;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs {@link GeneralAgent} calls on a worker pool so they can be bounded by a timeout and cancelled.
 */
public class LangchainFallbackAgent implements FallbackAgent {

    private static final Logger log = LoggerFactory.getLogger(LangchainFallbackAgent.class);

    private final GeneralAgent agent;
    private final ExecutorService executor;

    public LangchainFallbackAgent(GeneralAgent agent, ExecutorService executor) {
        this.agent = agent;
        this.executor = executor;
    }

    @Override
    public String invoke(String query, Duration timeout) {
        Future<String> call = executor.submit(() -> agent.chat(query));
        try {
            return call.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            call.cancel(true);
            log.warn("General agent did not answer within {}ms, call cancelled", timeout.toMillis());
            throw new FallbackTimeoutException("General agent timed out after " + timeout.toMillis() + "ms", e);
        } catch (InterruptedException e) {
            call.cancel(true);
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while waiting for the general agent");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("General agent failed: " + cause.getMessage(), cause);
        }
    }
}
