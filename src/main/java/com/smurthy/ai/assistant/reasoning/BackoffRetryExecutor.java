package com.smurthy.ai.assistant.reasoning;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.backoff.ExponentialBackOffPolicy;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.ThreadWaitSleeper;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.function.Supplier;

/**
 * Retry with exponential backoff: after failure n (counting from 0) wait {@code baseDelay * 2^n}, for at most
 * {@code maxRetries} additional attempts.
 *
 * A template is built per call so runtime configuration changes apply to the next request. Interrupting the
 * calling thread cancels the loop, including while it is sleeping.
 */
public class BackoffRetryExecutor {

    private static final Logger log = LoggerFactory.getLogger(BackoffRetryExecutor.class);

    private static final double MULTIPLIER = 2.0;

    private final Sleeper sleeper;

    public BackoffRetryExecutor() {
        this(new ThreadWaitSleeper());
    }

    public BackoffRetryExecutor(Sleeper sleeper) {
        this.sleeper = sleeper;
    }

    /**
     * @throws DispatchException {@link ErrorCode#RETRY_EXHAUSTED} wrapping the last failure, or
     *                           {@link ErrorCode#CANCELLED} when interrupted
     */
    public <T> T execute(String operation, Supplier<T> action, int maxRetries, Duration baseDelay) {
        RetryTemplate retryTemplate = retryTemplate(operation, maxRetries, baseDelay);
        try {
            return retryTemplate.execute(context -> {
                if (Thread.currentThread().isInterrupted()) {
                    throw new CancellationException(operation + " cancelled");
                }
                return action.get();
            }, context -> {
                Throwable last = context.getLastThrowable();
                if (last instanceof CancellationException) {
                    throw new DispatchException(ErrorCode.CANCELLED, operation + " cancelled", last);
                }
                throw new DispatchException(ErrorCode.RETRY_EXHAUSTED,
                        operation + " failed after " + context.getRetryCount() + " attempts: "
                                + (last == null ? "unknown error" : last.getMessage()), last);
            });
        } catch (BackOffInterruptedException e) {
            throw new DispatchException(ErrorCode.CANCELLED, operation + " cancelled during backoff", e);
        }
    }

    private RetryTemplate retryTemplate(String operation, int maxRetries, Duration baseDelay) {
        RetryTemplate retryTemplate = new RetryTemplate();

        ExponentialBackOffPolicy backOffPolicy = new ExponentialBackOffPolicy();
        backOffPolicy.setInitialInterval(baseDelay.toMillis());
        backOffPolicy.setMultiplier(MULTIPLIER);
        backOffPolicy.setMaxInterval(Long.MAX_VALUE);
        backOffPolicy.setSleeper(sleeper);
        retryTemplate.setBackOffPolicy(backOffPolicy);

        SimpleRetryPolicy retryPolicy = new SimpleRetryPolicy(maxRetries + 1,
                Map.of(CancellationException.class, false), true, true);
        retryTemplate.setRetryPolicy(retryPolicy);

        retryTemplate.registerListener(new RetryListener() {
            @Override
            public <T, E extends Throwable> void onError(RetryContext context, RetryCallback<T, E> callback,
                                                         Throwable throwable) {
                if (!(throwable instanceof CancellationException) && context.getRetryCount() <= maxRetries) {
                    log.warn("{} attempt {}/{} failed: {}", operation, context.getRetryCount(), maxRetries + 1,
                            throwable.getMessage());
                }
            }
        });
        return retryTemplate;
    }
}
