package com.smurthy.ai.assistant.activity;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wraps another sink and swallows its failures after logging them.
 */
public class SafeActivitySink implements ActivitySink {

    private static final Logger log = LoggerFactory.getLogger(SafeActivitySink.class);

    private final ActivitySink delegate;

    public SafeActivitySink(ActivitySink delegate) {
        this.delegate = delegate;
    }

    public static ActivitySink wrap(ActivitySink sink) {
        if (sink == null) {
            return new SafeActivitySink(null);
        }
        return sink instanceof SafeActivitySink ? sink : new SafeActivitySink(sink);
    }

    @Override
    public void log(String message) {
        if (delegate == null) {
            return;
        }
        try {
            delegate.log(message);
        } catch (RuntimeException e) {
            log.debug("Activity sink failed to log '{}': {}", message, e.getMessage());
        }
    }

    @Override
    public void setState(AssistantState state, String message) {
        if (delegate == null) {
            return;
        }
        try {
            delegate.setState(state, message);
        } catch (RuntimeException e) {
            log.debug("Activity sink failed to switch to {}: {}", state, e.getMessage());
        }
    }
}
