package com.smurthy.ai.assistant.activity;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Default activity sink: writes every notification to the application log and remembers the
 * most recent entries and the current state for the monitoring endpoint.
 */
public class ActivityLog implements ActivitySink {

    private static final Logger log = LoggerFactory.getLogger(ActivityLog.class);

    public static final int DEFAULT_CAPACITY = 50;

    private final int capacity;
    private final Clock clock;
    private final Deque<Entry> entries = new ArrayDeque<>();
    private volatile AssistantState state = AssistantState.IDLE;

    public ActivityLog() {
        this(DEFAULT_CAPACITY, Clock.systemUTC());
    }

    public ActivityLog(int capacity, Clock clock) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
        this.clock = clock;
    }

    @Override
    public void log(String message) {
        log.info("[activity] {}", message);
        append(new Entry(clock.instant(), state, message));
    }

    @Override
    public void setState(AssistantState newState, String message) {
        this.state = newState;
        log.debug("[activity] state={} {}", newState, message);
        append(new Entry(clock.instant(), newState, message));
    }

    public AssistantState currentState() {
        return state;
    }

    public Snapshot snapshot() {
        synchronized (entries) {
            return new Snapshot(state, List.copyOf(entries));
        }
    }

    private void append(Entry entry) {
        synchronized (entries) {
            if (entries.size() == capacity) {
                entries.removeFirst();
            }
            entries.addLast(entry);
        }
    }

    public record Entry(Instant timestamp, AssistantState state, String message) {}

    public record Snapshot(AssistantState currentState, List<Entry> recent) {}
}
