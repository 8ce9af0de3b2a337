package com.smurthy.ai.assistant.reasoning;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.convert.DurationStyle;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holder of the current {@link RuntimeConfig}. Readers always see a complete snapshot; updates replace it
 * atomically.
 *
 * Update keys are matched case-insensitively ignoring '_' and '-', so {@code max_retries},
 * {@code maxRetries} and {@code max-retries} are the same key. Durations accept a number of seconds or a
 * Spring duration string ("500ms", "PT2S", "5m").
 */
public class RuntimeSettings {

    private static final Logger log = LoggerFactory.getLogger(RuntimeSettings.class);

    private final AtomicReference<RuntimeConfig> current;

    public RuntimeSettings(RuntimeConfig initial) {
        this.current = new AtomicReference<>(initial);
    }

    public RuntimeConfig current() {
        return current.get();
    }

    /**
     * Apply a partial update. Unknown keys are ignored with a warning.
     *
     * @return the configuration now in effect
     * @throws IllegalArgumentException if a known key has an unusable value; nothing is applied then
     */
    public synchronized RuntimeConfig update(Map<String, ?> changes) {
        if (changes == null || changes.isEmpty()) {
            return current.get();
        }
        Draft draft = new Draft(current.get());
        for (Map.Entry<String, ?> change : changes.entrySet()) {
            String key = change.getKey();
            Object value = change.getValue();
            switch (canonical(key)) {
                case "maxretries" -> draft.maxRetries = toInt(key, value);
                case "retrybasedelay" -> draft.retryBaseDelay = toDuration(key, value);
                case "fallbacktimeout", "timeoutseconds" -> draft.fallbackTimeout = toDuration(key, value);
                case "sufficiencythreshold", "orchestratorthreshold" -> draft.sufficiencyThreshold = toInt(key, value);
                case "cachettl" -> draft.cacheTtl = toDuration(key, value);
                case "minquerylength" -> draft.minQueryLength = toInt(key, value);
                case "maxquerylength" -> draft.maxQueryLength = toInt(key, value);
                case "fallbackenabled", "enablefallback" -> draft.fallbackEnabled = toBoolean(key, value);
                default -> log.warn("Ignoring unknown configuration key '{}'", key);
            }
        }
        RuntimeConfig updated = draft.build();
        current.set(updated);
        log.info("Runtime configuration updated: {}", updated);
        return updated;
    }

    static String canonical(String key) {
        return key == null ? "" : key.replace("_", "").replace("-", "").toLowerCase(Locale.ROOT);
    }

    private static int toInt(String key, Object value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short) {
            long number = ((Number) value).longValue();
            if (number < Integer.MIN_VALUE || number > Integer.MAX_VALUE) {
                throw new IllegalArgumentException("'" + key + "' is out of range: " + number);
            }
            return (int) number;
        }
        if (value instanceof String text) {
            try {
                return Integer.parseInt(text.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("'" + key + "' expects an integer but got '" + text + "'", e);
            }
        }
        throw new IllegalArgumentException("'" + key + "' expects an integer but got " + value);
    }

    private static Duration toDuration(String key, Object value) {
        if (value instanceof Duration duration) {
            return duration;
        }
        if (value instanceof Number number) {
            return Duration.ofMillis(Math.round(number.doubleValue() * 1000));
        }
        if (value instanceof String text) {
            try {
                return DurationStyle.detectAndParse(text.trim(), ChronoUnit.SECONDS);
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("'" + key + "' expects a duration but got '" + text + "'", e);
            }
        }
        throw new IllegalArgumentException("'" + key + "' expects a duration but got " + value);
    }

    private static boolean toBoolean(String key, Object value) {
        if (value instanceof Boolean bool) {
            return bool;
        }
        if (value instanceof String text) {
            String normalized = text.trim().toLowerCase(Locale.ROOT);
            if (normalized.equals("true") || normalized.equals("false")) {
                return Boolean.parseBoolean(normalized);
            }
        }
        throw new IllegalArgumentException("'" + key + "' expects true or false but got " + value);
    }

    private static final class Draft {
        int maxRetries;
        Duration retryBaseDelay;
        Duration fallbackTimeout;
        int sufficiencyThreshold;
        Duration cacheTtl;
        int minQueryLength;
        int maxQueryLength;
        boolean fallbackEnabled;

        Draft(RuntimeConfig from) {
            maxRetries = from.maxRetries();
            retryBaseDelay = from.retryBaseDelay();
            fallbackTimeout = from.fallbackTimeout();
            sufficiencyThreshold = from.sufficiencyThreshold();
            cacheTtl = from.cacheTtl();
            minQueryLength = from.minQueryLength();
            maxQueryLength = from.maxQueryLength();
            fallbackEnabled = from.fallbackEnabled();
        }

        RuntimeConfig build() {
            return new RuntimeConfig(maxRetries, retryBaseDelay, fallbackTimeout, sufficiencyThreshold, cacheTtl,
                    minQueryLength, maxQueryLength, fallbackEnabled);
        }
    }
}
