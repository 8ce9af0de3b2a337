package com.smurthy.ai.assistant.intent;

import com.fasterxml.jackson.annotation.JsonValue;
import com.smurthy.ai.assistant.tools.ToolCategory;

import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Confidence per intent category for one query. Only non-zero scores are kept.
 */
public record IntentScores(Map<ToolCategory, Double> scores) {

    private static final Comparator<Map.Entry<ToolCategory, Double>> BY_SCORE_DESC =
            Map.Entry.<ToolCategory, Double>comparingByValue().reversed()
                    .thenComparing(Map.Entry.comparingByKey());

    public IntentScores {
        Map<ToolCategory, Double> copy = new EnumMap<>(ToolCategory.class);
        if (scores != null) {
            scores.forEach((category, score) -> {
                if (category != null && score != null && score > 0.0) {
                    copy.put(category, Math.min(score, 1.0));
                }
            });
        }
        scores = Collections.unmodifiableMap(copy);
    }

    public static IntentScores empty() {
        return new IntentScores(Map.of());
    }

    public double score(ToolCategory category) {
        return scores.getOrDefault(category, 0.0);
    }

    public boolean isEmpty() {
        return scores.isEmpty();
    }

    /**
     * Categories sorted by descending score, ties in declaration order
     */
    public List<Map.Entry<ToolCategory, Double>> ranked() {
        return scores.entrySet().stream()
                .sorted(BY_SCORE_DESC)
                .map(e -> Map.entry(e.getKey(), e.getValue()))
                .toList();
    }

    public Optional<Map.Entry<ToolCategory, Double>> top() {
        List<Map.Entry<ToolCategory, Double>> ranked = ranked();
        return ranked.isEmpty() ? Optional.empty() : Optional.of(ranked.get(0));
    }

    @JsonValue
    public Map<String, Double> asRankedMap() {
        Map<String, Double> out = new LinkedHashMap<>();
        ranked().forEach(e -> out.put(e.getKey().id(), e.getValue()));
        return out;
    }
}
