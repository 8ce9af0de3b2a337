package com.smurthy.ai.assistant.tools;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Static routing metadata for one tool. Identity is the name.
 */
public record ToolMetadata(
        String name,              // Unique key, e.g. "get_system_info"
        ToolCategory category,
        String description,
        Set<String> keywords,     // Lower-case, matched as substrings of the normalized query
        int priority,             // 1..10, scales the computed score
        Set<String> prerequisites,
        Set<String> conflicts,
        double minConfidence,     // 0..1, minimum score for the tool to qualify
        double estimatedCost,     // Seconds
        boolean asyncCapable
) {

    public static final int MIN_PRIORITY = 1;
    public static final int MAX_PRIORITY = 10;
    public static final double DEFAULT_MIN_CONFIDENCE = 0.7;

    public ToolMetadata {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Tool name must not be blank");
        }
        if (category == null) {
            throw new IllegalArgumentException("Tool '" + name + "' has no category");
        }
        if (priority < MIN_PRIORITY || priority > MAX_PRIORITY) {
            throw new IllegalArgumentException("Tool '" + name + "' priority must be between "
                    + MIN_PRIORITY + " and " + MAX_PRIORITY + " but was " + priority);
        }
        if (minConfidence < 0.0 || minConfidence > 1.0) {
            throw new IllegalArgumentException("Tool '" + name + "' minConfidence must be within [0,1] but was " + minConfidence);
        }
        if (estimatedCost < 0.0) {
            throw new IllegalArgumentException("Tool '" + name + "' estimatedCost must not be negative");
        }
        name = name.trim();
        description = description == null ? "" : description;
        keywords = lowerCased(keywords);
        prerequisites = copyOf(prerequisites);
        conflicts = copyOf(conflicts);
    }

    public static Builder builder(String name, ToolCategory category) {
        return new Builder(name, category);
    }

    public boolean conflictsWith(String otherTool) {
        return conflicts.contains(otherTool);
    }

    private static Set<String> lowerCased(Collection<String> values) {
        Set<String> out = new LinkedHashSet<>();
        if (values != null) {
            for (String value : values) {
                if (value != null && !value.isBlank()) {
                    out.add(value.trim().toLowerCase(Locale.ROOT));
                }
            }
        }
        return Collections.unmodifiableSet(out);
    }

    private static Set<String> copyOf(Collection<String> values) {
        Set<String> out = new LinkedHashSet<>();
        if (values != null) {
            for (String value : values) {
                if (value != null && !value.isBlank()) {
                    out.add(value.trim());
                }
            }
        }
        return Collections.unmodifiableSet(out);
    }

    public static final class Builder {
        private final String name;
        private final ToolCategory category;
        private String description = "";
        private Set<String> keywords = Set.of();
        private int priority = 5;
        private Set<String> prerequisites = Set.of();
        private Set<String> conflicts = Set.of();
        private double minConfidence = DEFAULT_MIN_CONFIDENCE;
        private double estimatedCost = 1.0;
        private boolean asyncCapable = true;

        private Builder(String name, ToolCategory category) {
            this.name = name;
            this.category = category;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder keywords(String... keywords) {
            this.keywords = new LinkedHashSet<>(Arrays.asList(keywords));
            return this;
        }

        public Builder keywords(Collection<String> keywords) {
            this.keywords = keywords == null ? Set.of() : new LinkedHashSet<>(keywords);
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder prerequisites(String... prerequisites) {
            this.prerequisites = new LinkedHashSet<>(Arrays.asList(prerequisites));
            return this;
        }

        public Builder prerequisites(Collection<String> prerequisites) {
            this.prerequisites = prerequisites == null ? Set.of() : new LinkedHashSet<>(prerequisites);
            return this;
        }

        public Builder conflicts(String... conflicts) {
            this.conflicts = new LinkedHashSet<>(Arrays.asList(conflicts));
            return this;
        }

        public Builder conflicts(Collection<String> conflicts) {
            this.conflicts = conflicts == null ? Set.of() : new LinkedHashSet<>(conflicts);
            return this;
        }

        public Builder minConfidence(double minConfidence) {
            this.minConfidence = minConfidence;
            return this;
        }

        public Builder estimatedCost(double estimatedCost) {
            this.estimatedCost = estimatedCost;
            return this;
        }

        public Builder asyncCapable(boolean asyncCapable) {
            this.asyncCapable = asyncCapable;
            return this;
        }

        public ToolMetadata build() {
            return new ToolMetadata(name, category, description, keywords, priority,
                    prerequisites, conflicts, minConfidence, estimatedCost, asyncCapable);
        }
    }
}
