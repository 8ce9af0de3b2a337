package com.smurthy.ai.assistant.orchestration;

import com.smurthy.ai.assistant.tools.ToolMetadata;

import java.util.List;

/**
 * Ordered, dependency-resolved tools to run for one request. Prerequisites always precede their dependents.
 */
public record ExecutionPlan(
        List<ToolMetadata> steps,
        double estimatedCost,
        boolean requiresPrerequisites,
        boolean hasUnmetPrerequisites,
        boolean hasConflicts
) {

    public ExecutionPlan {
        steps = steps == null ? List.of() : List.copyOf(steps);
    }

    public List<String> toolNames() {
        return steps.stream().map(ToolMetadata::name).toList();
    }

    public boolean isEmpty() {
        return steps.isEmpty();
    }
}
