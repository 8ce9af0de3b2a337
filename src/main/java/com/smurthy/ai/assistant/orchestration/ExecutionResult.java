package com.smurthy.ai.assistant.orchestration;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of running a plan. {@code outputs} keeps execution order; a failed tool has no output entry.
 */
public record ExecutionResult(
        boolean success,
        Map<String, String> outputs,
        List<String> errors,
        long elapsedMs
) {

    public ExecutionResult {
        outputs = outputs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(outputs));
        errors = errors == null ? List.of() : List.copyOf(errors);
    }
}
