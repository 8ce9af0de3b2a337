package com.smurthy.ai.assistant.orchestration;

import java.util.List;

/**
 * Result of the composed analyze, select, plan and execute pipeline.
 *
 * @param matched         false when no tool qualified; the response is then the fixed no-match text
 * @param response        non-empty tool outputs joined in execution order
 * @param toolsRun        planned tools in execution order
 * @param errors          per-tool error messages
 * @param executionTimeMs wall time of the whole pipeline
 */
public record OrchestrationResult(
        boolean matched,
        String response,
        List<String> toolsRun,
        List<String> errors,
        long executionTimeMs
) {

    public static final String NO_MATCH_RESPONSE = "I couldn't find a suitable tool for that request.";

    public OrchestrationResult {
        response = response == null ? "" : response;
        toolsRun = toolsRun == null ? List.of() : List.copyOf(toolsRun);
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static OrchestrationResult noMatch(long executionTimeMs) {
        return new OrchestrationResult(false, NO_MATCH_RESPONSE, List.of(), List.of(), executionTimeMs);
    }
}
