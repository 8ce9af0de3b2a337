package com.smurthy.ai.assistant.orchestration;

import com.smurthy.ai.assistant.intent.IntentScores;

import java.util.List;

/**
 * Outcome of {@link ToolOrchestrator#analyze(String)}.
 *
 * @param query             the query as received
 * @param intents           per-category confidence
 * @param rankedTools       qualifying tools, best first, at most {@link ToolOrchestrator#MAX_CANDIDATES}
 * @param primaryIntent     id of the best category, or {@code "general"}
 * @param primaryConfidence confidence of the primary intent
 */
public record QueryAnalysis(
        String query,
        IntentScores intents,
        List<ScoredTool> rankedTools,
        String primaryIntent,
        double primaryConfidence
) {

    public static final String GENERAL_INTENT = "general";
    public static final double GENERAL_CONFIDENCE = 0.5;

    public QueryAnalysis {
        intents = intents == null ? IntentScores.empty() : intents;
        rankedTools = rankedTools == null ? List.of() : List.copyOf(rankedTools);
    }

    public boolean hasCandidates() {
        return !rankedTools.isEmpty();
    }
}
