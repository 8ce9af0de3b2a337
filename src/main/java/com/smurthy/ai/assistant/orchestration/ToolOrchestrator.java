package com.smurthy.ai.assistant.orchestration;

import com.smurthy.ai.assistant.activity.ActivitySink;
import com.smurthy.ai.assistant.activity.AssistantState;
import com.smurthy.ai.assistant.activity.SafeActivitySink;
import com.smurthy.ai.assistant.intent.IntentClassifier;
import com.smurthy.ai.assistant.intent.IntentScores;
import com.smurthy.ai.assistant.intent.QueryNormalizer;
import com.smurthy.ai.assistant.tools.Tool;
import com.smurthy.ai.assistant.tools.ToolCategory;
import com.smurthy.ai.assistant.tools.ToolMetadata;
import com.smurthy.ai.assistant.tools.ToolRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.stream.Collectors;

/**
 * Intent-driven tool orchestrator.
 *
 * Turns a query into a scored shortlist of tools, a conflict and category filtered selection, a
 * dependency-ordered plan, and finally runs that plan:
 * <pre>
 *   analyze -> select -> plan -> execute
 * </pre>
 * Tools of one plan run strictly one after another, in plan order. A failing tool is recorded and the
 * remaining tools still run.
 */
public class ToolOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ToolOrchestrator.class);

    public static final int MAX_CANDIDATES = 5;
    public static final int MAX_SELECTED = 3;
    public static final String COMPLETED_WITHOUT_OUTPUT = "Task completed successfully.";

    static final double KEYWORD_WEIGHT = 0.3;
    static final double INTENT_WEIGHT = 0.7;

    private static final Comparator<Candidate> BY_RANK = Comparator
            .comparingDouble((Candidate c) -> c.score()).reversed()
            .thenComparing(Comparator.comparingInt((Candidate c) -> c.tool().priority()).reversed())
            .thenComparing(c -> c.tool().name());

    private final ToolRegistry toolRegistry;
    private final IntentClassifier intentClassifier;
    private final ActivitySink activity;

    public ToolOrchestrator(ToolRegistry toolRegistry, IntentClassifier intentClassifier, ActivitySink activity) {
        this.toolRegistry = toolRegistry;
        this.intentClassifier = intentClassifier;
        this.activity = SafeActivitySink.wrap(activity);
        log.info("Tool Orchestrator initialized with {} tools", toolRegistry.size());
    }

    /**
     * Score every registered tool against the query and keep the best qualifying ones.
     */
    public QueryAnalysis analyze(String query) {
        String normalized = QueryNormalizer.normalize(query);
        IntentScores intents = intentClassifier.classify(query);

        List<Candidate> qualifying = new ArrayList<>();
        for (ToolMetadata tool : toolRegistry.all()) {
            double score = score(tool, normalized, intents);
            if (score >= tool.minConfidence()) {
                qualifying.add(new Candidate(tool, score));
            }
        }

        List<ScoredTool> ranked = qualifying.stream()
                .sorted(BY_RANK)
                .limit(MAX_CANDIDATES)
                .map(c -> new ScoredTool(c.tool().name(), c.score()))
                .toList();

        String primaryIntent = QueryAnalysis.GENERAL_INTENT;
        double primaryConfidence = QueryAnalysis.GENERAL_CONFIDENCE;
        Optional<Map.Entry<ToolCategory, Double>> top = intents.top();
        if (top.isPresent()) {
            primaryIntent = top.get().getKey().id();
            primaryConfidence = top.get().getValue();
        }

        log.debug("Analysis for '{}': primary={} ({}), candidates={}",
                normalized, primaryIntent, primaryConfidence, ranked);
        return new QueryAnalysis(query, intents, ranked, primaryIntent, primaryConfidence);
    }

    /**
     * Pick at most {@value #MAX_SELECTED} tools from the shortlist: no two conflicting tools and one tool
     * per category, except utilities.
     */
    public List<ToolMetadata> select(QueryAnalysis analysis) {
        List<ToolMetadata> selected = new ArrayList<>();
        Set<ToolCategory> usedCategories = new HashSet<>();

        for (ScoredTool candidate : analysis.rankedTools()) {
            if (selected.size() >= MAX_SELECTED) {
                break;
            }
            Optional<ToolMetadata> found = toolRegistry.get(candidate.name());
            if (found.isEmpty()) {
                continue;
            }
            ToolMetadata tool = found.get();

            boolean conflicting = selected.stream().anyMatch(s -> conflicts(s, tool));
            if (conflicting) {
                log.debug("Skipping {}: conflicts with current selection", tool.name());
                continue;
            }
            if (tool.category() != ToolCategory.UTILITIES && usedCategories.contains(tool.category())) {
                log.debug("Skipping {}: category {} already selected", tool.name(), tool.category().id());
                continue;
            }
            selected.add(tool);
            usedCategories.add(tool.category());
        }
        return selected;
    }

    /**
     * Resolve prerequisites (transitively). Injected prerequisites are placed at the front of the plan, in
     * dependency order, ahead of every selected tool. An injected tool that itself depends on a selected
     * tool stays behind that tool.
     */
    public ExecutionPlan plan(List<ToolMetadata> selection, String query) {
        Map<String, ToolMetadata> ordered = new LinkedHashMap<>();
        Set<String> inProgress = new HashSet<>();
        boolean[] unmet = {false};

        for (ToolMetadata tool : selection) {
            visit(tool, ordered, inProgress, unmet);
        }

        Set<String> selectedNames = selection.stream().map(ToolMetadata::name).collect(Collectors.toSet());
        List<ToolMetadata> front = new ArrayList<>();
        List<ToolMetadata> rest = new ArrayList<>();
        Set<String> frontNames = new HashSet<>();
        for (ToolMetadata step : ordered.values()) {
            boolean movable = !selectedNames.contains(step.name())
                    && step.prerequisites().stream()
                            .allMatch(p -> frontNames.contains(p) || !ordered.containsKey(p));
            if (movable) {
                front.add(step);
                frontNames.add(step.name());
            } else {
                rest.add(step);
            }
        }
        front.addAll(rest);
        List<ToolMetadata> steps = List.copyOf(front);

        boolean injected = ordered.keySet().stream().anyMatch(name -> !selectedNames.contains(name));
        double cost = steps.stream().mapToDouble(ToolMetadata::estimatedCost).sum();

        boolean conflicting = false;
        for (int i = 0; i < steps.size() && !conflicting; i++) {
            for (int j = i + 1; j < steps.size(); j++) {
                if (conflicts(steps.get(i), steps.get(j))) {
                    conflicting = true;
                    break;
                }
            }
        }

        ExecutionPlan plan = new ExecutionPlan(steps, cost, injected, unmet[0], conflicting);
        log.debug("Plan for '{}': {} (cost ~{}s, prerequisites={}, unmet={}, conflicts={})",
                query, plan.toolNames(), cost, injected, unmet[0], conflicting);
        return plan;
    }

    private void visit(ToolMetadata tool, Map<String, ToolMetadata> ordered, Set<String> inProgress, boolean[] unmet) {
        if (ordered.containsKey(tool.name())) {
            return;
        }
        if (!inProgress.add(tool.name())) {
            log.warn("Prerequisite cycle through '{}', ignoring back edge", tool.name());
            return;
        }
        for (String prerequisite : tool.prerequisites()) {
            Optional<ToolMetadata> required = toolRegistry.get(prerequisite);
            if (required.isPresent()) {
                visit(required.get(), ordered, inProgress, unmet);
            } else {
                log.warn("Tool '{}' requires '{}' which is not registered", tool.name(), prerequisite);
                unmet[0] = true;
            }
        }
        inProgress.remove(tool.name());
        ordered.put(tool.name(), tool);
    }

    /**
     * Run the plan sequentially. Per-tool failures are recorded and do not stop the plan.
     *
     * @throws CancellationException if the calling thread is interrupted between tools
     */
    public ExecutionResult execute(ExecutionPlan plan, String query) {
        long start = System.nanoTime();
        Map<String, String> outputs = new LinkedHashMap<>();
        List<String> errors = new ArrayList<>();

        for (ToolMetadata step : plan.steps()) {
            if (Thread.currentThread().isInterrupted()) {
                throw new CancellationException("Execution cancelled before " + step.name());
            }
            activity.log("Running " + step.name());
            try {
                Tool tool = toolRegistry.implementation(step.name())
                        .orElseThrow(() -> new IllegalStateException("no implementation registered"));
                String output = tool.invoke(query);
                outputs.put(step.name(), output == null ? "" : output);
                log.debug("Tool {} completed", step.name());
            } catch (RuntimeException e) {
                String error = "Error executing " + step.name() + ": " + e.getMessage();
                log.warn(error);
                activity.log(error);
                errors.add(error);
            }
        }

        long elapsedMs = (System.nanoTime() - start) / 1_000_000;
        return new ExecutionResult(errors.isEmpty(), outputs, errors, elapsedMs);
    }

    /**
     * The full pipeline. Returns the no-match result without executing anything when no tool qualifies.
     */
    public OrchestrationResult process(String query) {
        long start = System.nanoTime();
        activity.setState(AssistantState.THINKING, "Analyzing request");

        QueryAnalysis analysis = analyze(query);
        if (!analysis.hasCandidates()) {
            log.info("No tool matched query: {}", query);
            activity.setState(AssistantState.IDLE, "No matching tool");
            return OrchestrationResult.noMatch(elapsedMs(start));
        }

        List<ToolMetadata> selection = select(analysis);
        ExecutionPlan plan = plan(selection, query);
        activity.log("Executing " + String.join(", ", plan.toolNames()));

        ExecutionResult result = execute(plan, query);

        String response = result.outputs().values().stream()
                .filter(output -> !output.isBlank())
                .collect(Collectors.joining("\n\n"));
        if (response.isEmpty() && result.success()) {
            response = COMPLETED_WITHOUT_OUTPUT;
        }

        long elapsed = elapsedMs(start);
        log.info("Orchestrated '{}' via {} in {}ms (errors={})", query, plan.toolNames(), elapsed, result.errors().size());
        activity.setState(result.success() ? AssistantState.IDLE : AssistantState.ERROR,
                result.success() ? "Done" : result.errors().get(0));

        return new OrchestrationResult(true, response, plan.toolNames(), result.errors(), elapsed);
    }

    /**
     * (0.3 * keyword hit ratio + 0.7 * category intent) scaled by priority / 10, clamped to [0,1].
     */
    double score(ToolMetadata tool, String normalizedQuery, IntentScores intents) {
        double keywordRatio = 0.0;
        if (!tool.keywords().isEmpty()) {
            long hits = tool.keywords().stream().filter(normalizedQuery::contains).count();
            keywordRatio = (double) hits / tool.keywords().size();
        }
        double raw = (KEYWORD_WEIGHT * keywordRatio + INTENT_WEIGHT * intents.score(tool.category()))
                * tool.priority() / 10.0;
        return Math.max(0.0, Math.min(raw, 1.0));
    }

    private static boolean conflicts(ToolMetadata a, ToolMetadata b) {
        return a.conflictsWith(b.name()) || b.conflictsWith(a.name());
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }

    private record Candidate(ToolMetadata tool, double score) {}
}
