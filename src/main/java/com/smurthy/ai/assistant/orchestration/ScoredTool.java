package com.smurthy.ai.assistant.orchestration;

/**
 * A tool that qualified for a query, with its computed score in [0,1].
 */
public record ScoredTool(String name, double score) {}
