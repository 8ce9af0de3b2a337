package com.smurthy.ai.assistant.tools;

/**
 * A single capability the assistant can run for a query.
 *
 * Side effects, idempotence and I/O are entirely up to the implementation. Failures should be
 * reported by throwing; the orchestrator records them without aborting the rest of the plan.
 */
@FunctionalInterface
public interface Tool {

    String invoke(String query);
}
