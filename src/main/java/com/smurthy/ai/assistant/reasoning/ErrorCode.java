package com.smurthy.ai.assistant.reasoning;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Stable, machine-readable failure codes surfaced in {@link DispatchResult#errorCode()}.
 */
public enum ErrorCode {
    INVALID_QUERY("InvalidQuery"),
    QUERY_TOO_SHORT("QueryTooShort"),
    QUERY_TOO_LONG("QueryTooLong"),
    TOOL_EXECUTION_ERROR("ToolExecutionError"),
    ORCHESTRATOR_FAILED("OrchestratorFailed"),
    EXECUTION_TIMEOUT("ExecutionTimeout"),
    EMPTY_RESPONSE("EmptyResponse"),
    RETRY_EXHAUSTED("RetryExhausted"),
    NO_METHOD_AVAILABLE("NoMethodAvailable"),
    FALLBACK_FAILED("FallbackFailed"),
    AGENT_CREATION_FAILED("AgentCreationFailed"),
    CANCELLED("Cancelled"),
    UNEXPECTED_ERROR("UnexpectedError");

    private final String code;

    ErrorCode(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }
}
