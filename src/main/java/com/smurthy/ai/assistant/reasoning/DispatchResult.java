package com.smurthy.ai.assistant.reasoning;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Structured outcome of {@link ReasoningDispatcher#dispatch(String)}.
 * Successful results carry {@code response} and {@code method}; failures carry {@code error} and {@code errorCode}.
 *
 * @param executionTime seconds
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DispatchResult(
        boolean success,
        String response,
        String error,
        ErrorCode errorCode,
        DispatchMethod method,
        double executionTime
) {

    public static DispatchResult success(String response, DispatchMethod method, double executionTime) {
        return new DispatchResult(true, response, null, null, method, executionTime);
    }

    public static DispatchResult failure(ErrorCode errorCode, String error, double executionTime) {
        return new DispatchResult(false, null, error, errorCode, null, executionTime);
    }
}
