package com.smurthy.ai.assistant.reasoning;

import com.fasterxml.jackson.annotation.JsonValue;

public enum DispatchMethod {
    ORCHESTRATOR("orchestrator"),
    FALLBACK("fallback");

    private final String label;

    DispatchMethod(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
