package com.smurthy.ai.assistant.tools;

/**
 * Metadata paired with the implementation that serves it
 */
public record ToolBinding(ToolMetadata metadata, Tool tool) {

    public ToolBinding {
        if (metadata == null || tool == null) {
            throw new IllegalArgumentException("A tool binding needs both metadata and an implementation");
        }
    }

    public String name() {
        return metadata.name();
    }
}
