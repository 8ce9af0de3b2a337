package com.smurthy.ai.assistant.tools;

import java.util.List;

/**
 * Interface for all tool providers to register their tools
 *
 * Each implementation groups a family of related capabilities (system, code sandbox, web, ...)
 * and is discovered as a Spring bean at startup.
 */
public interface ToolProvider {

    /**
     * Get every tool this provider offers, metadata and implementation together
     *
     * @return List of bindings for registration
     */
    List<ToolBinding> getTools();

    /**
     * Get a human-readable name for this provider
     *
     * @return Provider name
     */
    default String getProviderName() {
        return getClass().getSimpleName();
    }
}
