package com.smurthy.ai.assistant.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.nio.file.Path;

/**
 * Settings for the built-in tools
 */
@ConfigurationProperties(prefix = "assistant.tools")
public record ToolsProperties(
        @DefaultValue("") String sandboxDirectory,                          // Blank means ~/jarvis_sandbox
        @DefaultValue("code") String editorCommand,                         // Blank disables launching an editor
        @DefaultValue("New Delhi") String defaultLocation,
        @DefaultValue("https://api.open-meteo.com/v1/forecast") String weatherEndpoint,
        @DefaultValue("https://nominatim.openstreetmap.org/search") String geocodingEndpoint,
        @DefaultValue("https://api.duckduckgo.com/") String searchEndpoint
) {

    public Path sandboxPath() {
        if (sandboxDirectory == null || sandboxDirectory.isBlank()) {
            return Path.of(System.getProperty("user.home"), "jarvis_sandbox");
        }
        return Path.of(sandboxDirectory);
    }
}
