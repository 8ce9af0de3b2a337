package com.smurthy.ai.assistant.tools;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Locale;

/**
 * Closed set of tool categories.
 *
 * The same set doubles as the intent categories produced by the classifier, so a tool's
 * category can be looked up directly in the intent scores of a query.
 */
public enum ToolCategory {

    SYSTEM_INFO("system-info", "system"),
    FILE_MANAGEMENT("file-management", "file"),
    CODE_DEVELOPMENT("code-development", "code"),
    WEB_SEARCH("web-search", "search"),
    AUTOMATION("automation", "automate"),
    WRITING("writing", "write"),
    MULTIMEDIA("multimedia", "media"),
    LEARNING("learning", "learn"),
    ENTERTAINMENT("entertainment", "fun"),
    PRODUCTIVITY("productivity", "task"),
    COMMUNICATION("communication", "message"),

    /**
     * Exempt from the one-tool-per-category rule during selection
     */
    UTILITIES("utilities", "utility");

    private final String id;
    private final String canonicalKeyword;

    ToolCategory(String id, String canonicalKeyword) {
        this.id = id;
        this.canonicalKeyword = canonicalKeyword;
    }

    @JsonValue
    public String id() {
        return id;
    }

    public String canonicalKeyword() {
        return canonicalKeyword;
    }

    /**
     * Spellings that count as the category being named literally in a normalized query
     */
    public List<String> literalForms() {
        return List.of(id, id.replace('-', '_'), id.replace('-', ' '), canonicalKeyword);
    }

    @JsonCreator
    public static ToolCategory fromId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Tool category must not be blank");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-').replace(' ', '-');
        for (ToolCategory category : values()) {
            if (category.id.equals(normalized)) {
                return category;
            }
        }
        throw new IllegalArgumentException("Unknown tool category: " + value);
    }
}
