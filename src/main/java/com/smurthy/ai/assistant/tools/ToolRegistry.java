package com.smurthy.ai.assistant.tools;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Central registry of all tools the orchestrator can plan with.
 *
 * Maps a tool name to its metadata and, when one is bound, the implementation that runs it.
 * Read-mostly: lookups share a read lock, registrations take the write lock.
 */
public class ToolRegistry {

    private static final Logger log = LoggerFactory.getLogger(ToolRegistry.class);

    private final Map<String, ToolMetadata> toolCatalog = new LinkedHashMap<>();
    private final Map<String, Tool> implementations = new LinkedHashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public ToolRegistry() {
    }

    public ToolRegistry(List<ToolProvider> toolProviders) {
        for (ToolProvider provider : toolProviders) {
            List<ToolBinding> tools = provider.getTools();
            tools.forEach(this::register);
            log.info("Registered {} tools from {}", tools.size(), provider.getProviderName());
        }
        log.info("Tool Registry initialized with {} total tools from {} providers",
                size(), toolProviders.size());
    }

    /**
     * Register or replace the metadata stored under {@code name}. An implementation already bound to
     * the name is kept.
     */
    public void register(String name, ToolMetadata metadata) {
        if (metadata == null) {
            throw new IllegalArgumentException("Tool metadata must not be null");
        }
        if (name == null || !name.trim().equals(metadata.name())) {
            throw new IllegalArgumentException("Registration name '" + name
                    + "' does not match metadata name '" + metadata.name() + "'");
        }
        lock.writeLock().lock();
        try {
            ToolMetadata previous = toolCatalog.put(metadata.name(), metadata);
            log.info("{} tool: {} [{}]", previous == null ? "Registered" : "Updated",
                    metadata.name(), metadata.category().id());
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void register(ToolBinding binding) {
        lock.writeLock().lock();
        try {
            toolCatalog.put(binding.name(), binding.metadata());
            implementations.put(binding.name(), binding.tool());
            log.debug("Registered tool: {} [{}]", binding.name(), binding.metadata().category().id());
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Optional<ToolMetadata> get(String name) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(toolCatalog.get(name));
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<Tool> implementation(String name) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(implementations.get(name));
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<ToolMetadata> all() {
        lock.readLock().lock();
        try {
            return List.copyOf(toolCatalog.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Get all tools in a specific category
     */
    public List<ToolMetadata> findByCategory(ToolCategory category) {
        return all().stream()
                .filter(tool -> tool.category() == category)
                .toList();
    }

    /**
     * Tools having at least one keyword that contains {@code text}, case-insensitively
     */
    public List<ToolMetadata> findByKeywordSubstring(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        String needle = text.trim().toLowerCase(Locale.ROOT);
        List<ToolMetadata> matches = new ArrayList<>();
        for (ToolMetadata tool : all()) {
            if (tool.keywords().stream().anyMatch(keyword -> keyword.contains(needle))) {
                matches.add(tool);
            }
        }
        return matches;
    }

    public boolean contains(String name) {
        return get(name).isPresent();
    }

    public int size() {
        lock.readLock().lock();
        try {
            return toolCatalog.size();
        } finally {
            lock.readLock().unlock();
        }
    }
}
