package com.smurthy.ai.assistant.fallback;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.smurthy.ai.assistant.tools.Tool;
import com.smurthy.ai.assistant.tools.ToolMetadata;
import com.smurthy.ai.assistant.tools.ToolRegistry;
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.service.AiServices;
import dev.langchain4j.service.tool.ToolExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;

/**
 * Builds the general fallback agent with every registered tool bridged in as a LangChain4j tool.
 *
 * Bridges the two tool models:
 * - Assistant: {@link Tool#invoke(String)} with the raw query
 * - LangChain4j: {@link ToolSpecification} + {@link ToolExecutor} with a single "query" argument
 */
public class LangchainFallbackAgentFactory implements FallbackAgentFactory {

    private static final Logger log = LoggerFactory.getLogger(LangchainFallbackAgentFactory.class);

    static final String QUERY_ARGUMENT = "query";

    private final ChatLanguageModel chatModel;
    private final ToolRegistry toolRegistry;
    private final ExecutorService executor;
    private final ObjectMapper objectMapper;

    public LangchainFallbackAgentFactory(ChatLanguageModel chatModel, ToolRegistry toolRegistry,
                                         ExecutorService executor, ObjectMapper objectMapper) {
        this.chatModel = chatModel;
        this.toolRegistry = toolRegistry;
        this.executor = executor;
        this.objectMapper = objectMapper;
    }

    @Override
    public FallbackAgent create() {
        Map<ToolSpecification, ToolExecutor> tools = bridgeTools();
        GeneralAgent agent = AiServices.builder(GeneralAgent.class)
                .chatLanguageModel(chatModel)
                .tools(tools)
                .build();
        log.info("General agent built with {} tools", tools.size());
        return new LangchainFallbackAgent(agent, executor);
    }

    Map<ToolSpecification, ToolExecutor> bridgeTools() {
        Map<ToolSpecification, ToolExecutor> tools = new LinkedHashMap<>();
        for (ToolMetadata metadata : toolRegistry.all()) {
            Optional<Tool> implementation = toolRegistry.implementation(metadata.name());
            if (implementation.isEmpty()) {
                continue;
            }
            tools.put(specification(metadata), executor(metadata.name(), implementation.get()));
        }
        return tools;
    }

    private static ToolSpecification specification(ToolMetadata metadata) {
        return ToolSpecification.builder()
                .name(metadata.name())
                .description(metadata.description())
                .parameters(JsonObjectSchema.builder()
                        .addStringProperty(QUERY_ARGUMENT, "The user's request, in their own words")
                        .required(QUERY_ARGUMENT)
                        .build())
                .build();
    }

    private ToolExecutor executor(String name, Tool tool) {
        return (ToolExecutionRequest request, Object memoryId) -> {
            String query = extractQuery(request.arguments());
            log.debug("General agent calling tool {} with '{}'", name, query);
            try {
                return tool.invoke(query);
            } catch (RuntimeException e) {
                log.warn("Tool {} failed inside general agent: {}", name, e.getMessage());
                return "Error executing " + name + ": " + e.getMessage();
            }
        };
    }

    String extractQuery(String arguments) {
        if (arguments == null || arguments.isBlank()) {
            return "";
        }
        try {
            JsonNode json = objectMapper.readTree(arguments);
            JsonNode query = json.get(QUERY_ARGUMENT);
            return query == null || query.isNull() ? arguments : query.asText();
        } catch (JsonProcessingException e) {
            log.debug("Tool arguments are not JSON, passing them through: {}", arguments);
            return arguments;
        }
    }
}
