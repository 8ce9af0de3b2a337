package com.smurthy.ai.assistant.controllers;

import com.smurthy.ai.assistant.orchestration.QueryAnalysis;
import com.smurthy.ai.assistant.orchestration.ToolOrchestrator;
import com.smurthy.ai.assistant.reasoning.DispatchResult;
import com.smurthy.ai.assistant.reasoning.ReasoningDispatcher;
import com.smurthy.ai.assistant.tools.ToolMetadata;
import com.smurthy.ai.assistant.tools.ToolRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Assistant API
 *
 * - POST /assistant/dispatch : answer a request (tools first, general agent as fallback)
 * - GET  /assistant/analyze  : show how a query would be routed, without running anything
 * - GET/POST /assistant/tools: list or register tool metadata
 */
@RestController
@RequestMapping("/assistant")
public class AssistantController {

    private static final Logger log = LoggerFactory.getLogger(AssistantController.class);

    private final ReasoningDispatcher dispatcher;
    private final ToolOrchestrator orchestrator;
    private final ToolRegistry toolRegistry;

    public AssistantController(ReasoningDispatcher dispatcher, ToolOrchestrator orchestrator, ToolRegistry toolRegistry) {
        this.dispatcher = dispatcher;
        this.orchestrator = orchestrator;
        this.toolRegistry = toolRegistry;
    }

    @PostMapping("/dispatch")
    public DispatchResult dispatch(@RequestBody DispatchRequest request) {
        log.debug("POST /assistant/dispatch");
        return dispatcher.dispatch(request.query());
    }

    @GetMapping("/analyze")
    public QueryAnalysis analyze(@RequestParam("q") String query) {
        return orchestrator.analyze(query);
    }

    @GetMapping("/tools")
    public List<ToolMetadata> tools() {
        return toolRegistry.all();
    }

    @PostMapping("/tools")
    public ToolMetadata registerTool(@RequestBody ToolMetadata metadata) {
        dispatcher.registerTool(metadata.name(), metadata);
        return metadata;
    }

    public record DispatchRequest(String query) {}
}
