package com.smurthy.ai.assistant.orchestration;

import com.smurthy.ai.assistant.activity.ActivitySink;
import com.smurthy.ai.assistant.config.ToolsProperties;
import com.smurthy.ai.assistant.intent.LexicalIntentClassifier;
import com.smurthy.ai.assistant.tools.ToolMetadata;
import com.smurthy.ai.assistant.tools.ToolRegistry;
import com.smurthy.ai.assistant.tools.providers.CodeSandboxToolProvider;
import com.smurthy.ai.assistant.tools.providers.LearningToolProvider;
import com.smurthy.ai.assistant.tools.providers.SystemToolProvider;
import com.smurthy.ai.assistant.tools.providers.UtilityToolProvider;
import com.smurthy.ai.assistant.tools.providers.WebToolProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.Answers;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.web.client.RestClient;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

/**
 * Routes everyday queries through the metadata of the real built-in tool providers
 */
@ExtendWith(MockitoExtension.class)
class BuiltInToolRoutingTest {

    @Mock
    private ActivitySink activitySink;

    @Mock(answer = Answers.RETURNS_DEEP_STUBS)
    private ChatClient.Builder chatClientBuilder;

    @TempDir
    Path sandbox;

    private ToolOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        when(chatClientBuilder.clone()).thenReturn(chatClientBuilder);
        ToolsProperties properties = new ToolsProperties(sandbox.toString(), "", "New Delhi",
                "http://weather.test/forecast", "http://geo.test/search", "http://search.test/");
        ToolRegistry registry = new ToolRegistry(List.of(
                new SystemToolProvider(),
                new UtilityToolProvider(),
                new CodeSandboxToolProvider(properties),
                new WebToolProvider(properties, RestClient.builder()),
                new LearningToolProvider(chatClientBuilder)));
        orchestrator = new ToolOrchestrator(registry, new LexicalIntentClassifier(), activitySink);
    }

    @ParameterizedTest(name = "''{0}'' -> {1}")
    @CsvSource({
            "what is the weather in Delhi, get_weather",
            "what time is it, get_current_datetime",
            "calculate 2 + 3, calculate_expression",
            "generate a password, generate_password",
            "show running processes, get_running_processes",
            "system info, get_system_info",
            "show my ip address, get_network_info",
            "search for java tutorials, web_search",
            "open vs code, open_vscode_sandbox",
            "write a python function, write_code",
            "create a new python file, create_code_file",
            "explain photosynthesis, explain_concept",
            "tell me a joke, tell_joke"
    })
    @DisplayName("Should route a single clear request to its built-in tool")
    void testRoutesToBuiltInTool(String query, String expectedTool) {
        // When
        QueryAnalysis analysis = orchestrator.analyze(query);
        List<ToolMetadata> selected = orchestrator.select(analysis);

        // Then
        assertThat(analysis.hasCandidates()).isTrue();
        assertThat(selected).extracting(ToolMetadata::name).containsExactly(expectedTool);
    }

    @Test
    @DisplayName("Should open the sandbox before writing code")
    void testWriteCodePlanStartsWithSandbox() {
        // Given
        QueryAnalysis analysis = orchestrator.analyze("write a python function");

        // When
        ExecutionPlan plan = orchestrator.plan(orchestrator.select(analysis), analysis.query());

        // Then
        assertThat(plan.toolNames()).containsExactly("open_vscode_sandbox", "write_code");
        assertThat(plan.requiresPrerequisites()).isTrue();
    }
}
