package com.smurthy.ai.assistant.tools.providers;

import com.smurthy.ai.assistant.tools.Tool;
import com.smurthy.ai.assistant.tools.ToolBinding;
import com.smurthy.ai.assistant.tools.ToolCategory;
import com.smurthy.ai.assistant.tools.ToolExecutionException;
import com.smurthy.ai.assistant.tools.ToolMetadata;
import com.smurthy.ai.assistant.tools.ToolProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Learning and entertainment tools answered by the chat model, each with its own system prompt.
 */
@Component
public class LearningToolProvider implements ToolProvider {

    private static final Logger log = LoggerFactory.getLogger(LearningToolProvider.class);

    static final String EXPLAIN_PROMPT = """
            You are a patient teacher. Explain the concept the user asks about in simple words,
            with one everyday example. Keep it under 120 words because the answer is spoken aloud.
            """;

    static final String STUDY_PLAN_PROMPT = """
            You are a study coach. Build a short, week-by-week study plan for the topic the user names.
            Use at most 6 bullet points, each with a concrete goal and one free resource.
            """;

    static final String JOKE_PROMPT = """
            You are Jarvis with a light sense of humour. Tell one short, clean joke, in Hinglish if the
            user writes in Hinglish. No explanations.
            """;

    private final ChatClient.Builder chatClientBuilder;

    public LearningToolProvider(ChatClient.Builder chatClientBuilder) {
        this.chatClientBuilder = chatClientBuilder;
    }

    @Override
    public List<ToolBinding> getTools() {
        return List.of(
                new ToolBinding(ToolMetadata.builder("explain_concept", ToolCategory.LEARNING)
                        .description("Explain a concept in simple words with an example")
                        .keywords("explain", "concept", "teach", "what is", "understand", "meaning")
                        .priority(8)
                        .minConfidence(0.2)
                        .estimatedCost(4.0)
                        .build(), chatTool("explain_concept", EXPLAIN_PROMPT)),
                new ToolBinding(ToolMetadata.builder("create_study_plan", ToolCategory.LEARNING)
                        .description("Create a week-by-week study plan for a topic")
                        .keywords("study plan", "study", "learn", "course", "roadmap", "syllabus")
                        .priority(7)
                        .minConfidence(0.2)
                        .estimatedCost(5.0)
                        .build(), chatTool("create_study_plan", STUDY_PLAN_PROMPT)),
                new ToolBinding(ToolMetadata.builder("tell_joke", ToolCategory.ENTERTAINMENT)
                        .description("Tell a short, clean joke")
                        .keywords("joke", "funny", "laugh", "bored")
                        .priority(8)
                        .minConfidence(0.2)
                        .estimatedCost(2.0)
                        .build(), chatTool("tell_joke", JOKE_PROMPT))
        );
    }

    private Tool chatTool(String name, String systemPrompt) {
        ChatClient chatClient = chatClientBuilder.clone()
                .defaultSystem(systemPrompt)
                .build();
        return query -> {
            log.debug("Calling chat model for {}", name);
            try {
                String content = chatClient.prompt()
                        .user(query)
                        .call()
                        .content();
                if (content == null || content.isBlank()) {
                    throw new ToolExecutionException(name + " returned no content");
                }
                return content.strip();
            } catch (ToolExecutionException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new ToolExecutionException(name + " failed: " + e.getMessage(), e);
            }
        };
    }
}
