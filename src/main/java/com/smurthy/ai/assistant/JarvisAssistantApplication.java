package com.smurthy.ai.assistant;

import com.smurthy.ai.assistant.config.ReasoningProperties;
import com.smurthy.ai.assistant.config.ToolsProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({ReasoningProperties.class, ToolsProperties.class})
public class JarvisAssistantApplication {

	public static void main(String[] args) {
		SpringApplication.run(JarvisAssistantApplication.class, args);
	}

}
