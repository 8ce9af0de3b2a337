package com.smurthy.ai.assistant.tools.providers;

import com.smurthy.ai.assistant.config.ToolsProperties;
import com.smurthy.ai.assistant.tools.ToolBinding;
import com.smurthy.ai.assistant.tools.ToolCategory;
import com.smurthy.ai.assistant.tools.ToolExecutionException;
import com.smurthy.ai.assistant.tools.ToolMetadata;
import com.smurthy.ai.assistant.tools.ToolProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Coding sandbox: a workspace directory opened in the configured editor, plus tools that create files in it.
 *
 * create_code_file and write_code need the sandbox, so both declare open_vscode_sandbox as a prerequisite.
 */
@Component
public class CodeSandboxToolProvider implements ToolProvider {

    private static final Logger log = LoggerFactory.getLogger(CodeSandboxToolProvider.class);

    static final String OPEN_SANDBOX = "open_vscode_sandbox";
    static final String PROJECTS_DIR = "projects";

    private static final Pattern FILE_NAME = Pattern.compile(
            "(?:named|called)\\s+([\\w-]+(?:\\.\\w+)?)|\\b([\\w-]+\\.(?:py|js|html|css|json|md|java|txt))\\b",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern FENCED_CODE = Pattern.compile("```(?:\\w+)?\\s*\\n?(.*?)```", Pattern.DOTALL);

    private final ToolsProperties properties;

    public CodeSandboxToolProvider(ToolsProperties properties) {
        this.properties = properties;
    }

    @Override
    public List<ToolBinding> getTools() {
        return List.of(
                new ToolBinding(ToolMetadata.builder(OPEN_SANDBOX, ToolCategory.CODE_DEVELOPMENT)
                        .description("Open the coding sandbox workspace in VS Code")
                        .keywords("vscode", "vs code", "sandbox", "editor", "ide")
                        .priority(9)
                        .minConfidence(0.2)
                        .estimatedCost(3.0)
                        .build(), query -> openSandbox()),
                new ToolBinding(ToolMetadata.builder("create_code_file", ToolCategory.CODE_DEVELOPMENT)
                        .description("Create a new code file from a language template in the sandbox")
                        .keywords("create", "new file", "code file", "template", "file")
                        .priority(8)
                        .prerequisites(OPEN_SANDBOX)
                        .conflicts("write_code")
                        .minConfidence(0.25)
                        .estimatedCost(1.0)
                        .build(), this::createCodeFile),
                new ToolBinding(ToolMetadata.builder("write_code", ToolCategory.CODE_DEVELOPMENT)
                        .description("Write a code snippet into a new file in the sandbox")
                        .keywords("write", "code", "program", "function", "script")
                        .priority(9)
                        .prerequisites(OPEN_SANDBOX)
                        .minConfidence(0.25)
                        .estimatedCost(2.0)
                        .build(), this::writeCode)
        );
    }

    String openSandbox() {
        Path workspace = ensureWorkspace();
        String editor = properties.editorCommand();
        if (editor == null || editor.isBlank()) {
            return "Sandbox ready at " + workspace;
        }
        try {
            new ProcessBuilder(editor, workspace.toString()).inheritIO().start();
            log.info("Launched '{}' on {}", editor, workspace);
            return "VS Code sandbox opened. Workspace: " + workspace;
        } catch (IOException e) {
            log.warn("Could not launch editor '{}': {}", editor, e.getMessage());
            return "Sandbox ready at " + workspace + " (editor '" + editor + "' is not available)";
        }
    }

    String createCodeFile(String query) {
        Language language = Language.detect(query);
        String baseName = requestedFileName(query).orElse("main");
        Path file = uniqueFile(stripExtension(baseName), extensionOf(baseName, language));
        write(file, language.template(file.getFileName().toString()));
        return "Created " + file.getFileName() + " in the sandbox (" + language.label + ").";
    }

    String writeCode(String query) {
        Language language = Language.detect(query);
        String code = extractCode(query)
                .orElseGet(() -> language.comment("TODO: " + query.strip()) + "\n");
        String baseName = requestedFileName(query).orElse("snippet");
        Path file = uniqueFile(stripExtension(baseName), extensionOf(baseName, language));
        write(file, code);
        return "Wrote " + code.lines().count() + " lines of " + language.label + " code to " + file.getFileName() + ".";
    }

    private Path ensureWorkspace() {
        Path projects = properties.sandboxPath().resolve(PROJECTS_DIR);
        try {
            Files.createDirectories(projects);
            return properties.sandboxPath();
        } catch (IOException e) {
            throw new ToolExecutionException("Cannot create sandbox at " + properties.sandboxPath(), e);
        }
    }

    private Path uniqueFile(String baseName, String extension) {
        Path projects = ensureWorkspace().resolve(PROJECTS_DIR);
        Path candidate = projects.resolve(baseName + extension);
        for (int i = 1; Files.exists(candidate); i++) {
            candidate = projects.resolve(baseName + "_" + i + extension);
        }
        return candidate;
    }

    private static void write(Path file, String content) {
        try {
            Files.writeString(file, content, StandardCharsets.UTF_8);
            log.info("Wrote sandbox file {}", file);
        } catch (IOException e) {
            throw new ToolExecutionException("Cannot write " + file.getFileName(), e);
        }
    }

    static Optional<String> requestedFileName(String query) {
        Matcher matcher = FILE_NAME.matcher(query == null ? "" : query);
        if (!matcher.find()) {
            return Optional.empty();
        }
        String name = matcher.group(1) != null ? matcher.group(1) : matcher.group(2);
        return Optional.of(name.replaceAll("[^\\w.-]", "_"));
    }

    static Optional<String> extractCode(String query) {
        if (query == null) {
            return Optional.empty();
        }
        Matcher fenced = FENCED_CODE.matcher(query);
        if (fenced.find() && !fenced.group(1).isBlank()) {
            return Optional.of(fenced.group(1).stripTrailing() + "\n");
        }
        int colon = query.indexOf(':');
        if (colon >= 0 && colon < query.length() - 1 && !query.substring(colon + 1).isBlank()) {
            return Optional.of(query.substring(colon + 1).strip() + "\n");
        }
        return Optional.empty();
    }

    private static String stripExtension(String name) {
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    private static String extensionOf(String name, Language language) {
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(dot) : language.extension;
    }

    enum Language {
        PYTHON("Python", ".py", "# "),
        JAVASCRIPT("JavaScript", ".js", "// "),
        JAVA("Java", ".java", "// "),
        HTML("HTML", ".html", null),
        CSS("CSS", ".css", null),
        JSON("JSON", ".json", null),
        MARKDOWN("Markdown", ".md", null),
        TEXT("text", ".txt", null);

        final String label;
        final String extension;
        private final String linePrefix;

        Language(String label, String extension, String linePrefix) {
            this.label = label;
            this.extension = extension;
            this.linePrefix = linePrefix;
        }

        static Language detect(String query) {
            String text = query == null ? "" : query.toLowerCase(Locale.ROOT);
            if (text.contains("javascript") || text.contains("node") || text.matches(".*\\bjs\\b.*")) {
                return JAVASCRIPT;
            }
            if (text.contains("html") || text.contains("web page") || text.contains("webpage")) {
                return HTML;
            }
            if (text.contains("css")) {
                return CSS;
            }
            if (text.contains("json")) {
                return JSON;
            }
            if (text.contains("markdown") || text.matches(".*\\.md\\b.*")) {
                return MARKDOWN;
            }
            if (text.matches(".*\\bjava\\b.*") || text.contains(".java")) {
                return JAVA;
            }
            if (text.contains("text file") || text.contains(".txt")) {
                return TEXT;
            }
            return PYTHON;
        }

        String comment(String text) {
            return switch (this) {
                case HTML, MARKDOWN -> "<!-- " + text + " -->";
                case CSS -> "/* " + text + " */";
                case JSON -> "{ \"todo\": \"" + text.replace("\"", "'") + "\" }";
                default -> (linePrefix == null ? "" : linePrefix) + text;
            };
        }

        String template(String fileName) {
            return switch (this) {
                case PYTHON -> """
                        \"\"\"
                        %s
                        Created by Jarvis
                        \"\"\"


                        def main():
                            print("Hello from Jarvis!")


                        if __name__ == "__main__":
                            main()
                        """.formatted(fileName);
                case JAVASCRIPT -> """
                        /**
                         * %s
                         * Created by Jarvis
                         */

                        function main() {
                            console.log("Hello from Jarvis!");
                        }

                        main();
                        """.formatted(fileName);
                case JAVA -> {
                    String className = fileName.replace(".java", "").replaceAll("\\W", "_");
                    yield """
                            public class %s {

                                public static void main(String[] args) {
                                    System.out.println("Hello from Jarvis!");
                                }
                            }
                            """.formatted(className);
                }
                case HTML -> """
                        <!DOCTYPE html>
                        <html lang="en">
                        <head>
                            <meta charset="UTF-8">
                            <title>%s</title>
                        </head>
                        <body>
                            <h1>Hello from Jarvis!</h1>
                        </body>
                        </html>
                        """.formatted(fileName);
                case CSS -> "/* %s */%n%nbody {%n    font-family: sans-serif;%n}%n".formatted(fileName);
                case JSON -> "{}\n";
                case MARKDOWN -> "# %s%n%nCreated by Jarvis%n".formatted(fileName);
                case TEXT -> "";
            };
        }
    }
}
