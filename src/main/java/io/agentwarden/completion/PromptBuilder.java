package io.agentwarden.completion;

import io.agentwarden.model.TaskPayload;
import io.agentwarden.model.TaskType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a task into the prompt sent to the completion service. Each task type has a built-in
 * template; a file {@code <templatesDir>/<type>.txt} replaces it, which is how approved
 * self-updates change the agent's prompting. Placeholders: {@code {description}}, {@code {code}},
 * {@code {language}}, {@code {file_path}}, {@code {target_path}}.
 */
public final class PromptBuilder {
    private static final Logger LOG = LoggerFactory.getLogger(PromptBuilder.class);

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{(description|code|language|file_path|target_path)}");

    private final Path templatesDir;

    public PromptBuilder(Path templatesDir) {
        this.templatesDir = templatesDir;
    }

    public String build(TaskType type, TaskPayload payload) {
        String template = overrideFor(type);
        if (template == null) {
            template = builtIn(type);
        }
        Map<String, String> values = Map.of(
                "description", orEmpty(payload.description()),
                "code", orEmpty(payload.code()),
                "language", payload.language() == null ? "the same language" : payload.language(),
                "file_path", orEmpty(payload.filePath()),
                "target_path", orEmpty(payload.targetPath())
        );
        Matcher m = PLACEHOLDER.matcher(template);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            m.appendReplacement(sb, Matcher.quoteReplacement(values.get(m.group(1))));
        }
        m.appendTail(sb);
        String prompt = sb.toString();
        return prompt.strip();
    }

    static String builtIn(TaskType type) {
        return switch (type) {
            case WRITE_TESTS -> """
                    Write thorough unit tests for the following code. Cover normal cases, edge cases and
                    error handling. Return only the test code.

                    Task: {description}

                    {code}
                    """;
            case TRANSLATE_CODE -> """
                    Translate the following code to {language}. Keep the behaviour identical and use the
                    idioms of the target language. Return only the translated code.

                    Task: {description}

                    {code}
                    """;
            case DEBUG_ERROR -> """
                    Find and fix the bug described below. Explain the root cause in one short paragraph,
                    then give the corrected code.

                    Problem: {description}

                    {code}
                    """;
            case FORMAT_CODE -> """
                    Reformat the following code according to the usual style conventions of its language
                    without changing behaviour. Return only the formatted code.

                    {code}
                    """;
            case GENERATE_DOCS -> """
                    Write clear documentation for the following code: purpose, parameters, return values
                    and a short usage example.

                    Task: {description}

                    {code}
                    """;
            case REFACTOR_FUNCTION -> """
                    Refactor the following code for readability and maintainability while keeping its
                    behaviour. Return the refactored code followed by a short list of the changes.

                    Task: {description}

                    {code}
                    """;
            case GENERAL -> """
                    {description}

                    {code}
                    """;
        };
    }

    private String overrideFor(TaskType type) {
        if (templatesDir == null) {
            return null;
        }
        Path file = templatesDir.resolve(type.wireName() + ".txt");
        if (!Files.isRegularFile(file)) {
            return null;
        }
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            LOG.warn("Ignoring unreadable prompt template {}: {}", file, e.getMessage());
            return null;
        }
    }

    private static String orEmpty(String value) {
        return value == null ? "" : value;
    }
}
