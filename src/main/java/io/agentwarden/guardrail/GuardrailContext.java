package io.agentwarden.guardrail;

import io.agentwarden.model.TaskPayload;

import java.util.ArrayList;
import java.util.List;

/**
 * The thing being judged. Build one with the static factories; rules pull the parts they care
 * about through {@link #texts()}, {@link #paths()} and {@link #code()}.
 */
public record GuardrailContext(
        Kind kind,
        String declaredType,
        TaskPayload payload,
        String content,
        String language,
        String path,
        String command
) {
    public enum Kind {
        TASK_INPUT,
        GENERATED_OUTPUT,
        TARGET_PATH,
        COMMAND
    }

    public static GuardrailContext taskInput(String declaredType, TaskPayload payload) {
        return new GuardrailContext(Kind.TASK_INPUT, declaredType, payload, null,
                payload == null ? null : payload.language(), null, null);
    }

    public static GuardrailContext generatedOutput(String content, String language, String targetPath) {
        return new GuardrailContext(Kind.GENERATED_OUTPUT, null, null, content, language, targetPath, null);
    }

    public static GuardrailContext targetPath(String path) {
        return new GuardrailContext(Kind.TARGET_PATH, null, null, null, null, path, null);
    }

    public static GuardrailContext command(String command) {
        return new GuardrailContext(Kind.COMMAND, null, null, null, null, null, command);
    }

    /** Free text to scan for size and dangerous patterns. */
    public List<String> texts() {
        List<String> out = new ArrayList<>();
        switch (kind) {
            case TASK_INPUT -> {
                if (payload != null) {
                    addIfPresent(out, payload.description());
                    addIfPresent(out, payload.code());
                }
            }
            case GENERATED_OUTPUT -> addIfPresent(out, content);
            case COMMAND -> addIfPresent(out, command);
            case TARGET_PATH -> {
            }
        }
        return out;
    }

    /** Source code to lex structurally. */
    public List<String> code() {
        List<String> out = new ArrayList<>();
        if (kind == Kind.TASK_INPUT && payload != null) {
            addIfPresent(out, payload.code());
        } else if (kind == Kind.GENERATED_OUTPUT) {
            addIfPresent(out, content);
        }
        return out;
    }

    public List<String> paths() {
        List<String> out = new ArrayList<>();
        if (kind == Kind.TASK_INPUT && payload != null) {
            addIfPresent(out, payload.filePath());
            addIfPresent(out, payload.targetPath());
        } else {
            addIfPresent(out, path);
        }
        return out;
    }

    private static void addIfPresent(List<String> out, String value) {
        if (value != null && !value.isBlank()) {
            out.add(value);
        }
    }
}
