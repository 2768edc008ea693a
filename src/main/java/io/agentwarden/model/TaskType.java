package io.agentwarden.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import io.agentwarden.error.InvalidTaskTypeException;

public enum TaskType {
    WRITE_TESTS("write_tests"),
    TRANSLATE_CODE("translate_code"),
    DEBUG_ERROR("debug_error"),
    FORMAT_CODE("format_code"),
    GENERATE_DOCS("generate_docs"),
    REFACTOR_FUNCTION("refactor_function"),
    GENERAL("general");

    private final String wireName;

    TaskType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public static boolean isKnown(String raw) {
        return lookup(raw) != null;
    }

    @JsonCreator
    public static TaskType fromWire(String raw) {
        TaskType type = lookup(raw);
        if (type == null) {
            throw new InvalidTaskTypeException(raw);
        }
        return type;
    }

    private static TaskType lookup(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String value = raw.trim();
        for (TaskType type : values()) {
            if (type.wireName.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        return null;
    }
}
