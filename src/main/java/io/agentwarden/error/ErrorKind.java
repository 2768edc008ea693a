package io.agentwarden.error;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ErrorKind {
    INVALID_TASK_TYPE("InvalidTaskType", false),
    NOT_CLAIMED("NotClaimed", false),
    SECURITY_VIOLATION("SecurityViolation", false),
    INVALID_TRANSITION("InvalidTransition", false),
    EXTERNAL_SERVICE_ERROR("ExternalServiceError", true),
    STORAGE_ERROR("StorageError", true);

    private final String wireName;
    private final boolean retryable;

    ErrorKind(String wireName, boolean retryable) {
        this.wireName = wireName;
        this.retryable = retryable;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean retryable() {
        return retryable;
    }

    @JsonCreator
    public static ErrorKind fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("error kind must not be blank");
        }
        for (ErrorKind value : values()) {
            if (value.wireName.equalsIgnoreCase(raw) || value.name().equalsIgnoreCase(raw)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown error kind: " + raw);
    }
}
