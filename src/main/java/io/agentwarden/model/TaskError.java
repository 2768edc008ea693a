package io.agentwarden.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.agentwarden.error.ErrorKind;
import io.agentwarden.error.SecurityViolationException;
import io.agentwarden.error.WardenException;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskError(ErrorKind kind, String message, String rule) {

    public static TaskError of(WardenException e) {
        String rule = e instanceof SecurityViolationException sv ? sv.rule() : null;
        return new TaskError(e.kind(), e.getMessage(), rule);
    }

    public static TaskError of(ErrorKind kind, String message) {
        return new TaskError(kind, message, null);
    }

    public boolean retryable() {
        return kind != null && kind.retryable();
    }
}
