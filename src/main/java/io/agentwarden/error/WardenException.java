package io.agentwarden.error;

/**
 * Base of every failure the agent reports to callers. The kind decides whether a task failing
 * with it may be retried.
 */
public class WardenException extends RuntimeException {
    private final ErrorKind kind;

    public WardenException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public WardenException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}
