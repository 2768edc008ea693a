package io.agentwarden.model;

public enum TaskStatus {
    PENDING,
    CLAIMED,
    RUNNING,
    COMPLETED,
    FAILED,
    RETRYING,
    CANCELLED;

    public boolean holdsLease() {
        return this == CLAIMED || this == RUNNING;
    }

    public boolean terminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    public static TaskStatus fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("status must not be blank");
        }
        return TaskStatus.valueOf(raw.trim().toUpperCase(java.util.Locale.ROOT));
    }
}
