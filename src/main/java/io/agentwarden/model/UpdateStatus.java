package io.agentwarden.model;

public enum UpdateStatus {
    PENDING_APPROVAL,
    APPROVED,
    REJECTED,
    APPLIED,
    ROLLED_BACK;

    public static UpdateStatus fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("status must not be blank");
        }
        return UpdateStatus.valueOf(raw.trim().toUpperCase(java.util.Locale.ROOT).replace('-', '_'));
    }
}
