package io.agentwarden.governance;

public enum Decision {
    APPROVE,
    REJECT;

    public static Decision fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("decision must not be blank");
        }
        String v = raw.trim().toLowerCase(java.util.Locale.ROOT);
        return switch (v) {
            case "approve", "approved", "yes" -> APPROVE;
            case "reject", "rejected", "no" -> REJECT;
            default -> throw new IllegalArgumentException("Unknown decision: " + raw);
        };
    }
}
