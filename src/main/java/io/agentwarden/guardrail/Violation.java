package io.agentwarden.guardrail;

public record Violation(String rule, Severity severity, String message) {

    public static Violation block(String rule, String message) {
        return new Violation(rule, Severity.BLOCK, message);
    }

    public static Violation warning(String rule, String message) {
        return new Violation(rule, Severity.WARNING, message);
    }

    public static Violation info(String rule, String message) {
        return new Violation(rule, Severity.INFO, message);
    }

    public boolean blocking() {
        return severity == Severity.BLOCK;
    }
}
