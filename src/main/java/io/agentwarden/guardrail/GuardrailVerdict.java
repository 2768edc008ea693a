package io.agentwarden.guardrail;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/** Outcome of one evaluation. Allowed unless at least one violation has severity {@code block}. */
public record GuardrailVerdict(boolean allowed, List<Violation> violations, long evaluatedAtMs) {

    public GuardrailVerdict {
        violations = List.copyOf(violations);
    }

    public static GuardrailVerdict of(List<Violation> violations, long evaluatedAtMs) {
        boolean allowed = violations.stream().noneMatch(Violation::blocking);
        return new GuardrailVerdict(allowed, violations, evaluatedAtMs);
    }

    public static GuardrailVerdict blockedBy(String rule, String message) {
        return new GuardrailVerdict(false, List.of(Violation.block(rule, message)), System.currentTimeMillis());
    }

    public Optional<Violation> firstBlocking() {
        return violations.stream().filter(Violation::blocking).findFirst();
    }

    public List<Violation> warnings() {
        return violations.stream().filter(v -> v.severity() == Severity.WARNING).toList();
    }

    public String summary() {
        if (allowed) {
            return violations.isEmpty() ? "allowed" : "allowed with " + violations.size() + " finding(s)";
        }
        return violations.stream()
                .filter(Violation::blocking)
                .map(v -> v.rule() + ": " + v.message())
                .collect(Collectors.joining("; "));
    }
}
