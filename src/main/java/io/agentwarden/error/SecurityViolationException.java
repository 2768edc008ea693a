package io.agentwarden.error;

import io.agentwarden.guardrail.GuardrailVerdict;
import io.agentwarden.guardrail.Violation;

public final class SecurityViolationException extends WardenException {
    private final GuardrailVerdict verdict;

    public SecurityViolationException(GuardrailVerdict verdict) {
        super(ErrorKind.SECURITY_VIOLATION, verdict.summary());
        this.verdict = verdict;
    }

    public SecurityViolationException(String rule, String message) {
        this(GuardrailVerdict.blockedBy(rule, message));
    }

    public GuardrailVerdict verdict() {
        return verdict;
    }

    /** Name of the first blocking rule. */
    public String rule() {
        return verdict.firstBlocking().map(Violation::rule).orElse(null);
    }
}
