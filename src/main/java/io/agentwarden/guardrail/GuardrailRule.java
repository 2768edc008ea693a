package io.agentwarden.guardrail;

import java.util.List;

/**
 * One check of the policy. Implementations must be pure: the same context always yields the same
 * violations, and nothing outside the rule is touched.
 */
public interface GuardrailRule {

    String name();

    /** Empty when the context passes this rule. */
    List<Violation> check(GuardrailContext context);
}
