package io.agentwarden.guardrail;

import io.agentwarden.model.TaskType;

import java.util.List;

public final class TaskTypeAllowlistRule implements GuardrailRule {
    public static final String NAME = "task_type_allowlist";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<Violation> check(GuardrailContext context) {
        if (context.kind() != GuardrailContext.Kind.TASK_INPUT) {
            return List.of();
        }
        if (TaskType.isKnown(context.declaredType())) {
            return List.of();
        }
        return List.of(Violation.block(NAME, "Task type is not allowed: " + context.declaredType()));
    }
}
