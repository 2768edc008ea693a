package io.agentwarden.guardrail;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Runs every registered rule, in registration order, against a context. The verdict lists all
 * findings so an operator sees warnings that accompanied a block.
 */
public final class GuardrailEngine {
    private static final Logger LOG = LoggerFactory.getLogger(GuardrailEngine.class);

    private final List<GuardrailRule> rules;
    private final Clock clock;

    public GuardrailEngine(List<GuardrailRule> rules, Clock clock) {
        this.rules = List.copyOf(rules);
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public static GuardrailEngine withDefaultRules(GuardrailPolicy policy, Clock clock) {
        return new GuardrailEngine(defaultRules(policy), clock);
    }

    public static List<GuardrailRule> defaultRules(GuardrailPolicy policy) {
        return List.of(
                new TaskTypeAllowlistRule(),
                new SizeLimitRule(policy.maxContentBytes()),
                new PathContainmentRule(policy.allowedRoots()),
                new ExtensionAllowlistRule(policy.allowedExtensions()),
                new DangerousPatternRule(),
                new CodeStructureRule(),
                new CommandAllowlistRule(policy.allowedCommands())
        );
    }

    public GuardrailVerdict evaluate(GuardrailContext context) {
        List<Violation> violations = new ArrayList<>();
        for (GuardrailRule rule : rules) {
            violations.addAll(rule.check(context));
        }
        GuardrailVerdict verdict = GuardrailVerdict.of(violations, clock.millis());
        if (!verdict.allowed()) {
            LOG.debug("Guardrail block on {}: {}", context.kind(), verdict.summary());
        }
        return verdict;
    }

    public List<String> ruleNames() {
        return rules.stream().map(GuardrailRule::name).toList();
    }
}
