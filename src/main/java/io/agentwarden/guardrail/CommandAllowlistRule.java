package io.agentwarden.guardrail;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Shell commands the agent may run. An entry ending in {@code *} matches by prefix against the
 * whole command line, any other entry must equal the base command name.
 */
public final class CommandAllowlistRule implements GuardrailRule {
    public static final String NAME = "command_allowlist";
    private static final Set<String> DANGEROUS_FLAGS = Set.of("-rf", "-fr", "--delete", "--privileged", "--no-preserve-root");
    private static final Pattern CHAINING = Pattern.compile("[;&|`]|\\$\\(");

    private final List<String> allowlist;

    public CommandAllowlistRule(List<String> allowlist) {
        this.allowlist = List.copyOf(allowlist);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<Violation> check(GuardrailContext context) {
        if (context.kind() != GuardrailContext.Kind.COMMAND) {
            return List.of();
        }
        String command = context.command() == null ? "" : context.command().trim();
        if (command.isEmpty()) {
            return List.of(Violation.block(NAME, "Empty command"));
        }
        List<Violation> out = new ArrayList<>();
        String[] tokens = command.split("\\s+");
        String base = tokens[0];
        int slash = base.lastIndexOf('/');
        if (slash >= 0) {
            base = base.substring(slash + 1);
        }
        if (!isAllowed(base, command)) {
            out.add(Violation.block(NAME, "Command is not allowlisted: " + base));
        }
        for (int i = 1; i < tokens.length; i++) {
            if (DANGEROUS_FLAGS.contains(tokens[i])) {
                out.add(Violation.block(NAME, "Dangerous flag: " + tokens[i]));
            }
        }
        if (CHAINING.matcher(command).find()) {
            out.add(Violation.block(NAME, "Command chaining or substitution is not allowed"));
        }
        return out;
    }

    private boolean isAllowed(String base, String command) {
        for (String pattern : allowlist) {
            if (pattern.endsWith("*")) {
                if (command.startsWith(pattern.substring(0, pattern.length() - 1))) {
                    return true;
                }
            } else if (pattern.equals(base)) {
                return true;
            }
        }
        return false;
    }
}
