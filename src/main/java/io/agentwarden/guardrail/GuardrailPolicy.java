package io.agentwarden.guardrail;

import java.nio.file.Path;
import java.util.List;

/**
 * Fixed inputs of the default rule set.
 *
 * @param allowedRoots directories a path may resolve into; the first one anchors relative paths
 */
public record GuardrailPolicy(
        List<Path> allowedRoots,
        long maxContentBytes,
        List<String> allowedExtensions,
        List<String> allowedCommands
) {
    public GuardrailPolicy {
        if (allowedRoots == null || allowedRoots.isEmpty()) {
            throw new IllegalArgumentException("at least one allowed root is required");
        }
        allowedRoots = allowedRoots.stream().map(p -> p.toAbsolutePath().normalize()).toList();
        allowedExtensions = List.copyOf(allowedExtensions);
        allowedCommands = List.copyOf(allowedCommands);
    }

    public Path workspaceRoot() {
        return allowedRoots.get(0);
    }
}
