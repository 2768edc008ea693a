package io.agentwarden.guardrail;

import java.util.List;
import java.util.Map;

/**
 * Imports and calls found in a piece of source code, with import aliases already applied to the
 * call names.
 */
public record SourceStructure(
        List<ImportRef> imports,
        List<CallRef> calls,
        Map<String, String> bindings,
        List<String> problems
) {
    public SourceStructure {
        imports = List.copyOf(imports);
        calls = List.copyOf(calls);
        bindings = Map.copyOf(bindings);
        problems = List.copyOf(problems);
    }

    public record ImportRef(String module, int line) {
    }

    /**
     * @param name     call target as written, e.g. {@code sp.run}
     * @param resolved the same target with its first segment replaced by what it was imported as
     */
    public record CallRef(String name, String resolved, int line) {
    }
}
