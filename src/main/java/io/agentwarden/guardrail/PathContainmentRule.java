package io.agentwarden.guardrail;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Every path must land inside one of the allowed roots after normalisation. Relative paths are
 * anchored at the workspace root, so {@code ../} sequences and absolute paths that escape are
 * both caught here.
 */
public final class PathContainmentRule implements GuardrailRule {
    public static final String NAME = "path_containment";

    private final List<Path> roots;

    public PathContainmentRule(List<Path> roots) {
        this.roots = roots.stream().map(p -> p.toAbsolutePath().normalize()).toList();
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<Violation> check(GuardrailContext context) {
        List<Violation> out = new ArrayList<>();
        for (String raw : context.paths()) {
            Path resolved;
            try {
                resolved = resolve(roots.get(0), raw);
            } catch (InvalidPathException e) {
                out.add(Violation.block(NAME, "Invalid path: " + raw));
                continue;
            }
            if (!isContained(roots, resolved)) {
                out.add(Violation.block(NAME, "Path resolves outside the allowed roots: " + raw));
            }
        }
        return out;
    }

    public static Path resolve(Path anchor, String raw) {
        if (raw.indexOf('\0') >= 0) {
            throw new InvalidPathException(raw, "NUL character");
        }
        Path candidate = Paths.get(raw.trim());
        Path absolute = candidate.isAbsolute() ? candidate : anchor.resolve(candidate);
        return absolute.toAbsolutePath().normalize();
    }

    public static boolean isContained(List<Path> roots, Path resolved) {
        for (Path root : roots) {
            if (resolved.startsWith(root)) {
                return true;
            }
        }
        return false;
    }
}
