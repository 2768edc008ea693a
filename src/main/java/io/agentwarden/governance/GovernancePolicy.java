package io.agentwarden.governance;

import io.agentwarden.config.WardenSettings;

import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.Paths;
import java.util.List;

/**
 * Where the agent's own files live and which of them need a human decision before they change.
 * Protected entries are glob patterns relative to the agent root.
 */
public final class GovernancePolicy {
    private final Path agentRoot;
    private final List<String> protectedGlobs;
    private final List<PathMatcher> matchers;
    private final List<PathMatcher> fileNameMatchers;

    public GovernancePolicy(Path agentRoot, List<String> protectedGlobs) {
        this.agentRoot = agentRoot.toAbsolutePath().normalize();
        this.protectedGlobs = List.copyOf(protectedGlobs);
        this.matchers = this.protectedGlobs.stream()
                .map(glob -> FileSystems.getDefault().getPathMatcher("glob:" + glob))
                .toList();
        // patterns without a directory part apply at any depth
        this.fileNameMatchers = this.protectedGlobs.stream()
                .filter(glob -> !glob.contains("/"))
                .map(glob -> FileSystems.getDefault().getPathMatcher("glob:" + glob))
                .toList();
    }

    public static GovernancePolicy from(Path agentRoot, WardenSettings settings) {
        return new GovernancePolicy(agentRoot, settings.protectedPaths());
    }

    public Path agentRoot() {
        return agentRoot;
    }

    public List<String> protectedGlobs() {
        return protectedGlobs;
    }

    public boolean isProtected(String relativePath) {
        Path path = Paths.get(relativePath);
        for (PathMatcher matcher : matchers) {
            if (matcher.matches(path)) {
                return true;
            }
        }
        Path fileName = path.getFileName();
        if (fileName == null) {
            return false;
        }
        for (PathMatcher matcher : fileNameMatchers) {
            if (matcher.matches(fileName)) {
                return true;
            }
        }
        return false;
    }

    public boolean isAgentPath(Path resolved) {
        return resolved.toAbsolutePath().normalize().startsWith(agentRoot);
    }
}
