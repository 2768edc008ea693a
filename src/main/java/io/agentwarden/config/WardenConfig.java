package io.agentwarden.config;

import java.nio.file.Path;
import java.nio.file.Paths;

/** Data directory layout. Everything the agent persists lives under {@link #rootDir()}. */
public final class WardenConfig {
    public static final String DEFAULT_ROOT = "data";
    public static final String SETTINGS_FILE_NAME = "warden-settings.json";

    private final Path rootDir;

    public WardenConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static WardenConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        return new WardenConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path dbFile() {
        return rootDir.resolve("agentwarden.db");
    }

    public Path activityRoot() {
        return rootDir.resolve("activity");
    }

    public Path activityLogFile() {
        return activityRoot().resolve("activity.log");
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE_NAME);
    }

    public Path defaultWorkspaceRoot() {
        return rootDir.resolve("workspace");
    }

    public Path defaultAgentRoot() {
        return rootDir.resolve("agent");
    }

    /** Workspace root from settings when given, relative values resolved against the data root. */
    public Path workspaceRoot(WardenSettings settings) {
        return resolveOr(settings.workspaceRoot(), defaultWorkspaceRoot());
    }

    public Path agentRoot(WardenSettings settings) {
        return resolveOr(settings.agentRoot(), defaultAgentRoot());
    }

    private Path resolveOr(String raw, Path fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        return rootDir.resolve(raw.trim()).toAbsolutePath().normalize();
    }
}
