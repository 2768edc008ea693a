package io.agentwarden.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.agentwarden.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Tunables read from {@code warden-settings.json}. Missing or out-of-range values fall back to
 * the defaults below; the file never has to list every key.
 */
public record WardenSettings(
        long leaseTimeoutMs,
        int maxAttempts,
        long baseBackoffMs,
        long maxBackoffMs,
        int workerSlots,
        long pollIntervalMs,
        long reapIntervalMs,
        long completionTimeoutMs,
        String model,
        int maxOutputTokens,
        String completionBaseUrl,
        long maxContentBytes,
        List<String> allowedExtensions,
        List<String> protectedPaths,
        List<String> allowedCommands,
        String backend,
        String redisUrl,
        String redisKeyPrefix,
        String workspaceRoot,
        String agentRoot,
        String activitySigningSecret
) {
    private static final Logger LOG = LoggerFactory.getLogger(WardenSettings.class);

    public static final long DEFAULT_LEASE_TIMEOUT_MS = 120_000L;
    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final long DEFAULT_BASE_BACKOFF_MS = 1_000L;
    public static final long DEFAULT_MAX_BACKOFF_MS = 60_000L;
    public static final int DEFAULT_WORKER_SLOTS = 3;
    public static final long DEFAULT_POLL_INTERVAL_MS = 5_000L;
    public static final long DEFAULT_REAP_INTERVAL_MS = 5_000L;
    public static final long DEFAULT_COMPLETION_TIMEOUT_MS = 60_000L;
    public static final String DEFAULT_MODEL = "claude-3-haiku-20240307";
    public static final int DEFAULT_MAX_OUTPUT_TOKENS = 4_096;
    public static final String DEFAULT_COMPLETION_BASE_URL = "https://api.anthropic.com";
    public static final long DEFAULT_MAX_CONTENT_BYTES = 10L * 1024L * 1024L;
    public static final List<String> DEFAULT_ALLOWED_EXTENSIONS = List.of(
            ".py", ".js", ".ts", ".java", ".kt", ".go", ".rs", ".c", ".h", ".cpp", ".hpp",
            ".rb", ".md", ".txt", ".json", ".yaml", ".yml", ".toml", ".html", ".css"
    );
    public static final List<String> DEFAULT_PROTECTED_PATHS = List.of(
            "core/**", "governance/**", "guardrails/**", "config/guardrails.json", "*.jar"
    );
    public static final List<String> DEFAULT_ALLOWED_COMMANDS = List.of(
            "python", "python3", "node", "npm", "yarn", "pip", "pip3", "git",
            "ls", "cat", "echo", "grep", "find", "wc", "sort"
    );
    public static final String BACKEND_SQLITE = "sqlite";
    public static final String BACKEND_REDIS = "redis";

    public WardenSettings {
        allowedExtensions = List.copyOf(allowedExtensions);
        protectedPaths = List.copyOf(protectedPaths);
        allowedCommands = List.copyOf(allowedCommands);
    }

    public static WardenSettings defaults() {
        return new WardenSettings(
                DEFAULT_LEASE_TIMEOUT_MS,
                DEFAULT_MAX_ATTEMPTS,
                DEFAULT_BASE_BACKOFF_MS,
                DEFAULT_MAX_BACKOFF_MS,
                DEFAULT_WORKER_SLOTS,
                DEFAULT_POLL_INTERVAL_MS,
                DEFAULT_REAP_INTERVAL_MS,
                DEFAULT_COMPLETION_TIMEOUT_MS,
                DEFAULT_MODEL,
                DEFAULT_MAX_OUTPUT_TOKENS,
                DEFAULT_COMPLETION_BASE_URL,
                DEFAULT_MAX_CONTENT_BYTES,
                DEFAULT_ALLOWED_EXTENSIONS,
                DEFAULT_PROTECTED_PATHS,
                DEFAULT_ALLOWED_COMMANDS,
                BACKEND_SQLITE,
                "redis://localhost:6379",
                "warden",
                null,
                null,
                ""
        );
    }

    public static WardenSettings load(Path settingsFile) {
        WardenSettings defaults = defaults();
        if (settingsFile == null || !Files.exists(settingsFile)) {
            return defaults;
        }
        try {
            SettingsFile file = Jsons.mapper().readValue(settingsFile.toFile(), SettingsFile.class);
            return fromFile(file, defaults);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read settings file: " + settingsFile, e);
        }
    }

    static WardenSettings fromFile(SettingsFile file, WardenSettings defaults) {
        if (file == null) {
            return defaults;
        }
        long baseBackoff = sanitizeLong(file.baseBackoffMs(), defaults.baseBackoffMs(), 1L);
        long maxBackoff = sanitizeLong(file.maxBackoffMs(), defaults.maxBackoffMs(), baseBackoff);
        String backend = sanitizeString(file.backend(), defaults.backend()).toLowerCase(Locale.ROOT);
        if (!BACKEND_SQLITE.equals(backend) && !BACKEND_REDIS.equals(backend)) {
            LOG.warn("Unknown queue backend '{}' in settings, using {}", backend, defaults.backend());
            backend = defaults.backend();
        }
        long leaseTimeout = sanitizeLong(file.leaseTimeoutMs(), defaults.leaseTimeoutMs(), 1_000L);
        long completionTimeout = sanitizeLong(file.completionTimeoutMs(), defaults.completionTimeoutMs(), 1_000L);
        long completionCeiling = completionCeiling(leaseTimeout);
        if (completionTimeout > completionCeiling) {
            LOG.warn("completionTimeoutMs {} does not fit inside leaseTimeoutMs {}, using {}",
                    completionTimeout, leaseTimeout, completionCeiling);
            completionTimeout = completionCeiling;
        }
        return new WardenSettings(
                leaseTimeout,
                sanitizeInt(file.maxAttempts(), defaults.maxAttempts(), 1),
                baseBackoff,
                maxBackoff,
                sanitizeInt(file.workerSlots(), defaults.workerSlots(), 1),
                sanitizeLong(file.pollIntervalMs(), defaults.pollIntervalMs(), 10L),
                sanitizeLong(file.reapIntervalMs(), defaults.reapIntervalMs(), 100L),
                completionTimeout,
                sanitizeString(file.model(), defaults.model()),
                sanitizeInt(file.maxOutputTokens(), defaults.maxOutputTokens(), 1),
                sanitizeString(file.completionBaseUrl(), defaults.completionBaseUrl()),
                sanitizeLong(file.maxContentBytes(), defaults.maxContentBytes(), 1L),
                sanitizeExtensions(file.allowedExtensions(), defaults.allowedExtensions()),
                withBuiltInProtection(sanitizeList(file.protectedPaths(), defaults.protectedPaths())),
                sanitizeList(file.allowedCommands(), defaults.allowedCommands()),
                backend,
                sanitizeString(file.redisUrl(), defaults.redisUrl()),
                sanitizeString(file.redisKeyPrefix(), defaults.redisKeyPrefix()),
                sanitizeString(file.workspaceRoot(), defaults.workspaceRoot()),
                sanitizeString(file.agentRoot(), defaults.agentRoot()),
                file.activitySigningSecret() == null ? defaults.activitySigningSecret() : file.activitySigningSecret().trim()
        );
    }

    /** Leaves room inside the lease for the checks and the write that follow a completion. */
    static long completionCeiling(long leaseTimeoutMs) {
        return leaseTimeoutMs - Math.max(1L, Math.min(5_000L, leaseTimeoutMs / 4));
    }

    private static List<String> withBuiltInProtection(List<String> configured) {
        Set<String> merged = new LinkedHashSet<>(DEFAULT_PROTECTED_PATHS);
        merged.addAll(configured);
        return new ArrayList<>(merged);
    }

    private static int sanitizeInt(Integer raw, int fallback, int min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static long sanitizeLong(Long raw, long fallback, long min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static String sanitizeString(String raw, String fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        return raw.trim();
    }

    private static List<String> sanitizeList(List<String> raw, List<String> fallback) {
        if (raw == null) {
            return fallback;
        }
        List<String> out = new ArrayList<>();
        for (String value : raw) {
            if (value != null && !value.isBlank()) {
                out.add(value.trim());
            }
        }
        return out;
    }

    private static List<String> sanitizeExtensions(List<String> raw, List<String> fallback) {
        List<String> cleaned = sanitizeList(raw, fallback);
        List<String> out = new ArrayList<>(cleaned.size());
        for (String ext : cleaned) {
            String lower = ext.toLowerCase(Locale.ROOT);
            out.add(lower.startsWith(".") ? lower : "." + lower);
        }
        return out;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SettingsFile(
            Long leaseTimeoutMs,
            Integer maxAttempts,
            Long baseBackoffMs,
            Long maxBackoffMs,
            Integer workerSlots,
            Long pollIntervalMs,
            Long reapIntervalMs,
            Long completionTimeoutMs,
            String model,
            Integer maxOutputTokens,
            String completionBaseUrl,
            Long maxContentBytes,
            List<String> allowedExtensions,
            List<String> protectedPaths,
            List<String> allowedCommands,
            String backend,
            String redisUrl,
            String redisKeyPrefix,
            String workspaceRoot,
            String agentRoot,
            String activitySigningSecret
    ) {
    }
}
