package io.agentwarden.model;

/** Pre-image of a target taken right before an update overwrote it. Never modified. */
public record Backup(
        String backupId,
        String updateId,
        String targetPath,
        boolean targetExisted,
        byte[] originalContent,
        String originalSha256,
        long takenAtMs
) {
}
