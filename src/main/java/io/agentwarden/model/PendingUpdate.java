package io.agentwarden.model;

/**
 * A proposed change to one of the agent's own files.
 *
 * @param targetPath relative to the agent root, '/'-separated
 * @param baseSha256 hash of the target when the update was proposed, null if it did not exist
 */
public record PendingUpdate(
        String updateId,
        String targetPath,
        String proposedContent,
        String proposedSha256,
        String baseSha256,
        String originTaskId,
        boolean protectedTarget,
        UpdateStatus status,
        String backupRef,
        String reason,
        long createdAtMs,
        Long decidedAtMs,
        String decidedBy,
        Long appliedAtMs,
        Long rolledBackAtMs
) {
}
