package io.agentwarden.model;

public record TaskView(
        String taskId,
        long seq,
        TaskType type,
        Priority priority,
        TaskPayload payload,
        TaskStatus status,
        int attemptCount,
        int maxAttempts,
        long createdAtMs,
        Long claimedAtMs,
        Long completedAtMs,
        String leaseOwner,
        Long leaseExpiresAtMs,
        Long nextRetryAtMs,
        boolean cancelRequested,
        String result,
        TaskError error
) {
}
