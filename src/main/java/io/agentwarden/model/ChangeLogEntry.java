package io.agentwarden.model;

public record ChangeLogEntry(
        long seq,
        String updateId,
        long atMs,
        String actor,
        String action,
        UpdateStatus fromStatus,
        UpdateStatus toStatus,
        String beforeRef,
        String afterRef
) {
    public static ChangeLogEntry of(
            String updateId,
            long atMs,
            String actor,
            String action,
            UpdateStatus fromStatus,
            UpdateStatus toStatus,
            String beforeRef,
            String afterRef
    ) {
        return new ChangeLogEntry(0L, updateId, atMs, actor, action, fromStatus, toStatus, beforeRef, afterRef);
    }
}
