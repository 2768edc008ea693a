package io.agentwarden.observability;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ActivityKind {
    TASK_SUBMITTED("task.submitted"),
    TASK_CLAIMED("task.claimed"),
    TASK_COMPLETED("task.completed"),
    TASK_FAILED("task.failed"),
    TASK_RETRY_SCHEDULED("task.retry_scheduled"),
    TASK_CANCELLED("task.cancelled"),
    TASK_CANCEL_REQUESTED("task.cancel_requested"),
    SECURITY_VIOLATION("task.security_violation"),
    LEASE_REAPED("lease.reaped"),
    UPDATE_PROPOSED("update.proposed"),
    UPDATE_APPROVED("update.approved"),
    UPDATE_REJECTED("update.rejected"),
    UPDATE_APPLIED("update.applied"),
    UPDATE_APPLY_FAILED("update.apply_failed"),
    UPDATE_ROLLED_BACK("update.rolled_back");

    private final String wireName;

    ActivityKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
