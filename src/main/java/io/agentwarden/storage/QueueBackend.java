package io.agentwarden.storage;

import io.agentwarden.error.ErrorKind;
import io.agentwarden.model.Priority;
import io.agentwarden.model.TaskError;
import io.agentwarden.model.TaskPayload;
import io.agentwarden.model.TaskStatus;
import io.agentwarden.model.TaskType;
import io.agentwarden.model.TaskView;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable task storage. Every mutating call is atomic on its own; lease-holding calls are fenced
 * by the lease token so a worker that lost its lease cannot overwrite the task.
 */
public interface QueueBackend extends AutoCloseable {

    void init();

    /** Stores a new PENDING task and returns its submission sequence. */
    long insert(NewTask task);

    /**
     * Promotes RETRYING tasks whose retry time has passed, then hands the highest-priority,
     * oldest PENDING task to {@code workerId}.
     */
    Optional<TaskView> claimNext(String workerId, String leaseToken, long nowMs, long leaseExpiresAtMs);

    boolean markRunning(String taskId, String leaseToken, long nowMs);

    /** Read-only lease check taken before a worker acts on a result. */
    LeaseCheck checkLease(String taskId, String leaseToken, long nowMs);

    AckOutcome ack(String taskId, String leaseToken, String result, long nowMs);

    FailureResolution fail(String taskId, String leaseToken, TaskError error, long nowMs, RetryDecision retry);

    /**
     * Returns tasks whose lease expired. Each goes back to PENDING, or to CANCELLED when a cancel
     * was requested, or to FAILED once the expiry used up its last attempt.
     */
    List<ReapedTask> reapExpired(long nowMs, int limit);

    CancelOutcome cancel(String taskId, long nowMs);

    Optional<TaskView> find(String taskId);

    /** Tasks in submission order; a null status lists every task. */
    List<TaskView> list(TaskStatus status, int limit);

    Map<TaskStatus, Long> countByStatus();

    @Override
    default void close() {
    }

    record NewTask(
            String taskId,
            TaskType type,
            Priority priority,
            TaskPayload payload,
            int maxAttempts,
            long createdAtMs
    ) {
    }

    /**
     * Computes the next retry time for a failure that leaves attempts. Called with the attempt
     * count after the increment.
     */
    @FunctionalInterface
    interface RetryDecision {
        long nextRetryAtMs(int attemptCount, long nowMs);
    }

    enum LeaseCheck {
        HELD,
        CANCEL_REQUESTED,
        NOT_HELD
    }

    enum AckOutcome {
        COMPLETED,
        CANCELLED,
        NOT_CLAIMED
    }

    enum FailureOutcome {
        RETRY_SCHEDULED,
        FAILED,
        CANCELLED,
        NOT_CLAIMED
    }

    record FailureResolution(FailureOutcome outcome, int attemptCount, Long nextRetryAtMs) {
        public static FailureResolution notClaimed() {
            return new FailureResolution(FailureOutcome.NOT_CLAIMED, 0, null);
        }

        public static FailureResolution retryScheduled(int attemptCount, long nextRetryAtMs) {
            return new FailureResolution(FailureOutcome.RETRY_SCHEDULED, attemptCount, nextRetryAtMs);
        }

        public static FailureResolution failed(int attemptCount) {
            return new FailureResolution(FailureOutcome.FAILED, attemptCount, null);
        }

        public static FailureResolution cancelled(int attemptCount) {
            return new FailureResolution(FailureOutcome.CANCELLED, attemptCount, null);
        }
    }

    record ReapedTask(String taskId, String previousOwner, TaskStatus newStatus, int attemptCount) {
        public static final String EXHAUSTED_MESSAGE_PREFIX =
                "Lease expired without ack or fail; attempts exhausted after ";

        public static TaskError exhaustedError(int attemptCount) {
            return TaskError.of(ErrorKind.NOT_CLAIMED, EXHAUSTED_MESSAGE_PREFIX + attemptCount);
        }
    }

    enum CancelOutcome {
        CANCELLED,
        CANCEL_REQUESTED,
        NOT_CANCELLABLE,
        NOT_FOUND
    }
}
