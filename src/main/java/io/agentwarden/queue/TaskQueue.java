package io.agentwarden.queue;

import io.agentwarden.error.NotClaimedException;
import io.agentwarden.model.Priority;
import io.agentwarden.model.TaskError;
import io.agentwarden.model.TaskPayload;
import io.agentwarden.model.TaskStatus;
import io.agentwarden.model.TaskType;
import io.agentwarden.model.TaskView;
import io.agentwarden.storage.QueueBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Task lifecycle on top of a {@link QueueBackend}. The queue decides ids, lease tokens, times and
 * retry delays; the backend applies each transition atomically.
 */
public final class TaskQueue {
    private static final Logger LOG = LoggerFactory.getLogger(TaskQueue.class);
    public static final int DEFAULT_REAP_LIMIT = 256;

    private final QueueBackend backend;
    private final RetryPolicy retryPolicy;
    private final Clock clock;

    public TaskQueue(QueueBackend backend, RetryPolicy retryPolicy, Clock clock) {
        this.backend = Objects.requireNonNull(backend, "backend");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public String submit(String type, Priority priority, TaskPayload payload) {
        return submit(type, priority, payload, retryPolicy.maxAttempts());
    }

    public String submit(String type, Priority priority, TaskPayload payload, int maxAttempts) {
        TaskType taskType = TaskType.fromWire(type);
        if (payload == null || payload.description() == null || payload.description().isBlank()) {
            throw new IllegalArgumentException("task description must not be blank");
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        String taskId = "tsk_" + UUID.randomUUID();
        long seq = backend.insert(new QueueBackend.NewTask(
                taskId,
                taskType,
                priority == null ? Priority.NORMAL : priority,
                payload,
                maxAttempts,
                clock.millis()
        ));
        LOG.debug("Submitted task {} type={} seq={}", taskId, taskType.wireName(), seq);
        return taskId;
    }

    public Optional<ClaimedTask> claim(String workerId, Duration leaseDuration) {
        if (workerId == null || workerId.isBlank()) {
            throw new IllegalArgumentException("workerId must not be blank");
        }
        if (leaseDuration == null || leaseDuration.isNegative() || leaseDuration.isZero()) {
            throw new IllegalArgumentException("leaseDuration must be positive");
        }
        long now = clock.millis();
        long expiresAt = now + leaseDuration.toMillis();
        String leaseToken = "lease_" + UUID.randomUUID();
        return backend.claimNext(workerId, leaseToken, now, expiresAt)
                .map(task -> new ClaimedTask(task, workerId, leaseToken, expiresAt));
    }

    public void markRunning(ClaimedTask claimed) {
        if (!backend.markRunning(claimed.taskId(), claimed.leaseToken(), clock.millis())) {
            throw new NotClaimedException(claimed.taskId(), "lease is not active in CLAIMED state");
        }
    }

    /**
     * Confirms the lease right before the holder acts on a result. Returns false when a cancel was
     * requested meanwhile.
     *
     * @throws NotClaimedException when the lease expired or passed to another worker
     */
    public boolean confirmLease(ClaimedTask claimed) {
        QueueBackend.LeaseCheck check = backend.checkLease(claimed.taskId(), claimed.leaseToken(), clock.millis());
        if (check == QueueBackend.LeaseCheck.NOT_HELD) {
            throw new NotClaimedException(claimed.taskId(), "lease no longer held");
        }
        return check == QueueBackend.LeaseCheck.HELD;
    }

    /**
     * Completes the task. Returns false when the task had been cancelled meanwhile and the result
     * was discarded.
     */
    public boolean ack(ClaimedTask claimed, String result) {
        QueueBackend.AckOutcome outcome = backend.ack(claimed.taskId(), claimed.leaseToken(), result, clock.millis());
        if (outcome == QueueBackend.AckOutcome.NOT_CLAIMED) {
            throw new NotClaimedException(claimed.taskId(), "ack rejected");
        }
        return outcome == QueueBackend.AckOutcome.COMPLETED;
    }

    public QueueBackend.FailureResolution fail(ClaimedTask claimed, TaskError error) {
        Objects.requireNonNull(error, "error");
        QueueBackend.FailureResolution resolution = backend.fail(
                claimed.taskId(),
                claimed.leaseToken(),
                error,
                clock.millis(),
                (attempt, nowMs) -> nowMs + retryPolicy.backoffMs(attempt)
        );
        if (resolution.outcome() == QueueBackend.FailureOutcome.NOT_CLAIMED) {
            throw new NotClaimedException(claimed.taskId(), "fail rejected");
        }
        return resolution;
    }

    public List<QueueBackend.ReapedTask> reapExpiredLeases() {
        List<QueueBackend.ReapedTask> reaped = backend.reapExpired(clock.millis(), DEFAULT_REAP_LIMIT);
        for (QueueBackend.ReapedTask task : reaped) {
            LOG.info("Reaped expired lease task={} owner={} -> {} attempt={}",
                    task.taskId(), task.previousOwner(), task.newStatus(), task.attemptCount());
        }
        return reaped;
    }

    public QueueBackend.CancelOutcome cancel(String taskId) {
        return backend.cancel(taskId, clock.millis());
    }

    public Optional<TaskView> get(String taskId) {
        return backend.find(taskId);
    }

    public List<TaskView> list(TaskStatus status, int limit) {
        return backend.list(status, limit);
    }

    public Map<TaskStatus, Long> stats() {
        return backend.countByStatus();
    }
}
