package io.agentwarden.runtime;

import io.agentwarden.completion.CompletionClient;
import io.agentwarden.completion.CompletionRequest;
import io.agentwarden.completion.CompletionResponse;
import io.agentwarden.completion.PromptBuilder;
import io.agentwarden.error.ErrorKind;
import io.agentwarden.error.ExternalServiceException;
import io.agentwarden.error.NotClaimedException;
import io.agentwarden.error.SecurityViolationException;
import io.agentwarden.error.WardenException;
import io.agentwarden.governance.SelfUpdateGovernance;
import io.agentwarden.guardrail.GuardrailContext;
import io.agentwarden.guardrail.GuardrailEngine;
import io.agentwarden.guardrail.GuardrailVerdict;
import io.agentwarden.guardrail.SourceScanner;
import io.agentwarden.model.PendingUpdate;
import io.agentwarden.model.TaskError;
import io.agentwarden.model.TaskPayload;
import io.agentwarden.model.TaskView;
import io.agentwarden.observability.ActivityKind;
import io.agentwarden.observability.ActivityLog;
import io.agentwarden.observability.MdcContext;
import io.agentwarden.observability.SensitiveDataMasker;
import io.agentwarden.queue.ClaimedTask;
import io.agentwarden.queue.TaskQueue;
import io.agentwarden.storage.QueueBackend;
import io.agentwarden.util.Hashing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * One pass of the agent loop: claim, pre-check, completion, post-check, lease check, persist or
 * propose, ack or fail. Every branch leaves an activity record. Thread-safe; worker slots share one
 * instance.
 */
public final class AgentOrchestrator implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(AgentOrchestrator.class);
    private static final int EXCERPT_CHARS = 512;

    private final TaskQueue queue;
    private final GuardrailEngine guardrails;
    private final SelfUpdateGovernance governance;
    private final CompletionClient completion;
    private final PromptBuilder prompts;
    private final WorkspaceWriter writer;
    private final ActivityLog activity;
    private final Options options;
    private final ExecutorService completionExecutor;

    public AgentOrchestrator(
            TaskQueue queue,
            GuardrailEngine guardrails,
            SelfUpdateGovernance governance,
            CompletionClient completion,
            PromptBuilder prompts,
            WorkspaceWriter writer,
            ActivityLog activity,
            Options options
    ) {
        this.queue = Objects.requireNonNull(queue, "queue");
        this.guardrails = Objects.requireNonNull(guardrails, "guardrails");
        this.governance = Objects.requireNonNull(governance, "governance");
        this.completion = Objects.requireNonNull(completion, "completion");
        this.prompts = Objects.requireNonNull(prompts, "prompts");
        this.writer = Objects.requireNonNull(writer, "writer");
        this.activity = Objects.requireNonNull(activity, "activity");
        this.options = Objects.requireNonNull(options, "options");
        AtomicInteger threadSeq = new AtomicInteger();
        this.completionExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "completion-" + threadSeq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public WorkerOutcome runOnce(String workerId) {
        Optional<ClaimedTask> maybe = queue.claim(workerId, options.leaseDuration());
        if (maybe.isEmpty()) {
            return WorkerOutcome.idle();
        }
        ClaimedTask claimed = maybe.get();
        TaskView task = claimed.task();
        MdcContext.setTask(workerId, task.taskId(), task.type().wireName());
        try {
            activity.append(ActivityLog.ActivityEvent.of(ActivityKind.TASK_CLAIMED, task.taskId(), workerId, detail(
                    "type", task.type().wireName(),
                    "priority", task.priority(),
                    "attempt_count", task.attemptCount(),
                    "lease_expires_at_ms", claimed.leaseExpiresAtMs())));
            return execute(claimed);
        } finally {
            MdcContext.clearTask();
        }
    }

    private WorkerOutcome execute(ClaimedTask claimed) {
        TaskView task = claimed.task();
        TaskPayload payload = task.payload();
        try {
            queue.markRunning(claimed);

            GuardrailVerdict pre = guardrails.evaluate(GuardrailContext.taskInput(task.type().wireName(), payload));
            if (!pre.allowed()) {
                return securityViolation(claimed, new SecurityViolationException(pre), "pre_check", null);
            }

            String prompt = prompts.build(task.type(), payload);
            CompletionResponse response = completeWithTimeout(
                    new CompletionRequest(task.type(), payload, prompt, options.model()));
            String generated = response.generatedText() == null ? "" : response.generatedText();

            String language = payload.hasTarget() ? SourceScanner.languageForPath(payload.targetPath()) : null;
            if (language == null) {
                language = payload.language();
            }
            GuardrailVerdict post = guardrails.evaluate(
                    GuardrailContext.generatedOutput(generated, language, payload.targetPath()));
            if (!post.allowed()) {
                return securityViolation(claimed, new SecurityViolationException(post), "post_check", generated);
            }

            if (!queue.confirmLease(claimed)) {
                queue.ack(claimed, null);
                return cancelledWhileRunning(claimed, null);
            }
            Map<String, Object> effect = new LinkedHashMap<>();
            String updateId = null;
            if (payload.hasTarget()) {
                Path target = resolveTarget(payload.targetPath());
                if (governance.targetsAgent(target)) {
                    PendingUpdate update = governance.propose(
                            target.toString(), WorkspaceWriter.contentFor(target.toString(), generated), task.taskId());
                    updateId = update.updateId();
                    effect.put("update_id", update.updateId());
                    effect.put("update_status", update.status());
                } else {
                    WorkspaceWriter.Written written = writer.write(target, generated);
                    effect.put("written_path", written.path().toString());
                    effect.put("written_sha256", written.sha256());
                    effect.put("written_bytes", written.bytes());
                }
            }

            if (!queue.ack(claimed, generated)) {
                return cancelledWhileRunning(claimed, updateId);
            }
            effect.put("warnings", post.warnings().size() + pre.warnings().size());
            effect.put("result_sha256", Hashing.sha256Hex(generated));
            activity.append(ActivityLog.ActivityEvent.of(ActivityKind.TASK_COMPLETED, task.taskId(), claimed.workerId(), effect));
            LOG.info("Task {} completed", task.taskId());
            return new WorkerOutcome(true, task.taskId(), WorkerOutcome.Status.COMPLETED, updateId, "Task completed");
        } catch (SecurityViolationException e) {
            return securityViolation(claimed, e, "self_update", null);
        } catch (NotClaimedException e) {
            return leaseLost(claimed, e);
        } catch (WardenException e) {
            return failTask(claimed, TaskError.of(e));
        } catch (IOException e) {
            return failTask(claimed, TaskError.of(ErrorKind.STORAGE_ERROR, "Failed to write result: " + e.getMessage()));
        }
    }

    private WorkerOutcome cancelledWhileRunning(ClaimedTask claimed, String updateId) {
        activity.append(ActivityLog.ActivityEvent.of(ActivityKind.TASK_CANCELLED, claimed.taskId(), claimed.workerId(),
                detail("reason", "cancel requested during execution", "result_discarded", true, "update_id", updateId)));
        LOG.info("Task {} was cancelled while running; result discarded", claimed.taskId());
        return new WorkerOutcome(true, claimed.taskId(), WorkerOutcome.Status.CANCELLED, updateId,
                "Task cancelled; result discarded");
    }

    private Path resolveTarget(String raw) {
        try {
            return writer.resolve(raw);
        } catch (InvalidPathException e) {
            throw new SecurityViolationException("path_containment", "Invalid target path: " + raw);
        }
    }

    private CompletionResponse completeWithTimeout(CompletionRequest request) {
        Future<CompletionResponse> future = completionExecutor.submit(() -> completion.complete(request));
        long timeoutMs = options.completionTimeout().toMillis();
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new ExternalServiceException("Completion timed out after " + timeoutMs + " ms", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ExternalServiceException("Interrupted while waiting for completion", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof WardenException we) {
                throw we;
            }
            throw new ExternalServiceException("Completion call failed: " + cause, cause);
        }
    }

    private WorkerOutcome securityViolation(ClaimedTask claimed, SecurityViolationException violation,
                                            String stage, String generated) {
        String taskId = claimed.taskId();
        Map<String, Object> detail = detail(
                "stage", stage,
                "rule", violation.rule(),
                "message", violation.getMessage());
        detail.put("violations", violation.verdict().violations());
        if (generated != null) {
            detail.put("content_sha256", Hashing.sha256Hex(generated));
            detail.put("content_bytes", generated.getBytes(StandardCharsets.UTF_8).length);
            detail.put("content_excerpt", SensitiveDataMasker.maskInline(excerpt(generated)));
        }
        activity.append(ActivityLog.ActivityEvent.of(ActivityKind.SECURITY_VIOLATION, taskId, claimed.workerId(), detail));
        LOG.warn("Guardrail blocked task {} at {}: {}", taskId, stage, violation.getMessage());
        return failTask(claimed, TaskError.of(violation));
    }

    private WorkerOutcome failTask(ClaimedTask claimed, TaskError error) {
        String taskId = claimed.taskId();
        QueueBackend.FailureResolution resolution;
        try {
            resolution = queue.fail(claimed, error);
        } catch (NotClaimedException e) {
            return leaseLost(claimed, e);
        }
        Map<String, Object> detail = detail(
                "error_kind", error.kind(),
                "message", error.message(),
                "rule", error.rule(),
                "attempt_count", resolution.attemptCount(),
                "next_retry_at_ms", resolution.nextRetryAtMs());
        return switch (resolution.outcome()) {
            case RETRY_SCHEDULED -> {
                activity.append(ActivityLog.ActivityEvent.of(ActivityKind.TASK_RETRY_SCHEDULED, taskId, claimed.workerId(), detail));
                LOG.warn("Task {} failed with {} (attempt {}), retry scheduled", taskId, error.kind(), resolution.attemptCount());
                yield new WorkerOutcome(true, taskId, WorkerOutcome.Status.RETRY_SCHEDULED, null, error.message());
            }
            case CANCELLED -> {
                activity.append(ActivityLog.ActivityEvent.of(ActivityKind.TASK_CANCELLED, taskId, claimed.workerId(), detail));
                yield new WorkerOutcome(true, taskId, WorkerOutcome.Status.CANCELLED, null, "Task cancelled");
            }
            default -> {
                activity.append(ActivityLog.ActivityEvent.of(ActivityKind.TASK_FAILED, taskId, claimed.workerId(), detail));
                LOG.warn("Task {} failed terminally with {}: {}", taskId, error.kind(), error.message());
                WorkerOutcome.Status status = error.kind() == ErrorKind.SECURITY_VIOLATION
                        ? WorkerOutcome.Status.SECURITY_VIOLATION
                        : WorkerOutcome.Status.FAILED;
                yield new WorkerOutcome(true, taskId, status, null, error.message());
            }
        };
    }

    private WorkerOutcome leaseLost(ClaimedTask claimed, NotClaimedException e) {
        activity.append(ActivityLog.ActivityEvent.of(ActivityKind.TASK_FAILED, claimed.taskId(), claimed.workerId(),
                detail("reason", "lease_lost", "message", e.getMessage())));
        LOG.warn("Lost lease on task {}: {}", claimed.taskId(), e.getMessage());
        return new WorkerOutcome(true, claimed.taskId(), WorkerOutcome.Status.LEASE_LOST, null, e.getMessage());
    }

    private static String excerpt(String text) {
        return text.length() <= EXCERPT_CHARS ? text : text.substring(0, EXCERPT_CHARS) + "...";
    }

    private static Map<String, Object> detail(Object... kv) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (int i = 0; i + 1 < kv.length; i += 2) {
            if (kv[i + 1] != null) {
                out.put(kv[i].toString(), kv[i + 1]);
            }
        }
        return out;
    }

    @Override
    public void close() {
        completionExecutor.shutdownNow();
    }

    public record Options(Duration leaseDuration, Duration completionTimeout, String model) {
        public Options {
            Objects.requireNonNull(leaseDuration, "leaseDuration");
            Objects.requireNonNull(completionTimeout, "completionTimeout");
            Objects.requireNonNull(model, "model");
        }
    }

    public record WorkerOutcome(boolean processed, String taskId, Status status, String updateId, String message) {
        public enum Status {
            IDLE,
            COMPLETED,
            CANCELLED,
            RETRY_SCHEDULED,
            FAILED,
            SECURITY_VIOLATION,
            LEASE_LOST
        }

        static WorkerOutcome idle() {
            return new WorkerOutcome(false, null, Status.IDLE, null, "No pending tasks");
        }
    }
}
