package io.agentwarden.runtime;

import io.agentwarden.completion.CompletionClient;
import io.agentwarden.completion.PromptBuilder;
import io.agentwarden.config.WardenConfig;
import io.agentwarden.config.WardenSettings;
import io.agentwarden.error.StorageException;
import io.agentwarden.governance.Decision;
import io.agentwarden.governance.GovernancePolicy;
import io.agentwarden.governance.RollbackOutcome;
import io.agentwarden.governance.SelfUpdateGovernance;
import io.agentwarden.guardrail.GuardrailContext;
import io.agentwarden.guardrail.GuardrailEngine;
import io.agentwarden.guardrail.GuardrailPolicy;
import io.agentwarden.guardrail.GuardrailVerdict;
import io.agentwarden.model.Backup;
import io.agentwarden.model.ChangeLogEntry;
import io.agentwarden.model.PendingUpdate;
import io.agentwarden.model.Priority;
import io.agentwarden.model.TaskPayload;
import io.agentwarden.model.TaskStatus;
import io.agentwarden.model.TaskView;
import io.agentwarden.model.UpdateStatus;
import io.agentwarden.observability.ActivityKind;
import io.agentwarden.observability.ActivityLog;
import io.agentwarden.queue.RetryPolicy;
import io.agentwarden.queue.TaskQueue;
import io.agentwarden.storage.Database;
import io.agentwarden.storage.QueueBackend;
import io.agentwarden.storage.RedisQueueBackend;
import io.agentwarden.storage.SqliteQueueBackend;
import io.agentwarden.storage.UpdateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Wires configuration, stores and components, and exposes the operator-facing operations used by
 * the CLI. Components get explicit settings at construction; nothing below reads process state.
 */
public final class WardenRuntime implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(WardenRuntime.class);
    private static final String OPERATOR = "operator";

    private final WardenConfig config;
    private final WardenSettings settings;
    private final Clock clock;
    private final Database database;
    private final QueueBackend backend;
    private final TaskQueue queue;
    private final GuardrailEngine guardrails;
    private final UpdateStore updateStore;
    private final ActivityLog activity;
    private final SelfUpdateGovernance governance;
    private final PromptBuilder prompts;
    private final WorkspaceWriter writer;

    public WardenRuntime(WardenConfig config) {
        this(config, WardenSettings.load(config.settingsFile()), Clock.systemUTC());
    }

    public WardenRuntime(WardenConfig config, WardenSettings settings, Clock clock) {
        this(config, settings, clock, null);
    }

    /** {@code backendOverride} replaces the backend chosen by the settings when not null. */
    public WardenRuntime(WardenConfig config, WardenSettings settings, Clock clock, QueueBackend backendOverride) {
        this.config = config;
        this.settings = settings;
        this.clock = clock;
        this.database = new Database(config);
        this.backend = backendOverride != null ? backendOverride : createBackend(settings, database);
        this.queue = new TaskQueue(backend, RetryPolicy.from(settings), clock);
        Path workspaceRoot = config.workspaceRoot(settings);
        Path agentRoot = config.agentRoot(settings);
        this.guardrails = GuardrailEngine.withDefaultRules(new GuardrailPolicy(
                List.of(workspaceRoot, agentRoot),
                settings.maxContentBytes(),
                settings.allowedExtensions(),
                settings.allowedCommands()
        ), clock);
        this.updateStore = new UpdateStore(database);
        this.activity = new ActivityLog(config.activityLogFile(), settings.activitySigningSecret(), clock);
        this.governance = new SelfUpdateGovernance(
                updateStore, guardrails, activity, GovernancePolicy.from(agentRoot, settings), clock);
        this.prompts = new PromptBuilder(agentRoot.resolve("prompts"));
        this.writer = new WorkspaceWriter(workspaceRoot);
    }

    private static QueueBackend createBackend(WardenSettings settings, Database database) {
        if (WardenSettings.BACKEND_REDIS.equals(settings.backend())) {
            return RedisQueueBackend.connect(settings.redisUrl(), settings.redisKeyPrefix());
        }
        return new SqliteQueueBackend(database);
    }

    public void init() {
        database.init();
        backend.init();
        try {
            Files.createDirectories(writer.workspaceRoot());
            Files.createDirectories(governance.policy().agentRoot());
        } catch (IOException e) {
            throw new StorageException("Failed to initialize workspace directories", e);
        }
        LOG.info("Runtime ready: root={}, backend={}", config.rootDir(), settings.backend());
    }

    public WardenConfig config() {
        return config;
    }

    public WardenSettings settings() {
        return settings;
    }

    public TaskQueue queue() {
        return queue;
    }

    public GuardrailEngine guardrails() {
        return guardrails;
    }

    public SelfUpdateGovernance governance() {
        return governance;
    }

    public ActivityLog activity() {
        return activity;
    }

    public String submit(String type, String priorityRaw, TaskPayload payload) {
        Priority priority = Priority.fromString(priorityRaw);
        String taskId = queue.submit(type, priority, payload);
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("type", type);
        detail.put("priority", priority);
        detail.put("has_code", payload.code() != null && !payload.code().isBlank());
        if (payload.targetPath() != null) {
            detail.put("target_path", payload.targetPath());
        }
        activity.append(ActivityLog.ActivityEvent.of(ActivityKind.TASK_SUBMITTED, taskId, OPERATOR, detail));
        return taskId;
    }

    public Optional<TaskView> task(String taskId) {
        return queue.get(taskId);
    }

    public List<TaskView> tasks(String statusRaw, int limit) {
        TaskStatus status = statusRaw == null || statusRaw.isBlank() ? null : TaskStatus.fromString(statusRaw);
        return queue.list(status, limit);
    }

    public QueueBackend.CancelOutcome cancel(String taskId) {
        QueueBackend.CancelOutcome outcome = queue.cancel(taskId);
        if (outcome == QueueBackend.CancelOutcome.CANCELLED) {
            activity.append(ActivityLog.ActivityEvent.of(ActivityKind.TASK_CANCELLED, taskId, OPERATOR, Map.of()));
        } else if (outcome == QueueBackend.CancelOutcome.CANCEL_REQUESTED) {
            activity.append(ActivityLog.ActivityEvent.of(ActivityKind.TASK_CANCEL_REQUESTED, taskId, OPERATOR, Map.of()));
        }
        return outcome;
    }

    public StatusOutcome status() {
        Map<TaskStatus, Long> tasks = new EnumMap<>(TaskStatus.class);
        for (TaskStatus s : TaskStatus.values()) {
            tasks.put(s, 0L);
        }
        tasks.putAll(queue.stats());
        long awaitingApproval = updateStore.list(UpdateStatus.PENDING_APPROVAL, Integer.MAX_VALUE).size();
        ActivityLog.IntegrityReport integrity = activity.verify();
        return new StatusOutcome(settings.backend(), config.rootDir().toString(), tasks, awaitingApproval, integrity.intact());
    }

    public List<QueueBackend.ReapedTask> reap() {
        List<QueueBackend.ReapedTask> reaped = queue.reapExpiredLeases();
        for (QueueBackend.ReapedTask task : reaped) {
            Map<String, Object> detail = new LinkedHashMap<>();
            detail.put("previous_owner", task.previousOwner());
            detail.put("new_status", task.newStatus());
            detail.put("attempt_count", task.attemptCount());
            activity.append(ActivityLog.ActivityEvent.of(ActivityKind.LEASE_REAPED, task.taskId(), "system:reaper", detail));
        }
        return reaped;
    }

    public List<PendingUpdate> updates(String statusRaw, int limit) {
        UpdateStatus status = statusRaw == null || statusRaw.isBlank() ? null : UpdateStatus.fromString(statusRaw);
        return governance.list(status, limit);
    }

    public Optional<PendingUpdate> update(String updateId) {
        return governance.get(updateId);
    }

    public PendingUpdate propose(String targetPath, String content, String originTaskId) {
        return governance.propose(targetPath, content, originTaskId);
    }

    /** Approves and, unless told otherwise, applies right away. */
    public PendingUpdate approve(String updateId, String actor, String reason, boolean applyNow) {
        PendingUpdate approved = governance.decide(updateId, Decision.APPROVE, actor, reason);
        return applyNow ? governance.apply(updateId) : approved;
    }

    public PendingUpdate reject(String updateId, String actor, String reason) {
        return governance.decide(updateId, Decision.REJECT, actor, reason);
    }

    public PendingUpdate apply(String updateId) {
        return governance.apply(updateId);
    }

    public RollbackOutcome rollback(String updateId, String actor) {
        return governance.rollback(updateId, actor);
    }

    public List<ChangeLogEntry> changeLog(String updateId) {
        return governance.changeLog(updateId);
    }

    public Optional<Backup> backup(String backupId) {
        return governance.backup(backupId);
    }

    public List<ActivityLog.ActivityRecord> activityTail(int limit) {
        return activity.tail(limit);
    }

    public ActivityLog.IntegrityReport verifyActivity() {
        return activity.verify();
    }

    /** Evaluates whichever of command, path and content are given, in that order. */
    public GuardrailVerdict guard(String command, String path, String content, String language) {
        if (command != null) {
            return guardrails.evaluate(GuardrailContext.command(command));
        }
        if (content != null) {
            return guardrails.evaluate(GuardrailContext.generatedOutput(content, language, path));
        }
        if (path != null) {
            return guardrails.evaluate(GuardrailContext.targetPath(path));
        }
        throw new IllegalArgumentException("one of command, path or content is required");
    }

    public AgentOrchestrator orchestrator(CompletionClient completion) {
        return new AgentOrchestrator(
                queue,
                guardrails,
                governance,
                completion,
                prompts,
                writer,
                activity,
                new AgentOrchestrator.Options(
                        Duration.ofMillis(settings.leaseTimeoutMs()),
                        Duration.ofMillis(settings.completionTimeoutMs()),
                        settings.model()
                )
        );
    }

    public WorkerPool workerPool(AgentOrchestrator orchestrator, int slots, String workerPrefix) {
        return new WorkerPool(
                orchestrator,
                this::reap,
                slots,
                Duration.ofMillis(settings.pollIntervalMs()),
                Duration.ofMillis(settings.reapIntervalMs()),
                workerPrefix
        );
    }

    @Override
    public void close() {
        backend.close();
    }

    public record StatusOutcome(
            String backend,
            String rootDir,
            Map<TaskStatus, Long> tasks,
            long updatesAwaitingApproval,
            boolean activityLogIntact
    ) {
    }
}
