package io.agentwarden.cli;

import io.agentwarden.completion.CompletionClient;
import io.agentwarden.completion.HttpCompletionClient;
import io.agentwarden.config.WardenConfig;
import io.agentwarden.config.WardenSettings;
import io.agentwarden.governance.RollbackOutcome;
import io.agentwarden.guardrail.GuardrailVerdict;
import io.agentwarden.model.PendingUpdate;
import io.agentwarden.model.TaskPayload;
import io.agentwarden.model.TaskView;
import io.agentwarden.observability.ActivityLog;
import io.agentwarden.runtime.AgentOrchestrator;
import io.agentwarden.runtime.WardenRuntime;
import io.agentwarden.runtime.WorkerPool;
import io.agentwarden.storage.QueueBackend;
import io.agentwarden.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

@Command(
        name = "agentwarden",
        mixinStandardHelpOptions = true,
        description = "Guarded autonomous coding-task agent",
        subcommands = {
                WardenCommand.InitCommand.class,
                WardenCommand.SubmitCommand.class,
                WardenCommand.TaskCommand.class,
                WardenCommand.TasksCommand.class,
                WardenCommand.StatusCommand.class,
                WardenCommand.CancelCommand.class,
                WardenCommand.WorkerCommand.class,
                WardenCommand.ReapCommand.class,
                WardenCommand.UpdatesCommand.class,
                WardenCommand.UpdateCommand.class,
                WardenCommand.ProposeCommand.class,
                WardenCommand.ApproveCommand.class,
                WardenCommand.RejectCommand.class,
                WardenCommand.ApplyCommand.class,
                WardenCommand.RollbackCommand.class,
                WardenCommand.ChangeLogCommand.class,
                WardenCommand.ActivityTailCommand.class,
                WardenCommand.ActivityVerifyCommand.class,
                WardenCommand.GuardCommand.class
        }
)
public final class WardenCommand implements Runnable {
    static final String API_KEY_ENV = "ANTHROPIC_API_KEY";

    @Option(names = {"--root"}, description = "Data root directory", defaultValue = WardenConfig.DEFAULT_ROOT)
    String root;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | submit | task | tasks | status | cancel | worker | reap | updates | update"
                + " | propose | approve | reject | apply | rollback | change-log | activity-tail | activity-verify | guard");
    }

    WardenRuntime runtime() {
        WardenRuntime runtime = new WardenRuntime(WardenConfig.fromRoot(root));
        runtime.init();
        return runtime;
    }

    static int notFound(String what) {
        System.out.println(Jsons.toCompactJson(Map.of("error", what + " not found")));
        return 1;
    }

    @Command(name = "init", description = "Create the data layout, schema and a default settings file")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        WardenCommand parent;

        @Override
        public Integer call() throws Exception {
            WardenConfig config = WardenConfig.fromRoot(parent.root);
            try (WardenRuntime runtime = new WardenRuntime(config)) {
                runtime.init();
            }
            Path settingsFile = config.settingsFile();
            if (!Files.exists(settingsFile)) {
                Files.writeString(settingsFile, Jsons.toJson(WardenSettings.defaults()), StandardCharsets.UTF_8);
            }
            System.out.println("Initialized AgentWarden at: " + config.rootDir());
            return 0;
        }
    }

    @Command(name = "submit", description = "Submit a coding task")
    static final class SubmitCommand implements Callable<Integer> {
        @ParentCommand
        WardenCommand parent;

        @Option(names = {"--type"}, required = true,
                description = "write_tests|translate_code|debug_error|format_code|generate_docs|refactor_function|general")
        String type;

        @Option(names = {"--description"}, required = true, description = "What the task should do")
        String description;

        @Option(names = {"--priority"}, defaultValue = "normal", description = "Priority: low|normal|high|urgent")
        String priority;

        @Option(names = {"--code"}, description = "Inline source code")
        String code;

        @Option(names = {"--code-file"}, description = "Read the source code from this file")
        Path codeFile;

        @Option(names = {"--language"}, description = "Source language")
        String language;

        @Option(names = {"--target"}, description = "Where the result is written, relative to the workspace")
        String target;

        @Override
        public Integer call() throws Exception {
            String source = code;
            String filePath = null;
            if (codeFile != null) {
                source = Files.readString(codeFile, StandardCharsets.UTF_8);
                filePath = codeFile.toString();
            }
            TaskPayload payload = new TaskPayload(description, source, filePath, target, language);
            try (WardenRuntime runtime = parent.runtime()) {
                String taskId = runtime.submit(type, priority, payload);
                System.out.println(Jsons.toJson(Map.of("task_id", taskId)));
            }
            return 0;
        }
    }

    @Command(name = "task", description = "Show one task")
    static final class TaskCommand implements Callable<Integer> {
        @ParentCommand
        WardenCommand parent;

        @Parameters(index = "0", description = "Task id")
        String taskId;

        @Override
        public Integer call() {
            try (WardenRuntime runtime = parent.runtime()) {
                Optional<TaskView> task = runtime.task(taskId);
                if (task.isEmpty()) {
                    return notFound("task");
                }
                System.out.println(Jsons.toJson(task.get()));
                return 0;
            }
        }
    }

    @Command(name = "tasks", description = "List tasks in submission order")
    static final class TasksCommand implements Callable<Integer> {
        @ParentCommand
        WardenCommand parent;

        @Option(names = {"--status"}, description = "Status filter")
        String status;

        @Option(names = {"--limit"}, defaultValue = "50", description = "Max rows")
        int limit;

        @Override
        public Integer call() {
            try (WardenRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.tasks(status, limit)));
                return 0;
            }
        }
    }

    @Command(name = "status", description = "Task counts, pending approvals and activity log integrity")
    static final class StatusCommand implements Callable<Integer> {
        @ParentCommand
        WardenCommand parent;

        @Override
        public Integer call() {
            try (WardenRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.status()));
                return 0;
            }
        }
    }

    @Command(name = "cancel", description = "Cancel a pending task or request cancellation of a running one")
    static final class CancelCommand implements Callable<Integer> {
        @ParentCommand
        WardenCommand parent;

        @Parameters(index = "0", description = "Task id")
        String taskId;

        @Override
        public Integer call() {
            try (WardenRuntime runtime = parent.runtime()) {
                QueueBackend.CancelOutcome outcome = runtime.cancel(taskId);
                System.out.println(Jsons.toJson(Map.of("task_id", taskId, "outcome", outcome)));
                return outcome == QueueBackend.CancelOutcome.CANCELLED
                        || outcome == QueueBackend.CancelOutcome.CANCEL_REQUESTED ? 0 : 1;
            }
        }
    }

    @Command(name = "worker", description = "Run the agent loop")
    static final class WorkerCommand implements Callable<Integer> {
        @ParentCommand
        WardenCommand parent;

        @Option(names = {"--once"}, defaultValue = "false", description = "Process at most one task and exit")
        boolean once;

        @Option(names = {"--slots"}, description = "Worker slots; defaults to the settings value")
        Integer slots;

        @Option(names = {"--worker-id"}, defaultValue = "worker", description = "Worker identity prefix")
        String workerId;

        @Option(names = {"--api-key"}, description = "Completion service API key (default: $" + API_KEY_ENV + ")")
        String apiKey;

        @Option(names = {"--graceful-timeout-ms"}, defaultValue = "30000", description = "Shutdown wait for running tasks")
        long gracefulTimeoutMs;

        @Override
        public Integer call() throws Exception {
            String key = apiKey != null ? apiKey : System.getenv(API_KEY_ENV);
            if (key == null || key.isBlank()) {
                System.err.println("Missing API key: pass --api-key or set " + API_KEY_ENV);
                return 2;
            }
            try (WardenRuntime runtime = parent.runtime()) {
                WardenSettings settings = runtime.settings();
                CompletionClient client = new HttpCompletionClient(
                        settings.completionBaseUrl(),
                        key,
                        settings.maxOutputTokens(),
                        Duration.ofMillis(settings.completionTimeoutMs())
                );
                try (AgentOrchestrator orchestrator = runtime.orchestrator(client)) {
                    if (once) {
                        runtime.reap();
                        System.out.println(Jsons.toJson(orchestrator.runOnce(workerId)));
                        return 0;
                    }
                    int effectiveSlots = slots == null ? settings.workerSlots() : Math.max(1, slots);
                    WorkerPool pool = runtime.workerPool(orchestrator, effectiveSlots, workerId);
                    Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                        try {
                            pool.stop(Duration.ofMillis(gracefulTimeoutMs));
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                        }
                    }, "agentwarden-shutdown"));
                    pool.start();
                    pool.awaitStop();
                    System.out.println(Jsons.toJson(Map.of("processed", pool.processedCount())));
                }
            }
            return 0;
        }
    }

    @Command(name = "reap", description = "Return tasks with expired leases to the queue")
    static final class ReapCommand implements Callable<Integer> {
        @ParentCommand
        WardenCommand parent;

        @Override
        public Integer call() {
            try (WardenRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.reap()));
                return 0;
            }
        }
    }

    @Command(name = "updates", description = "List self-updates")
    static final class UpdatesCommand implements Callable<Integer> {
        @ParentCommand
        WardenCommand parent;

        @Option(names = {"--status"}, description = "pending_approval|approved|rejected|applied|rolled_back")
        String status;

        @Option(names = {"--limit"}, defaultValue = "50", description = "Max rows")
        int limit;

        @Override
        public Integer call() {
            try (WardenRuntime runtime = parent.runtime()) {
                List<Map<String, Object>> rows = runtime.updates(status, limit).stream()
                        .map(WardenCommand::summary)
                        .toList();
                System.out.println(Jsons.toJson(rows));
                return 0;
            }
        }
    }

    @Command(name = "update", description = "Show one self-update, including the proposed content")
    static final class UpdateCommand implements Callable<Integer> {
        @ParentCommand
        WardenCommand parent;

        @Parameters(index = "0", description = "Update id")
        String updateId;

        @Override
        public Integer call() {
            try (WardenRuntime runtime = parent.runtime()) {
                Optional<PendingUpdate> update = runtime.update(updateId);
                if (update.isEmpty()) {
                    return notFound("update");
                }
                System.out.println(Jsons.toJson(update.get()));
                return 0;
            }
        }
    }

    @Command(name = "propose", description = "Propose a change to one of the agent's own files")
    static final class ProposeCommand implements Callable<Integer> {
        @ParentCommand
        WardenCommand parent;

        @Parameters(index = "0", description = "Target path, relative to the agent root")
        String target;

        @Option(names = {"--file"}, required = true, description = "File holding the new content")
        Path file;

        @Override
        public Integer call() throws Exception {
            String content = Files.readString(file, StandardCharsets.UTF_8);
            try (WardenRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(summary(runtime.propose(target, content, null))));
                return 0;
            }
        }
    }

    @Command(name = "approve", description = "Approve a protected self-update")
    static final class ApproveCommand implements Callable<Integer> {
        @ParentCommand
        WardenCommand parent;

        @Parameters(index = "0", description = "Update id")
        String updateId;

        @Option(names = {"--actor"}, required = true, description = "Who approves")
        String actor;

        @Option(names = {"--reason"}, description = "Decision note")
        String reason;

        @Option(names = {"--no-apply"}, defaultValue = "false", description = "Approve only; apply later")
        boolean noApply;

        @Override
        public Integer call() {
            try (WardenRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(summary(runtime.approve(updateId, actor, reason, !noApply))));
                return 0;
            }
        }
    }

    @Command(name = "reject", description = "Reject a protected self-update")
    static final class RejectCommand implements Callable<Integer> {
        @ParentCommand
        WardenCommand parent;

        @Parameters(index = "0", description = "Update id")
        String updateId;

        @Option(names = {"--actor"}, required = true, description = "Who rejects")
        String actor;

        @Option(names = {"--reason"}, description = "Decision note")
        String reason;

        @Override
        public Integer call() {
            try (WardenRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(summary(runtime.reject(updateId, actor, reason))));
                return 0;
            }
        }
    }

    @Command(name = "apply", description = "Apply an approved self-update")
    static final class ApplyCommand implements Callable<Integer> {
        @ParentCommand
        WardenCommand parent;

        @Parameters(index = "0", description = "Update id")
        String updateId;

        @Override
        public Integer call() {
            try (WardenRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(summary(runtime.apply(updateId))));
                return 0;
            }
        }
    }

    @Command(name = "rollback", description = "Restore the content that existed before an update was applied")
    static final class RollbackCommand implements Callable<Integer> {
        @ParentCommand
        WardenCommand parent;

        @Parameters(index = "0", description = "Update id")
        String updateId;

        @Option(names = {"--actor"}, defaultValue = "operator", description = "Who rolls back")
        String actor;

        @Override
        public Integer call() {
            try (WardenRuntime runtime = parent.runtime()) {
                RollbackOutcome outcome = runtime.rollback(updateId, actor);
                Map<String, Object> out = summary(outcome.update());
                out.put("already_rolled_back", outcome.alreadyRolledBack());
                System.out.println(Jsons.toJson(out));
                return 0;
            }
        }
    }

    @Command(name = "change-log", description = "Governance change log, oldest first")
    static final class ChangeLogCommand implements Callable<Integer> {
        @ParentCommand
        WardenCommand parent;

        @Option(names = {"--update"}, description = "Only entries of this update")
        String updateId;

        @Override
        public Integer call() {
            try (WardenRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.changeLog(updateId)));
                return 0;
            }
        }
    }

    @Command(name = "activity-tail", description = "Last activity records")
    static final class ActivityTailCommand implements Callable<Integer> {
        @ParentCommand
        WardenCommand parent;

        @Option(names = {"--lines"}, defaultValue = "20", description = "Number of records")
        int lines;

        @Override
        public Integer call() {
            try (WardenRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.activityTail(lines)));
                return 0;
            }
        }
    }

    @Command(name = "activity-verify", description = "Check the activity log hash chain")
    static final class ActivityVerifyCommand implements Callable<Integer> {
        @ParentCommand
        WardenCommand parent;

        @Override
        public Integer call() {
            try (WardenRuntime runtime = parent.runtime()) {
                ActivityLog.IntegrityReport report = runtime.verifyActivity();
                System.out.println(Jsons.toJson(report));
                return report.intact() ? 0 : 1;
            }
        }
    }

    @Command(name = "guard", description = "Evaluate guardrails against a command, path or content")
    static final class GuardCommand implements Callable<Integer> {
        @ParentCommand
        WardenCommand parent;

        @Option(names = {"--command"}, description = "Shell command to check")
        String command;

        @Option(names = {"--path"}, description = "Target path to check")
        String path;

        @Option(names = {"--content"}, description = "Content to check")
        String content;

        @Option(names = {"--content-file"}, description = "Read the content from this file")
        Path contentFile;

        @Option(names = {"--language"}, description = "Language of the content")
        String language;

        @Override
        public Integer call() throws Exception {
            String text = contentFile != null ? Files.readString(contentFile, StandardCharsets.UTF_8) : content;
            try (WardenRuntime runtime = parent.runtime()) {
                GuardrailVerdict verdict = runtime.guard(command, path, text, language);
                System.out.println(Jsons.toJson(verdict));
                return verdict.allowed() ? 0 : 1;
            }
        }
    }

    /** Update fields without the proposed content, which can be large. */
    static Map<String, Object> summary(PendingUpdate update) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("update_id", update.updateId());
        out.put("target_path", update.targetPath());
        out.put("status", update.status());
        out.put("protected", update.protectedTarget());
        out.put("backup_ref", update.backupRef());
        out.put("base_sha256", update.baseSha256());
        out.put("proposed_sha256", update.proposedSha256());
        out.put("origin_task_id", update.originTaskId());
        out.put("decided_by", update.decidedBy());
        out.put("reason", update.reason());
        return out;
    }
}
