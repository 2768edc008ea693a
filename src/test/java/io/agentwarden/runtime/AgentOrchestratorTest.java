package io.agentwarden.runtime;

import io.agentwarden.MutableClock;
import io.agentwarden.completion.CompletionClient;
import io.agentwarden.completion.CompletionRequest;
import io.agentwarden.completion.CompletionResponse;
import io.agentwarden.completion.PromptBuilder;
import io.agentwarden.config.WardenConfig;
import io.agentwarden.config.WardenSettings;
import io.agentwarden.error.ErrorKind;
import io.agentwarden.error.ExternalServiceException;
import io.agentwarden.model.PendingUpdate;
import io.agentwarden.model.TaskPayload;
import io.agentwarden.model.TaskStatus;
import io.agentwarden.model.TaskType;
import io.agentwarden.model.TaskView;
import io.agentwarden.model.UpdateStatus;
import io.agentwarden.observability.ActivityKind;
import io.agentwarden.observability.ActivityLog;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.stream.Stream;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

final class AgentOrchestratorTest {
    private static final String TESTS = "import unittest\n\n"
            + "class TestAdd(unittest.TestCase):\n"
            + "    def test_add(self):\n"
            + "        self.assertEqual(add(1, 2), 3)\n";

    @Test
    void highPriorityRunsFirstAndBenignResultCompletes() throws Exception {
        Path root = Files.createTempDirectory("agentwarden-test-orch-complete-");
        CompletionClient client = mock(CompletionClient.class);
        when(client.complete(any())).thenReturn(new CompletionResponse(TESTS, "test-model", "end_turn"));
        try (WardenRuntime runtime = newRuntime(root);
             AgentOrchestrator orchestrator = newOrchestrator(runtime, client, Duration.ofSeconds(5))) {
            String low = runtime.submit("general", "low", TaskPayload.describe("summarize the repo"));
            String high = runtime.submit("write_tests", "high", TaskPayload.describe("tests for add")
                    .withCode("def add(a, b):\n    return a + b\n", "python"));

            AgentOrchestrator.WorkerOutcome outcome = orchestrator.runOnce("w1");
            Assertions.assertEquals(high, outcome.taskId());
            Assertions.assertEquals(AgentOrchestrator.WorkerOutcome.Status.COMPLETED, outcome.status());

            TaskView done = runtime.task(high).orElseThrow();
            Assertions.assertEquals(TaskStatus.COMPLETED, done.status());
            Assertions.assertEquals(TESTS, done.result());
            Assertions.assertEquals(TaskStatus.PENDING, runtime.task(low).orElseThrow().status());

            ArgumentCaptor<CompletionRequest> request = ArgumentCaptor.forClass(CompletionRequest.class);
            verify(client).complete(request.capture());
            Assertions.assertEquals(TaskType.WRITE_TESTS, request.getValue().taskType());
            Assertions.assertEquals("test-model", request.getValue().modelIdentifier());
            Assertions.assertTrue(request.getValue().prompt().contains("return a + b"));

            Assertions.assertEquals(List.of("task.submitted", "task.submitted", "task.claimed", "task.completed"),
                    eventKinds(runtime));
            Assertions.assertTrue(runtime.verifyActivity().intact());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void dangerousInputNeverReachesCompletionService() throws Exception {
        Path root = Files.createTempDirectory("agentwarden-test-orch-precheck-");
        CompletionClient client = mock(CompletionClient.class);
        try (WardenRuntime runtime = newRuntime(root);
             AgentOrchestrator orchestrator = newOrchestrator(runtime, client, Duration.ofSeconds(5))) {
            String taskId = runtime.submit("general", "normal", TaskPayload.describe("run rm -rf / please"));

            AgentOrchestrator.WorkerOutcome outcome = orchestrator.runOnce("w1");

            Assertions.assertEquals(AgentOrchestrator.WorkerOutcome.Status.SECURITY_VIOLATION, outcome.status());
            verifyNoInteractions(client);
            TaskView failed = runtime.task(taskId).orElseThrow();
            Assertions.assertEquals(TaskStatus.FAILED, failed.status());
            Assertions.assertEquals(ErrorKind.SECURITY_VIOLATION, failed.error().kind());
            Assertions.assertEquals(1, failed.attemptCount());

            ActivityLog.ActivityRecord violation = runtime.activityTail(10).stream()
                    .filter(r -> r.eventKind().equals(ActivityKind.SECURITY_VIOLATION.wireName()))
                    .findFirst().orElseThrow();
            Assertions.assertEquals("pre_check", violation.detail().path("stage").asText());
            Assertions.assertEquals("dangerous_pattern.shell", violation.detail().path("rule").asText());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void blockedOutputIsNotWritten() throws Exception {
        Path root = Files.createTempDirectory("agentwarden-test-orch-postcheck-");
        CompletionClient client = mock(CompletionClient.class);
        when(client.complete(any())).thenReturn(CompletionResponse.of(
                "```python\nimport subprocess\nsubprocess.run(['ls'])\n```"));
        try (WardenRuntime runtime = newRuntime(root);
             AgentOrchestrator orchestrator = newOrchestrator(runtime, client, Duration.ofSeconds(5))) {
            String taskId = runtime.submit("refactor_function", "normal", TaskPayload.describe("refactor the helper")
                    .withCode("def helper():\n    return 1\n", "python")
                    .withTarget("src/helper.py"));

            AgentOrchestrator.WorkerOutcome outcome = orchestrator.runOnce("w1");

            Assertions.assertEquals(AgentOrchestrator.WorkerOutcome.Status.SECURITY_VIOLATION, outcome.status());
            Assertions.assertEquals(TaskStatus.FAILED, runtime.task(taskId).orElseThrow().status());
            Assertions.assertFalse(Files.exists(root.resolve("workspace/src/helper.py")));

            ActivityLog.ActivityRecord violation = runtime.activityTail(10).stream()
                    .filter(r -> r.eventKind().equals(ActivityKind.SECURITY_VIOLATION.wireName()))
                    .findFirst().orElseThrow();
            Assertions.assertEquals("post_check", violation.detail().path("stage").asText());
            Assertions.assertFalse(violation.detail().path("content_sha256").asText().isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void workspaceTargetReceivesFencedCode() throws Exception {
        Path root = Files.createTempDirectory("agentwarden-test-orch-write-");
        CompletionClient client = mock(CompletionClient.class);
        when(client.complete(any())).thenReturn(CompletionResponse.of("Here are the tests:\n```python\n" + TESTS + "```\n"));
        try (WardenRuntime runtime = newRuntime(root);
             AgentOrchestrator orchestrator = newOrchestrator(runtime, client, Duration.ofSeconds(5))) {
            runtime.submit("write_tests", "normal", TaskPayload.describe("tests for add")
                    .withCode("def add(a, b):\n    return a + b\n", "python")
                    .withTarget("tests/test_add.py"));

            Assertions.assertEquals(AgentOrchestrator.WorkerOutcome.Status.COMPLETED, orchestrator.runOnce("w1").status());
            Assertions.assertEquals(TESTS, Files.readString(root.resolve("workspace/tests/test_add.py")));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void agentTargetGoesThroughGovernance() throws Exception {
        Path root = Files.createTempDirectory("agentwarden-test-orch-selfupdate-");
        CompletionClient client = mock(CompletionClient.class);
        when(client.complete(any())).thenReturn(CompletionResponse.of("Write focused tests for:\n{code}\n"));
        try (WardenRuntime runtime = newRuntime(root);
             AgentOrchestrator orchestrator = newOrchestrator(runtime, client, Duration.ofSeconds(5))) {
            String taskId = runtime.submit("generate_docs", "normal", TaskPayload.describe("improve the test prompt")
                    .withTarget("../agent/prompts/write_tests.txt"));

            AgentOrchestrator.WorkerOutcome outcome = orchestrator.runOnce("w1");

            Assertions.assertEquals(AgentOrchestrator.WorkerOutcome.Status.COMPLETED, outcome.status());
            Assertions.assertNotNull(outcome.updateId());
            PendingUpdate update = runtime.update(outcome.updateId()).orElseThrow();
            Assertions.assertEquals(UpdateStatus.APPLIED, update.status());
            Assertions.assertEquals("prompts/write_tests.txt", update.targetPath());
            Assertions.assertEquals(taskId, update.originTaskId());
            Assertions.assertEquals("Write focused tests for:\n{code}\n",
                    Files.readString(root.resolve("agent/prompts/write_tests.txt")));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void protectedAgentTargetWaitsForApproval() throws Exception {
        Path root = Files.createTempDirectory("agentwarden-test-orch-protected-");
        CompletionClient client = mock(CompletionClient.class);
        when(client.complete(any())).thenReturn(CompletionResponse.of("```python\ndef loop():\n    return 2\n```"));
        try (WardenRuntime runtime = newRuntime(root);
             AgentOrchestrator orchestrator = newOrchestrator(runtime, client, Duration.ofSeconds(5))) {
            runtime.submit("refactor_function", "normal", TaskPayload.describe("tidy the main loop")
                    .withTarget("../agent/core/loop.py"));

            AgentOrchestrator.WorkerOutcome outcome = orchestrator.runOnce("w1");

            Assertions.assertEquals(AgentOrchestrator.WorkerOutcome.Status.COMPLETED, outcome.status());
            PendingUpdate update = runtime.update(outcome.updateId()).orElseThrow();
            Assertions.assertEquals(UpdateStatus.PENDING_APPROVAL, update.status());
            Assertions.assertEquals("def loop():\n    return 2\n", update.proposedContent());
            Assertions.assertFalse(Files.exists(root.resolve("agent/core/loop.py")));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void slowCompletionSchedulesRetry() throws Exception {
        Path root = Files.createTempDirectory("agentwarden-test-orch-timeout-");
        CompletionClient client = mock(CompletionClient.class);
        when(client.complete(any())).thenAnswer(inv -> {
            Thread.sleep(5_000L);
            return CompletionResponse.of("late");
        });
        try (WardenRuntime runtime = newRuntime(root);
             AgentOrchestrator orchestrator = newOrchestrator(runtime, client, Duration.ofMillis(200))) {
            String taskId = runtime.submit("general", "normal", TaskPayload.describe("explain the build"));

            AgentOrchestrator.WorkerOutcome outcome = orchestrator.runOnce("w1");

            Assertions.assertEquals(AgentOrchestrator.WorkerOutcome.Status.RETRY_SCHEDULED, outcome.status());
            TaskView task = runtime.task(taskId).orElseThrow();
            Assertions.assertEquals(TaskStatus.RETRYING, task.status());
            Assertions.assertEquals(1, task.attemptCount());
            Assertions.assertEquals(ErrorKind.EXTERNAL_SERVICE_ERROR, task.error().kind());
            Assertions.assertNotNull(task.nextRetryAtMs());
            Assertions.assertTrue(eventKinds(runtime).contains("task.retry_scheduled"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void failingServiceErrorIsRetried() throws Exception {
        Path root = Files.createTempDirectory("agentwarden-test-orch-error-");
        CompletionClient client = mock(CompletionClient.class);
        when(client.complete(any())).thenThrow(new ExternalServiceException("HTTP 529 overloaded"));
        try (WardenRuntime runtime = newRuntime(root);
             AgentOrchestrator orchestrator = newOrchestrator(runtime, client, Duration.ofSeconds(5))) {
            runtime.submit("general", "normal", TaskPayload.describe("explain the build"));

            AgentOrchestrator.WorkerOutcome outcome = orchestrator.runOnce("w1");

            Assertions.assertEquals(AgentOrchestrator.WorkerOutcome.Status.RETRY_SCHEDULED, outcome.status());
            Assertions.assertTrue(outcome.message().contains("529"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void cancelDuringExecutionDiscardsResult() throws Exception {
        Path root = Files.createTempDirectory("agentwarden-test-orch-cancel-");
        CompletionClient client = mock(CompletionClient.class);
        try (WardenRuntime runtime = newRuntime(root);
             AgentOrchestrator orchestrator = newOrchestrator(runtime, client, Duration.ofSeconds(5))) {
            String taskId = runtime.submit("general", "normal", TaskPayload.describe("explain the build"));
            when(client.complete(any())).thenAnswer(inv -> {
                runtime.cancel(taskId);
                return CompletionResponse.of("a long explanation");
            });

            AgentOrchestrator.WorkerOutcome outcome = orchestrator.runOnce("w1");

            Assertions.assertEquals(AgentOrchestrator.WorkerOutcome.Status.CANCELLED, outcome.status());
            TaskView task = runtime.task(taskId).orElseThrow();
            Assertions.assertEquals(TaskStatus.CANCELLED, task.status());
            Assertions.assertNull(task.result());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void cancelDuringExecutionLeavesWorkspaceTargetUntouched() throws Exception {
        Path root = Files.createTempDirectory("agentwarden-test-orch-cancel-write-");
        CompletionClient client = mock(CompletionClient.class);
        try (WardenRuntime runtime = newRuntime(root);
             AgentOrchestrator orchestrator = newOrchestrator(runtime, client, Duration.ofSeconds(5))) {
            String taskId = runtime.submit("write_tests", "normal", TaskPayload.describe("tests for add")
                    .withCode("def add(a, b):\n    return a + b\n", "python")
                    .withTarget("tests/test_add.py"));
            when(client.complete(any())).thenAnswer(inv -> {
                runtime.cancel(taskId);
                return CompletionResponse.of("```python\n" + TESTS + "```\n");
            });

            AgentOrchestrator.WorkerOutcome outcome = orchestrator.runOnce("w1");

            Assertions.assertEquals(AgentOrchestrator.WorkerOutcome.Status.CANCELLED, outcome.status());
            Assertions.assertEquals(TaskStatus.CANCELLED, runtime.task(taskId).orElseThrow().status());
            Assertions.assertFalse(Files.exists(root.resolve("workspace/tests/test_add.py")));
            Assertions.assertFalse(eventKinds(runtime).contains("task.completed"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void cancelDuringExecutionProposesNoSelfUpdate() throws Exception {
        Path root = Files.createTempDirectory("agentwarden-test-orch-cancel-agent-");
        CompletionClient client = mock(CompletionClient.class);
        try (WardenRuntime runtime = newRuntime(root);
             AgentOrchestrator orchestrator = newOrchestrator(runtime, client, Duration.ofSeconds(5))) {
            String taskId = runtime.submit("generate_docs", "normal", TaskPayload.describe("improve the test prompt")
                    .withTarget("../agent/prompts/write_tests.txt"));
            when(client.complete(any())).thenAnswer(inv -> {
                runtime.cancel(taskId);
                return CompletionResponse.of("Write focused tests for:\n{code}\n");
            });

            AgentOrchestrator.WorkerOutcome outcome = orchestrator.runOnce("w1");

            Assertions.assertEquals(AgentOrchestrator.WorkerOutcome.Status.CANCELLED, outcome.status());
            Assertions.assertNull(outcome.updateId());
            Assertions.assertTrue(runtime.updates(null, 10).isEmpty());
            Assertions.assertFalse(Files.exists(root.resolve("agent/prompts/write_tests.txt")));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void leaseExpiringDuringCompletionWritesNothing() throws Exception {
        Path root = Files.createTempDirectory("agentwarden-test-orch-lease-");
        MutableClock clock = new MutableClock(1_000_000L);
        CompletionClient client = mock(CompletionClient.class);
        when(client.complete(any())).thenAnswer(inv -> {
            clock.advance(Duration.ofSeconds(31));
            return CompletionResponse.of("```python\n" + TESTS + "```\n");
        });
        try (WardenRuntime runtime = newRuntime(root, clock);
             AgentOrchestrator orchestrator = newOrchestrator(runtime, client, Duration.ofSeconds(5))) {
            String taskId = runtime.submit("write_tests", "normal", TaskPayload.describe("tests for add")
                    .withCode("def add(a, b):\n    return a + b\n", "python")
                    .withTarget("tests/test_add.py"));

            AgentOrchestrator.WorkerOutcome outcome = orchestrator.runOnce("w1");

            Assertions.assertEquals(AgentOrchestrator.WorkerOutcome.Status.LEASE_LOST, outcome.status());
            Assertions.assertFalse(Files.exists(root.resolve("workspace/tests/test_add.py")));
            Assertions.assertNull(runtime.task(taskId).orElseThrow().result());

            Assertions.assertEquals(1, runtime.reap().size());
            TaskView requeued = runtime.task(taskId).orElseThrow();
            Assertions.assertEquals(TaskStatus.PENDING, requeued.status());
            Assertions.assertEquals(1, requeued.attemptCount());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void emptyQueueIsIdle() throws Exception {
        Path root = Files.createTempDirectory("agentwarden-test-orch-idle-");
        CompletionClient client = mock(CompletionClient.class);
        try (WardenRuntime runtime = newRuntime(root);
             AgentOrchestrator orchestrator = newOrchestrator(runtime, client, Duration.ofSeconds(5))) {
            AgentOrchestrator.WorkerOutcome outcome = orchestrator.runOnce("w1");

            Assertions.assertFalse(outcome.processed());
            Assertions.assertEquals(AgentOrchestrator.WorkerOutcome.Status.IDLE, outcome.status());
            verifyNoInteractions(client);
        } finally {
            deleteRecursively(root);
        }
    }

    private static List<String> eventKinds(WardenRuntime runtime) {
        return runtime.activityTail(50).stream().map(ActivityLog.ActivityRecord::eventKind).toList();
    }

    private static WardenRuntime newRuntime(Path root) {
        return newRuntime(root, new MutableClock(1_000_000L));
    }

    private static WardenRuntime newRuntime(Path root, MutableClock clock) {
        WardenRuntime runtime = new WardenRuntime(
                WardenConfig.fromRoot(root.toString()), WardenSettings.defaults(), clock);
        runtime.init();
        return runtime;
    }

    private static AgentOrchestrator newOrchestrator(WardenRuntime runtime, CompletionClient client, Duration timeout) {
        WardenConfig config = runtime.config();
        return new AgentOrchestrator(
                runtime.queue(),
                runtime.guardrails(),
                runtime.governance(),
                client,
                new PromptBuilder(config.agentRoot(runtime.settings()).resolve("prompts")),
                new WorkspaceWriter(config.workspaceRoot(runtime.settings())),
                runtime.activity(),
                new AgentOrchestrator.Options(Duration.ofSeconds(30), timeout, "test-model")
        );
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
