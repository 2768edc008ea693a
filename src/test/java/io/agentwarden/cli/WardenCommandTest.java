package io.agentwarden.cli;

import com.fasterxml.jackson.databind.JsonNode;
import io.agentwarden.Main;
import io.agentwarden.config.WardenConfig;
import io.agentwarden.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

final class WardenCommandTest {

    @Test
    void taskLifecycleThroughTheCli() throws Exception {
        Path root = Files.createTempDirectory("agentwarden-test-cli-tasks-");
        try {
            Assertions.assertEquals(0, run(root, "init").exitCode());
            Assertions.assertTrue(Files.exists(root.resolve(WardenConfig.SETTINGS_FILE_NAME)));

            Result submitted = run(root, "submit", "--type", "write_tests", "--description", "tests for add",
                    "--priority", "high", "--code", "def add(a, b):\n    return a + b\n", "--language", "python");
            Assertions.assertEquals(0, submitted.exitCode());
            String taskId = submitted.json().path("task_id").asText();
            Assertions.assertTrue(taskId.startsWith("tsk_"), taskId);

            JsonNode task = run(root, "task", taskId).json();
            Assertions.assertEquals("PENDING", task.path("status").asText());
            Assertions.assertEquals(1, run(root, "tasks").json().size());

            JsonNode status = run(root, "status").json();
            Assertions.assertTrue(status.path("activityLogIntact").asBoolean());
            Assertions.assertEquals(0, status.path("updatesAwaitingApproval").asInt());

            Result cancelled = run(root, "cancel", taskId);
            Assertions.assertEquals(0, cancelled.exitCode());
            Assertions.assertEquals("CANCELLED", cancelled.json().path("outcome").asText());

            Assertions.assertEquals(1, run(root, "task", "tsk_missing").exitCode());
            Assertions.assertEquals(0, run(root, "activity-verify").exitCode());
            Assertions.assertEquals(2, run(root, "activity-tail", "--lines", "5").json().size());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void domainErrorsAreReportedAsJsonOnStderr() throws Exception {
        Path root = Files.createTempDirectory("agentwarden-test-cli-errors-");
        try {
            Result result = run(root, "submit", "--type", "deploy_prod", "--description", "ship it");

            Assertions.assertEquals(1, result.exitCode());
            Assertions.assertTrue(result.stdout().isBlank());
            JsonNode error = Jsons.mapper().readTree(result.stderr());
            Assertions.assertEquals("InvalidTaskType", error.path("error").asText());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void guardExitCodeFollowsVerdict() throws Exception {
        Path root = Files.createTempDirectory("agentwarden-test-cli-guard-");
        try {
            Result blocked = run(root, "guard", "--command", "rm -rf /");
            Assertions.assertEquals(1, blocked.exitCode());
            Assertions.assertFalse(blocked.json().path("allowed").asBoolean());

            Result allowed = run(root, "guard", "--command", "git status");
            Assertions.assertEquals(0, allowed.exitCode());
            Assertions.assertTrue(allowed.json().path("allowed").asBoolean());

            Assertions.assertEquals(1, run(root, "guard", "--path", "../../etc/passwd.txt").exitCode());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void protectedUpdateApproveAndRollback() throws Exception {
        Path root = Files.createTempDirectory("agentwarden-test-cli-updates-");
        try {
            Path content = root.resolve("proposal.py");
            Files.writeString(content, "def loop():\n    return 2\n");

            JsonNode proposed = run(root, "propose", "core/loop.py", "--file", content.toString()).json();
            Assertions.assertEquals("PENDING_APPROVAL", proposed.path("status").asText());
            String updateId = proposed.path("update_id").asText();
            Assertions.assertEquals(1, run(root, "updates", "--status", "pending_approval").json().size());

            Result reserved = run(root, "approve", updateId, "--actor", "system:me");
            Assertions.assertNotEquals(0, reserved.exitCode());

            JsonNode applied = run(root, "approve", updateId, "--actor", "alice", "--reason", "ok").json();
            Assertions.assertEquals("APPLIED", applied.path("status").asText());
            Path target = root.resolve("agent/core/loop.py");
            Assertions.assertEquals("def loop():\n    return 2\n", Files.readString(target));

            JsonNode rolledBack = run(root, "rollback", updateId, "--actor", "alice").json();
            Assertions.assertEquals("ROLLED_BACK", rolledBack.path("status").asText());
            Assertions.assertFalse(rolledBack.path("already_rolled_back").asBoolean());
            Assertions.assertFalse(Files.exists(target));

            Assertions.assertTrue(run(root, "rollback", updateId).json().path("already_rolled_back").asBoolean());
            Assertions.assertEquals(5, run(root, "change-log", "--update", updateId).json().size());
        } finally {
            deleteRecursively(root);
        }
    }

    private static Result run(Path root, String... args) {
        List<String> argv = new ArrayList<>();
        argv.add("--root");
        argv.add(root.toString());
        argv.addAll(List.of(args));

        CommandLine cli = Main.commandLine();
        StringWriter err = new StringWriter();
        cli.setErr(new PrintWriter(err, true));
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        PrintStream originalOut = System.out;
        int code;
        System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
        try {
            code = cli.execute(argv.toArray(new String[0]));
        } finally {
            System.setOut(originalOut);
        }
        return new Result(code, out.toString(StandardCharsets.UTF_8), err.toString());
    }

    private record Result(int exitCode, String stdout, String stderr) {
        JsonNode json() {
            try {
                return Jsons.mapper().readTree(stdout);
            } catch (IOException e) {
                throw new AssertionError("stdout is not JSON: " + stdout, e);
            }
        }
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
