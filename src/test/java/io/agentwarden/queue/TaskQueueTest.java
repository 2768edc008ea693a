package io.agentwarden.queue;

import io.agentwarden.MutableClock;
import io.agentwarden.config.WardenConfig;
import io.agentwarden.error.ErrorKind;
import io.agentwarden.error.InvalidTaskTypeException;
import io.agentwarden.error.NotClaimedException;
import io.agentwarden.model.Priority;
import io.agentwarden.model.TaskError;
import io.agentwarden.model.TaskPayload;
import io.agentwarden.model.TaskStatus;
import io.agentwarden.model.TaskView;
import io.agentwarden.storage.Database;
import io.agentwarden.storage.QueueBackend;
import io.agentwarden.storage.SqliteQueueBackend;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

final class TaskQueueTest {
    private static final Duration LEASE = Duration.ofSeconds(30);

    @Test
    void higherPriorityIsClaimedFirstAndEqualPriorityIsFifo() throws Exception {
        Path root = Files.createTempDirectory("agentwarden-test-priority-");
        try {
            MutableClock clock = new MutableClock(1_000_000L);
            TaskQueue queue = newQueue(root, clock);
            String normalFirst = queue.submit("general", Priority.NORMAL, TaskPayload.describe("normal first"));
            clock.advanceMillis(1);
            String low = queue.submit("general", Priority.LOW, TaskPayload.describe("low"));
            clock.advanceMillis(1);
            String normalSecond = queue.submit("general", Priority.NORMAL, TaskPayload.describe("normal second"));
            clock.advanceMillis(1);
            String high = queue.submit("write_tests", Priority.HIGH, TaskPayload.describe("high")
                    .withCode("def add(a, b):\n    return a + b\n", "python"));

            List<String> order = new ArrayList<>();
            for (int i = 0; i < 4; i++) {
                order.add(queue.claim("w1", LEASE).orElseThrow().taskId());
            }
            Assertions.assertEquals(List.of(high, normalFirst, normalSecond, low), order);
            Assertions.assertTrue(queue.claim("w1", LEASE).isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void equalTimestampsFallBackToSubmissionSequence() throws Exception {
        Path root = Files.createTempDirectory("agentwarden-test-seq-");
        try {
            TaskQueue queue = newQueue(root, new MutableClock(5_000L));
            String a = queue.submit("general", Priority.NORMAL, TaskPayload.describe("a"));
            String b = queue.submit("general", Priority.NORMAL, TaskPayload.describe("b"));
            String c = queue.submit("general", Priority.NORMAL, TaskPayload.describe("c"));

            Assertions.assertEquals(a, queue.claim("w", LEASE).orElseThrow().taskId());
            Assertions.assertEquals(b, queue.claim("w", LEASE).orElseThrow().taskId());
            Assertions.assertEquals(c, queue.claim("w", LEASE).orElseThrow().taskId());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void unknownTaskTypeIsRejectedAndNothingIsStored() throws Exception {
        Path root = Files.createTempDirectory("agentwarden-test-invalid-type-");
        try {
            TaskQueue queue = newQueue(root, new MutableClock(1L));
            InvalidTaskTypeException ex = Assertions.assertThrows(InvalidTaskTypeException.class,
                    () -> queue.submit("deploy_to_prod", Priority.URGENT, TaskPayload.describe("ship it")));
            Assertions.assertEquals(ErrorKind.INVALID_TASK_TYPE, ex.kind());
            Assertions.assertTrue(queue.list(null, 10).isEmpty());
            Assertions.assertThrows(IllegalArgumentException.class,
                    () -> queue.submit("general", Priority.NORMAL, TaskPayload.describe("  ")));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void concurrentClaimsNeverReturnTheSameTask() throws Exception {
        Path root = Files.createTempDirectory("agentwarden-test-concurrent-claim-");
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            TaskQueue queue = newQueue(root, new MutableClock(10_000L));
            int tasks = 40;
            for (int i = 0; i < tasks; i++) {
                queue.submit("general", Priority.NORMAL, TaskPayload.describe("task " + i));
            }
            ConcurrentLinkedQueue<String> claimed = new ConcurrentLinkedQueue<>();
            CountDownLatch start = new CountDownLatch(1);
            List<Future<?>> futures = new ArrayList<>();
            for (int w = 0; w < 8; w++) {
                String workerId = "w" + w;
                futures.add(pool.submit(() -> {
                    start.await();
                    while (true) {
                        Optional<ClaimedTask> next = queue.claim(workerId, LEASE);
                        if (next.isEmpty()) {
                            return null;
                        }
                        claimed.add(next.get().taskId());
                    }
                }));
            }
            start.countDown();
            for (Future<?> f : futures) {
                f.get(60, TimeUnit.SECONDS);
            }
            Set<String> unique = new HashSet<>(claimed);
            Assertions.assertEquals(tasks, claimed.size());
            Assertions.assertEquals(tasks, unique.size());
            Assertions.assertEquals((long) tasks, queue.stats().get(TaskStatus.CLAIMED));
        } finally {
            pool.shutdownNow();
            deleteRecursively(root);
        }
    }

    @Test
    void ackCompletesAndRejectsForeignOrExpiredLeases() throws Exception {
        Path root = Files.createTempDirectory("agentwarden-test-ack-");
        try {
            MutableClock clock = new MutableClock(100_000L);
            TaskQueue queue = newQueue(root, clock);
            String id = queue.submit("format_code", Priority.NORMAL, TaskPayload.describe("format"));
            ClaimedTask claimed = queue.claim("w1", LEASE).orElseThrow();
            queue.markRunning(claimed);
            Assertions.assertEquals(TaskStatus.RUNNING, queue.get(id).orElseThrow().status());

            ClaimedTask forged = new ClaimedTask(claimed.task(), "w2", "lease_forged", claimed.leaseExpiresAtMs());
            Assertions.assertThrows(NotClaimedException.class, () -> queue.ack(forged, "stolen"));

            Assertions.assertTrue(queue.ack(claimed, "formatted"));
            TaskView done = queue.get(id).orElseThrow();
            Assertions.assertEquals(TaskStatus.COMPLETED, done.status());
            Assertions.assertEquals("formatted", done.result());
            Assertions.assertNotNull(done.completedAtMs());
            Assertions.assertNull(done.leaseOwner());
            Assertions.assertThrows(NotClaimedException.class, () -> queue.ack(claimed, "again"));

            queue.submit("format_code", Priority.NORMAL, TaskPayload.describe("late"));
            ClaimedTask late = queue.claim("w1", LEASE).orElseThrow();
            clock.advance(LEASE.plusMillis(1));
            Assertions.assertThrows(NotClaimedException.class, () -> queue.ack(late, "too late"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void retryableFailuresBackOffThenExhaust() throws Exception {
        Path root = Files.createTempDirectory("agentwarden-test-retry-");
        try {
            MutableClock clock = new MutableClock(200_000L);
            TaskQueue queue = newQueue(root, clock, new RetryPolicy(2, 1_000L, 4_000L));
            String id = queue.submit("debug_error", Priority.NORMAL, TaskPayload.describe("fix it"));

            ClaimedTask first = queue.claim("w1", LEASE).orElseThrow();
            QueueBackend.FailureResolution r1 = queue.fail(first,
                    TaskError.of(ErrorKind.EXTERNAL_SERVICE_ERROR, "timeout"));
            Assertions.assertEquals(QueueBackend.FailureOutcome.RETRY_SCHEDULED, r1.outcome());
            Assertions.assertEquals(1, r1.attemptCount());
            long delay = r1.nextRetryAtMs() - clock.millis();
            Assertions.assertTrue(delay >= 1_000L && delay <= 1_250L, "delay was " + delay);

            TaskView retrying = queue.get(id).orElseThrow();
            Assertions.assertEquals(TaskStatus.RETRYING, retrying.status());
            Assertions.assertTrue(queue.claim("w1", LEASE).isEmpty());

            clock.advanceMillis(1_300L);
            ClaimedTask second = queue.claim("w1", LEASE).orElseThrow();
            Assertions.assertEquals(id, second.taskId());
            QueueBackend.FailureResolution r2 = queue.fail(second,
                    TaskError.of(ErrorKind.STORAGE_ERROR, "disk full"));
            Assertions.assertEquals(QueueBackend.FailureOutcome.FAILED, r2.outcome());

            TaskView failed = queue.get(id).orElseThrow();
            Assertions.assertEquals(TaskStatus.FAILED, failed.status());
            Assertions.assertEquals(2, failed.attemptCount());
            Assertions.assertEquals(ErrorKind.STORAGE_ERROR, failed.error().kind());
            Assertions.assertEquals("disk full", failed.error().message());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void securityViolationIsNeverRetried() throws Exception {
        Path root = Files.createTempDirectory("agentwarden-test-violation-");
        try {
            TaskQueue queue = newQueue(root, new MutableClock(1_000L), new RetryPolicy(5, 1_000L, 4_000L));
            String id = queue.submit("general", Priority.NORMAL, TaskPayload.describe("rm -rf /"));
            ClaimedTask claimed = queue.claim("w1", LEASE).orElseThrow();
            QueueBackend.FailureResolution r = queue.fail(claimed,
                    new TaskError(ErrorKind.SECURITY_VIOLATION, "blocked", "dangerous_pattern.shell"));
            Assertions.assertEquals(QueueBackend.FailureOutcome.FAILED, r.outcome());
            TaskView task = queue.get(id).orElseThrow();
            Assertions.assertEquals(TaskStatus.FAILED, task.status());
            Assertions.assertEquals("dangerous_pattern.shell", task.error().rule());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void expiredLeaseIsReapedOnceAndKeepsItsPlaceInLine() throws Exception {
        Path root = Files.createTempDirectory("agentwarden-test-reap-");
        try {
            MutableClock clock = new MutableClock(300_000L);
            TaskQueue queue = newQueue(root, clock);
            String older = queue.submit("general", Priority.NORMAL, TaskPayload.describe("older"));
            clock.advanceMillis(10);
            ClaimedTask crashed = queue.claim("w-crashed", LEASE).orElseThrow();
            Assertions.assertEquals(older, crashed.taskId());
            long createdAt = crashed.task().createdAtMs();

            String newer = queue.submit("general", Priority.NORMAL, TaskPayload.describe("newer"));
            Assertions.assertTrue(queue.reapExpiredLeases().isEmpty());

            clock.advance(LEASE.plusSeconds(1));
            List<QueueBackend.ReapedTask> reaped = queue.reapExpiredLeases();
            Assertions.assertEquals(1, reaped.size());
            Assertions.assertEquals(older, reaped.get(0).taskId());
            Assertions.assertEquals("w-crashed", reaped.get(0).previousOwner());
            Assertions.assertEquals(TaskStatus.PENDING, reaped.get(0).newStatus());
            Assertions.assertTrue(queue.reapExpiredLeases().isEmpty());

            TaskView back = queue.get(older).orElseThrow();
            Assertions.assertEquals(TaskStatus.PENDING, back.status());
            Assertions.assertEquals(1, back.attemptCount());
            Assertions.assertEquals(createdAt, back.createdAtMs());

            Assertions.assertEquals(older, queue.claim("w2", LEASE).orElseThrow().taskId());
            Assertions.assertEquals(newer, queue.claim("w2", LEASE).orElseThrow().taskId());
            Assertions.assertThrows(NotClaimedException.class, () -> queue.ack(crashed, "zombie result"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void leaseExpiryOnLastAttemptFailsTheTask() throws Exception {
        Path root = Files.createTempDirectory("agentwarden-test-reap-exhausted-");
        try {
            MutableClock clock = new MutableClock(300_000L);
            TaskQueue queue = newQueue(root, clock);
            String id = queue.submit("general", Priority.NORMAL, TaskPayload.describe("crashes its worker"), 2);

            queue.claim("w1", LEASE).orElseThrow();
            clock.advance(LEASE.plusSeconds(1));
            Assertions.assertEquals(TaskStatus.PENDING, queue.reapExpiredLeases().get(0).newStatus());

            queue.claim("w2", LEASE).orElseThrow();
            clock.advance(LEASE.plusSeconds(1));
            List<QueueBackend.ReapedTask> reaped = queue.reapExpiredLeases();
            Assertions.assertEquals(new QueueBackend.ReapedTask(id, "w2", TaskStatus.FAILED, 2), reaped.get(0));

            TaskView failed = queue.get(id).orElseThrow();
            Assertions.assertEquals(TaskStatus.FAILED, failed.status());
            Assertions.assertEquals(2, failed.attemptCount());
            Assertions.assertEquals(ErrorKind.NOT_CLAIMED, failed.error().kind());
            Assertions.assertNotNull(failed.completedAtMs());
            Assertions.assertTrue(queue.claim("w3", LEASE).isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void confirmLeaseReportsCancelAndLostLease() throws Exception {
        Path root = Files.createTempDirectory("agentwarden-test-confirm-");
        try {
            MutableClock clock = new MutableClock(1_000L);
            TaskQueue queue = newQueue(root, clock);
            String first = queue.submit("general", Priority.HIGH, TaskPayload.describe("first"));
            queue.submit("general", Priority.NORMAL, TaskPayload.describe("second"));
            ClaimedTask one = queue.claim("w1", LEASE).orElseThrow();
            ClaimedTask two = queue.claim("w2", LEASE).orElseThrow();
            Assertions.assertEquals(first, one.taskId());

            Assertions.assertTrue(queue.confirmLease(one));
            queue.cancel(first);
            Assertions.assertFalse(queue.confirmLease(one));
            Assertions.assertEquals(TaskStatus.CLAIMED, queue.get(first).orElseThrow().status());

            clock.advance(LEASE.plusSeconds(1));
            Assertions.assertThrows(NotClaimedException.class, () -> queue.confirmLease(two));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void cancelRemovesPendingAndDefersForClaimedTasks() throws Exception {
        Path root = Files.createTempDirectory("agentwarden-test-cancel-");
        try {
            TaskQueue queue = newQueue(root, new MutableClock(1_000L));
            String running = queue.submit("general", Priority.HIGH, TaskPayload.describe("running"));
            String pending = queue.submit("general", Priority.NORMAL, TaskPayload.describe("pending"));
            ClaimedTask claimed = queue.claim("w1", LEASE).orElseThrow();
            Assertions.assertEquals(running, claimed.taskId());

            Assertions.assertEquals(QueueBackend.CancelOutcome.CANCELLED, queue.cancel(pending));
            Assertions.assertEquals(TaskStatus.CANCELLED, queue.get(pending).orElseThrow().status());
            Assertions.assertTrue(queue.claim("w2", LEASE).isEmpty());

            Assertions.assertEquals(QueueBackend.CancelOutcome.CANCEL_REQUESTED, queue.cancel(running));
            Assertions.assertTrue(queue.get(running).orElseThrow().cancelRequested());
            Assertions.assertFalse(queue.ack(claimed, "discarded"));
            TaskView cancelled = queue.get(running).orElseThrow();
            Assertions.assertEquals(TaskStatus.CANCELLED, cancelled.status());
            Assertions.assertNull(cancelled.result());

            Assertions.assertEquals(QueueBackend.CancelOutcome.NOT_CANCELLABLE, queue.cancel(running));
            Assertions.assertEquals(QueueBackend.CancelOutcome.NOT_FOUND, queue.cancel("tsk_missing"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void listKeepsSubmissionOrderAndStatsCountEveryStatus() throws Exception {
        Path root = Files.createTempDirectory("agentwarden-test-list-");
        try {
            TaskQueue queue = newQueue(root, new MutableClock(1_000L));
            String a = queue.submit("general", Priority.LOW, TaskPayload.describe("a"));
            String b = queue.submit("general", Priority.URGENT, TaskPayload.describe("b"));
            queue.claim("w", LEASE).orElseThrow();

            List<String> all = queue.list(null, 10).stream().map(TaskView::taskId).toList();
            Assertions.assertEquals(List.of(a, b), all);
            Assertions.assertEquals(List.of(a),
                    queue.list(TaskStatus.PENDING, 10).stream().map(TaskView::taskId).toList());

            Map<TaskStatus, Long> stats = queue.stats();
            Assertions.assertEquals(1L, stats.get(TaskStatus.PENDING));
            Assertions.assertEquals(1L, stats.get(TaskStatus.CLAIMED));
            Assertions.assertEquals(0L, stats.get(TaskStatus.FAILED));
        } finally {
            deleteRecursively(root);
        }
    }

    private static TaskQueue newQueue(Path root, MutableClock clock) {
        return newQueue(root, clock, new RetryPolicy(3, 1_000L, 60_000L));
    }

    private static TaskQueue newQueue(Path root, MutableClock clock, RetryPolicy policy) {
        SqliteQueueBackend backend = new SqliteQueueBackend(new Database(WardenConfig.fromRoot(root.toString())));
        backend.init();
        return new TaskQueue(backend, policy, clock);
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
