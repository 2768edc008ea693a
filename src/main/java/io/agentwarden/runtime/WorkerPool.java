package io.agentwarden.runtime;

import io.agentwarden.observability.MdcContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fixed number of worker slots, each running {@link AgentOrchestrator#runOnce} in a loop, plus a
 * scheduled lease reaper. Idle slots sleep for the poll interval.
 */
public final class WorkerPool {
    private static final Logger LOG = LoggerFactory.getLogger(WorkerPool.class);

    private final AgentOrchestrator orchestrator;
    private final Runnable reaper;
    private final int slots;
    private final Duration pollInterval;
    private final Duration reapInterval;
    private final String workerPrefix;
    private final CountDownLatch stopSignal = new CountDownLatch(1);
    private final AtomicLong processed = new AtomicLong();
    private final List<Thread> workers = new ArrayList<>();
    private ScheduledExecutorService reaperExecutor;
    private boolean started;

    public WorkerPool(
            AgentOrchestrator orchestrator,
            Runnable reaper,
            int slots,
            Duration pollInterval,
            Duration reapInterval,
            String workerPrefix
    ) {
        if (slots < 1) {
            throw new IllegalArgumentException("slots must be >= 1");
        }
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator");
        this.reaper = Objects.requireNonNull(reaper, "reaper");
        this.slots = slots;
        this.pollInterval = pollInterval;
        this.reapInterval = reapInterval;
        this.workerPrefix = workerPrefix == null || workerPrefix.isBlank() ? "worker" : workerPrefix.trim();
    }

    public synchronized void start() {
        if (started) {
            throw new IllegalStateException("Worker pool already started");
        }
        started = true;
        reaperExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, workerPrefix + "-reaper");
            t.setDaemon(true);
            return t;
        });
        reaperExecutor.scheduleWithFixedDelay(this::reapSafely, 0L, reapInterval.toMillis(), TimeUnit.MILLISECONDS);
        for (int i = 1; i <= slots; i++) {
            String workerId = workerPrefix + "-" + i;
            Thread t = new Thread(() -> loop(workerId), workerId);
            workers.add(t);
            t.start();
        }
        LOG.info("Started {} worker slots (poll={}ms, reap={}ms)", slots, pollInterval.toMillis(), reapInterval.toMillis());
    }

    /** Signals every slot to stop after its current task and waits up to {@code timeout}. */
    public void stop(Duration timeout) throws InterruptedException {
        List<Thread> snapshot;
        synchronized (this) {
            stopSignal.countDown();
            if (reaperExecutor != null) {
                reaperExecutor.shutdownNow();
            }
            snapshot = List.copyOf(workers);
        }
        long deadline = System.nanoTime() + timeout.toNanos();
        for (Thread t : snapshot) {
            long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
            if (remainingMs > 0) {
                t.join(remainingMs);
            }
            if (t.isAlive()) {
                LOG.warn("Worker {} did not stop within {} ms", t.getName(), timeout.toMillis());
            }
        }
    }

    public void awaitStop() throws InterruptedException {
        stopSignal.await();
    }

    public long processedCount() {
        return processed.get();
    }

    private void loop(String workerId) {
        MdcContext.setWorker(workerId);
        try {
            while (stopSignal.getCount() > 0) {
                AgentOrchestrator.WorkerOutcome outcome;
                try {
                    outcome = orchestrator.runOnce(workerId);
                } catch (RuntimeException e) {
                    // Lease is left to expire; the reaper returns the task to the queue.
                    LOG.error("Worker {} iteration failed", workerId, e);
                    outcome = null;
                }
                if (outcome != null && outcome.processed()) {
                    processed.incrementAndGet();
                    continue;
                }
                if (stopSignal.await(pollInterval.toMillis(), TimeUnit.MILLISECONDS)) {
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            MdcContext.clear();
        }
    }

    private void reapSafely() {
        try {
            reaper.run();
        } catch (RuntimeException e) {
            LOG.error("Lease reap failed", e);
        }
    }
}
