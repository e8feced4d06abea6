package io.commandgate.queue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed set of worker threads pulling from one {@link ExecutionQueue}.
 */
public final class WorkerPool implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);
    private static final long SHUTDOWN_GRACE_MS = 5_000L;

    private final ExecutionWorker worker;
    private final int workerCount;
    private final long claimTimeoutMs;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private ExecutorService executor;

    public WorkerPool(ExecutionWorker worker, int workerCount, long claimTimeoutMs) {
        this.worker = worker;
        this.workerCount = Math.max(1, workerCount);
        this.claimTimeoutMs = Math.max(10L, claimTimeoutMs);
    }

    public synchronized void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        AtomicInteger counter = new AtomicInteger();
        executor = Executors.newFixedThreadPool(workerCount, r -> {
            Thread t = new Thread(r, "commandgate-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        for (int i = 1; i <= workerCount; i++) {
            String workerId = "worker-" + i;
            executor.submit(() -> loop(workerId));
        }
        log.info("Started {} workers", workerCount);
    }

    public boolean isRunning() {
        return running.get();
    }

    private void loop(String workerId) {
        while (running.get()) {
            try {
                worker.runOnce(workerId, claimTimeoutMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (RuntimeException e) {
                log.error("Worker {} loop error", workerId, e);
            }
        }
    }

    @Override
    public synchronized void close() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(SHUTDOWN_GRACE_MS, TimeUnit.MILLISECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Stopped workers");
    }
}
