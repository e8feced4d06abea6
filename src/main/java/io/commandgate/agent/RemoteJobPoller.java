package io.commandgate.agent;

import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Drives a {@link RemoteJob} to a terminal state on a scheduler. Each tick polls once and
 * either completes the future, or schedules the next tick, or gives up when the attempt or
 * deadline bound is reached. Cancelling the returned future stops the timer and cancels the job.
 */
public final class RemoteJobPoller implements AutoCloseable {
    private final ScheduledExecutorService scheduler;

    public RemoteJobPoller(ScheduledExecutorService scheduler) {
        this.scheduler = scheduler;
    }

    public static RemoteJobPoller create(int threads) {
        AtomicInteger counter = new AtomicInteger();
        return new RemoteJobPoller(Executors.newScheduledThreadPool(Math.max(1, threads), r -> {
            Thread t = new Thread(r, "commandgate-poller-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }));
    }

    public CompletableFuture<Map<String, Object>> start(RemoteJob job, PollPolicy policy) {
        CompletableFuture<Map<String, Object>> future = new CompletableFuture<>();
        AtomicReference<ScheduledFuture<?>> nextTick = new AtomicReference<>();
        AtomicInteger attempts = new AtomicInteger();
        long startedNanos = System.nanoTime();

        Runnable tick = new Runnable() {
            @Override
            public void run() {
                if (future.isDone()) {
                    return;
                }
                int attempt = attempts.incrementAndGet();
                PollResult observed;
                try {
                    observed = job.poll();
                } catch (Exception e) {
                    future.completeExceptionally(e);
                    return;
                }
                switch (observed.status()) {
                    case DONE -> future.complete(observed.result());
                    case FAILED -> future.completeExceptionally(new RemoteJobFailedException(job.jobId(), observed.error()));
                    case PENDING -> {
                        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
                        if (attempt >= policy.maxAttempts() || elapsedMs + policy.intervalMs() > policy.deadlineMs()) {
                            job.cancel();
                            future.completeExceptionally(new PollTimeoutException(job.jobId(), attempt, elapsedMs));
                        } else {
                            nextTick.set(scheduler.schedule(this, policy.intervalMs(), TimeUnit.MILLISECONDS));
                        }
                    }
                }
            }
        };

        future.whenComplete((result, error) -> {
            if (error instanceof CancellationException) {
                ScheduledFuture<?> pending = nextTick.get();
                if (pending != null) {
                    pending.cancel(false);
                }
                job.cancel();
            }
        });
        nextTick.set(scheduler.schedule(tick, 0L, TimeUnit.MILLISECONDS));
        return future;
    }

    /**
     * Blocks until the job is terminal. Interruption cancels the job and is rethrown.
     */
    public Map<String, Object> await(RemoteJob job, PollPolicy policy) throws Exception {
        CompletableFuture<Map<String, Object>> future = start(job, policy);
        try {
            return future.get();
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception exception) {
                throw exception;
            }
            throw e;
        }
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
    }
}
