package io.commandgate.queue;

import io.commandgate.model.CommandGateException;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.DelayQueue;
import java.util.concurrent.Delayed;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * In-process FIFO of commit jobs with a bounded retry budget. A job is attempted at most
 * {@code 1 + retryLimit} times; once FAILED or SUCCEEDED it never runs again.
 */
public final class ExecutionQueue {
    public static final int MAX_RETRY_LIMIT = 1;

    private final int maxAttempts;
    private final LinkedBlockingQueue<String> ready = new LinkedBlockingQueue<>();
    private final DelayQueue<DelayedRetry> delayed = new DelayQueue<>();
    private final Map<String, Job> jobs = new ConcurrentHashMap<>();
    private final Map<String, String> activeJobByExecution = new ConcurrentHashMap<>();

    public ExecutionQueue(int retryLimit) {
        if (retryLimit < 0 || retryLimit > MAX_RETRY_LIMIT) {
            throw new IllegalArgumentException("retryLimit must be 0 or 1, got " + retryLimit);
        }
        this.maxAttempts = 1 + retryLimit;
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    /**
     * Queues a job for the execution unless one is already queued or running for it.
     */
    public synchronized String enqueue(String executionId) {
        if (executionId == null || executionId.isBlank()) {
            throw new IllegalArgumentException("execution id cannot be empty");
        }
        String active = activeJobByExecution.get(executionId);
        if (active != null) {
            return active;
        }
        String jobId = "job_" + UUID.randomUUID();
        jobs.put(jobId, Job.queued(jobId, executionId, maxAttempts));
        activeJobByExecution.put(executionId, jobId);
        ready.add(jobId);
        return jobId;
    }

    public Optional<Job> claim(long timeoutMs) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(Math.max(0L, timeoutMs));
        while (true) {
            promoteDueRetries();
            long wait = Math.max(0L, deadline - System.nanoTime());
            DelayedRetry next = delayed.peek();
            if (next != null) {
                wait = Math.min(wait, Math.max(0L, next.getDelay(TimeUnit.NANOSECONDS)));
            }
            String jobId = ready.poll(wait, TimeUnit.NANOSECONDS);
            if (jobId == null) {
                promoteDueRetries();
                if (ready.isEmpty() && System.nanoTime() - deadline >= 0) {
                    return Optional.empty();
                }
                continue;
            }
            synchronized (this) {
                Job job = jobs.get(jobId);
                if (job != null && job.status() == JobStatus.QUEUED) {
                    Job claimed = job.with(JobStatus.PROCESSING, job.attempts() + 1, job.lastError());
                    jobs.put(jobId, claimed);
                    return Optional.of(claimed);
                }
            }
        }
    }

    public synchronized Job ack(String jobId) {
        Job job = requireProcessing(jobId);
        Job done = job.with(JobStatus.SUCCEEDED, job.attempts(), job.lastError());
        jobs.put(jobId, done);
        activeJobByExecution.remove(job.executionId(), jobId);
        return done;
    }

    /**
     * Returns the job to the queue when {@code retry} is requested and attempts remain;
     * otherwise the job is failed for good.
     */
    public NackOutcome nack(String jobId, String error, boolean retry) {
        return nack(jobId, error, retry, 0L);
    }

    /**
     * As {@link #nack(String, String, boolean)}, but a requeued job becomes claimable only after
     * {@code delayMs}.
     */
    public synchronized NackOutcome nack(String jobId, String error, boolean retry, long delayMs) {
        Job job = requireProcessing(jobId);
        if (retry && job.attempts() < job.maxAttempts()) {
            jobs.put(jobId, job.with(JobStatus.QUEUED, job.attempts(), error));
            if (delayMs > 0L) {
                delayed.add(new DelayedRetry(jobId, System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(delayMs)));
            } else {
                ready.add(jobId);
            }
            return NackOutcome.REQUEUED;
        }
        jobs.put(jobId, job.with(JobStatus.FAILED, job.attempts(), error));
        activeJobByExecution.remove(job.executionId(), jobId);
        return NackOutcome.FAILED;
    }

    public Optional<Job> get(String jobId) {
        return Optional.ofNullable(jobs.get(jobId));
    }

    public Optional<Job> activeJobFor(String executionId) {
        String jobId = activeJobByExecution.get(executionId);
        return jobId == null ? Optional.empty() : get(jobId);
    }

    public int depth() {
        return ready.size() + delayed.size();
    }

    /**
     * Milliseconds until the earliest delayed retry becomes claimable, 0 when one is already due,
     * or -1 when no retry is waiting.
     */
    public long millisUntilNextRetry() {
        DelayedRetry next = delayed.peek();
        if (next == null) {
            return -1L;
        }
        return Math.max(0L, next.getDelay(TimeUnit.MILLISECONDS));
    }

    public synchronized boolean isIdle() {
        return activeJobByExecution.isEmpty();
    }

    public Map<String, Long> snapshot() {
        Map<JobStatus, Long> counts = new EnumMap<>(JobStatus.class);
        for (JobStatus status : JobStatus.values()) {
            counts.put(status, 0L);
        }
        for (Job job : jobs.values()) {
            counts.merge(job.status(), 1L, Long::sum);
        }
        Map<String, Long> out = new LinkedHashMap<>();
        counts.forEach((status, count) -> out.put(status.name(), count));
        return out;
    }

    private void promoteDueRetries() {
        DelayedRetry due;
        while ((due = delayed.poll()) != null) {
            ready.add(due.jobId);
        }
    }

    private Job requireProcessing(String jobId) {
        Job job = jobs.get(jobId);
        if (job == null) {
            throw CommandGateException.notFound("job", jobId);
        }
        if (job.status() != JobStatus.PROCESSING) {
            throw new IllegalStateException("Job " + jobId + " is not processing: " + job.status());
        }
        return job;
    }

    private static final class DelayedRetry implements Delayed {
        private final String jobId;
        private final long dueAtNanos;

        private DelayedRetry(String jobId, long dueAtNanos) {
            this.jobId = jobId;
            this.dueAtNanos = dueAtNanos;
        }

        @Override
        public long getDelay(TimeUnit unit) {
            return unit.convert(dueAtNanos - System.nanoTime(), TimeUnit.NANOSECONDS);
        }

        @Override
        public int compareTo(Delayed other) {
            return Long.compare(getDelay(TimeUnit.NANOSECONDS), other.getDelay(TimeUnit.NANOSECONDS));
        }
    }
}
