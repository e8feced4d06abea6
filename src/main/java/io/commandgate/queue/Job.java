package io.commandgate.queue;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;

public record Job(
        String jobId,
        String executionId,
        JobStatus status,
        int attempts,
        int maxAttempts,
        String lastError,
        long createdAtMs,
        long updatedAtMs
) {
    static Job queued(String jobId, String executionId, int maxAttempts) {
        long now = Instant.now().toEpochMilli();
        return new Job(jobId, executionId, JobStatus.QUEUED, 0, maxAttempts, null, now, now);
    }

    @JsonIgnore
    public boolean isFinalAttempt() {
        return attempts >= maxAttempts;
    }

    Job with(JobStatus nextStatus, int nextAttempts, String error) {
        return new Job(jobId, executionId, nextStatus, nextAttempts, maxAttempts, error, createdAtMs,
                Instant.now().toEpochMilli());
    }
}
