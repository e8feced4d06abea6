package io.commandgate.queue;

import io.commandgate.model.ExecutionState;

public record WorkerOutcome(
        String workerId,
        boolean processed,
        String jobId,
        String executionId,
        ExecutionState state,
        String message
) {
    static WorkerOutcome idle(String workerId) {
        return new WorkerOutcome(workerId, false, null, null, null, "No queued jobs");
    }
}
