package io.commandgate.storage;

import io.commandgate.model.ExecutionFailure;
import io.commandgate.model.ExecutionRecord;
import io.commandgate.model.ExecutionState;

import java.time.Instant;
import java.util.Map;

public record IndexEntry(
        String executionId,
        Status status,
        ExecutionState outcomeState,
        Map<String, Object> result,
        ExecutionFailure failure,
        String agentId,
        long recordedAtMs
) {
    public enum Status {
        PROCESSING,
        COMMITTED
    }

    static IndexEntry processing(String executionId) {
        return new IndexEntry(executionId, Status.PROCESSING, null, null, null, null, Instant.now().toEpochMilli());
    }

    static IndexEntry forOutcome(ExecutionRecord outcome) {
        return new IndexEntry(outcome.executionId(), Status.COMMITTED, outcome.state(), outcome.result(),
                outcome.failure(), outcome.agentId(), Instant.now().toEpochMilli());
    }

    public boolean committed() {
        return status == Status.COMMITTED;
    }
}
