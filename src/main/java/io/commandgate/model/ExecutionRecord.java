package io.commandgate.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record ExecutionRecord(
        String executionId,
        Command command,
        ExecutionState state,
        PolicyVerdict verdict,
        String approvalId,
        Map<String, Object> result,
        ExecutionFailure failure,
        int attemptCount,
        String agentId,
        long createdAtMs,
        long updatedAtMs
) {
    public static ExecutionRecord received(Command command) {
        long now = Instant.now().toEpochMilli();
        return new ExecutionRecord(command.executionId(), command, ExecutionState.RECEIVED, null, null,
                null, null, 0, null, now, now);
    }

    @JsonIgnore
    public boolean isTerminal() {
        return state.isTerminal();
    }

    /**
     * Ready for commit: explicitly approved, or received with no governance requirement.
     */
    @JsonIgnore
    public boolean isDispatchable() {
        return state == ExecutionState.APPROVED
                || (state == ExecutionState.RECEIVED && verdict == PolicyVerdict.ALLOW);
    }

    public ExecutionRecord withVerdict(PolicyVerdict nextVerdict) {
        return new ExecutionRecord(executionId, command, state, nextVerdict, approvalId, result, failure,
                attemptCount, agentId, createdAtMs, Instant.now().toEpochMilli());
    }

    public ExecutionRecord blocked(String nextApprovalId) {
        return new ExecutionRecord(executionId, command, ExecutionState.BLOCKED, verdict, nextApprovalId, result,
                failure, attemptCount, agentId, createdAtMs, Instant.now().toEpochMilli());
    }

    public ExecutionRecord moveTo(ExecutionState next) {
        return new ExecutionRecord(executionId, command, next, verdict, approvalId, result, failure,
                attemptCount, agentId, createdAtMs, Instant.now().toEpochMilli());
    }

    public ExecutionRecord dispatched() {
        return new ExecutionRecord(executionId, command, ExecutionState.DISPATCHED, verdict, approvalId, result,
                failure, attemptCount + 1, agentId, createdAtMs, Instant.now().toEpochMilli());
    }

    public ExecutionRecord completed(String byAgent, Map<String, Object> output) {
        return new ExecutionRecord(executionId, command, ExecutionState.COMPLETED, verdict, approvalId,
                output == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(output)), null, attemptCount, byAgent, createdAtMs,
                Instant.now().toEpochMilli());
    }

    public ExecutionRecord failed(String byAgent, ExecutionFailure nextFailure) {
        return new ExecutionRecord(executionId, command, ExecutionState.FAILED, verdict, approvalId, result,
                nextFailure, attemptCount, byAgent, createdAtMs, Instant.now().toEpochMilli());
    }
}
