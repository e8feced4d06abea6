package io.commandgate.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

public record Approval(
        String approvalId,
        String executionId,
        ApprovalStatus status,
        long createdAtMs,
        Long decidedAtMs,
        String decidedBy
) {
    public static Approval pending(String approvalId, String executionId, long nowMs) {
        return new Approval(approvalId, executionId, ApprovalStatus.PENDING, nowMs, null, null);
    }

    @JsonIgnore
    public boolean isPending() {
        return status == ApprovalStatus.PENDING;
    }

    public Approval decide(ApprovalOutcome outcome, String by, long nowMs) {
        return new Approval(approvalId, executionId, outcome.toStatus(), createdAtMs, nowMs, by);
    }
}
