package io.commandgate.gateway;

import io.commandgate.model.ExecutionRecord;
import io.commandgate.model.ErrorType;
import io.commandgate.model.ExecutionState;
import io.commandgate.model.PolicyVerdict;

/**
 * Caller-facing answer to a write request. {@code approvalId} is set only when blocked.
 */
public record WriteOutcome(
        String executionId,
        WriteDisposition disposition,
        ExecutionState state,
        String approvalId,
        String reason
) {
    static WriteOutcome of(WriteDisposition disposition, ExecutionRecord record, String reason) {
        return new WriteOutcome(record.executionId(), disposition, record.state(), record.approvalId(), reason);
    }

    /**
     * Describes an execution that was already recorded, as seen by a caller resubmitting it.
     */
    public static WriteOutcome fromRecord(ExecutionRecord record) {
        String reason = record.failure() == null ? null : record.failure().reason();
        WriteDisposition disposition;
        if (record.verdict() == PolicyVerdict.DENY
                || (record.failure() != null && record.failure().errorType() == ErrorType.APPROVAL_REJECTED)) {
            disposition = WriteDisposition.REJECTED;
        } else if (record.state() == ExecutionState.BLOCKED) {
            disposition = WriteDisposition.BLOCKED;
        } else {
            disposition = WriteDisposition.ALLOWED;
        }
        return new WriteOutcome(record.executionId(), disposition, record.state(), record.approvalId(), reason);
    }
}
