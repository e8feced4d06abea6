package io.commandgate.storage;

import io.commandgate.model.Approval;
import io.commandgate.model.ApprovalOutcome;

import java.util.List;
import java.util.Optional;

/**
 * Approval lifecycle shared by every caller of one process. An approval created here is
 * immediately visible to {@link #get(String)} and {@link #listPending()} from any thread.
 *
 * <p>{@link #decide} is linearizable per approval: of two concurrent decisions exactly one
 * succeeds and the other fails with {@code APPROVAL_CONFLICT}.
 */
public interface ApprovalStateStore {
    /**
     * Creates the single approval of an execution.
     *
     * @throws io.commandgate.model.CommandGateException {@code APPROVAL_CONFLICT} when the execution already has one
     */
    Approval create(String executionId);

    /**
     * @throws io.commandgate.model.CommandGateException {@code NOT_FOUND} for an unknown id,
     *                                                   {@code APPROVAL_CONFLICT} when already decided
     */
    Approval decide(String approvalId, ApprovalOutcome outcome, String decidedBy);

    Optional<Approval> get(String approvalId);

    Optional<Approval> findByExecution(String executionId);

    List<Approval> listPending();
}
