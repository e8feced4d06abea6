package io.commandgate.storage;

import io.commandgate.model.Approval;
import io.commandgate.model.ApprovalOutcome;
import io.commandgate.model.CommandGateException;
import io.commandgate.model.ErrorType;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

public final class InMemoryApprovalStateStore implements ApprovalStateStore {
    private final Map<String, Approval> approvals = new ConcurrentHashMap<>();
    private final Map<String, String> approvalByExecution = new ConcurrentHashMap<>();

    @Override
    public Approval create(String executionId) {
        String approvalId = "apr_" + UUID.randomUUID();
        String existing = approvalByExecution.putIfAbsent(executionId, approvalId);
        if (existing != null) {
            throw new CommandGateException(ErrorType.APPROVAL_CONFLICT,
                    "Execution already has approval " + existing + ": " + executionId);
        }
        Approval approval = Approval.pending(approvalId, executionId, Instant.now().toEpochMilli());
        approvals.put(approvalId, approval);
        return approval;
    }

    @Override
    public Approval decide(String approvalId, ApprovalOutcome outcome, String decidedBy) {
        Approval current = approvals.get(approvalId);
        if (current == null) {
            throw CommandGateException.notFound("approval", approvalId);
        }
        if (!current.isPending()) {
            throw conflict(current);
        }
        Approval decided = current.decide(outcome, decidedBy, Instant.now().toEpochMilli());
        if (!approvals.replace(approvalId, current, decided)) {
            throw conflict(approvals.get(approvalId));
        }
        return decided;
    }

    @Override
    public Optional<Approval> get(String approvalId) {
        return approvalId == null ? Optional.empty() : Optional.ofNullable(approvals.get(approvalId));
    }

    @Override
    public Optional<Approval> findByExecution(String executionId) {
        if (executionId == null) {
            return Optional.empty();
        }
        return get(approvalByExecution.get(executionId));
    }

    @Override
    public List<Approval> listPending() {
        return approvals.values().stream()
                .filter(Approval::isPending)
                .sorted(Comparator.comparingLong(Approval::createdAtMs).thenComparing(Approval::approvalId))
                .toList();
    }

    private static CommandGateException conflict(Approval current) {
        return new CommandGateException(ErrorType.APPROVAL_CONFLICT,
                "Approval already decided: " + current.approvalId() + " status=" + current.status());
    }
}
