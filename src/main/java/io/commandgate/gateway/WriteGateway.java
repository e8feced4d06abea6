package io.commandgate.gateway;

import io.commandgate.agent.AgentRouter;
import io.commandgate.agent.RoutingResult;
import io.commandgate.model.Approval;
import io.commandgate.model.ApprovalOutcome;
import io.commandgate.model.ApprovalStatus;
import io.commandgate.model.AuditEventType;
import io.commandgate.model.Command;
import io.commandgate.model.CommandGateException;
import io.commandgate.model.ErrorType;
import io.commandgate.model.ExecutionFailure;
import io.commandgate.model.ExecutionRecord;
import io.commandgate.model.ExecutionState;
import io.commandgate.model.InitiatorContext;
import io.commandgate.policy.PolicyDecision;
import io.commandgate.policy.PolicyEvaluator;
import io.commandgate.policy.SystemFlags;
import io.commandgate.security.SensitiveDataMasker;
import io.commandgate.storage.IndexEntry;
import io.commandgate.storage.StateStores;
import io.commandgate.util.Hashing;
import io.commandgate.util.Jsons;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * The only path that mutates execution, approval and idempotency state. Every operation runs
 * under the lock of its execution id, so calls for one execution are serialized while
 * unrelated executions proceed independently.
 */
public final class WriteGateway {
    public static final String DEFAULT_DECIDER = "operator";

    private final StateStores stores;
    private final AgentRouter router;
    private final Supplier<SystemFlags> flags;

    public WriteGateway(StateStores stores, AgentRouter router, Supplier<SystemFlags> flags) {
        this.stores = stores;
        this.router = router;
        this.flags = flags;
    }

    /**
     * Validates, records and evaluates a new command.
     *
     * @throws CommandGateException {@code INVALID_COMMAND} for malformed input,
     *                              {@code INVALID_STATE} when the execution id is already known
     */
    public WriteOutcome requestWrite(Command raw, InitiatorContext initiator) {
        Command command = validate(raw);
        InitiatorContext caller = initiator == null ? InitiatorContext.standard(command.initiator()) : initiator;
        String executionId = command.executionId();
        return stores.locks().withLock(executionId, () -> {
            ExecutionRecord received = ExecutionRecord.received(command);
            if (!stores.executions().create(received)) {
                throw new CommandGateException(ErrorType.INVALID_STATE, "duplicate_execution: " + executionId);
            }
            Map<String, Object> receivedDetails = new LinkedHashMap<>();
            receivedDetails.put("command_id", command.commandId());
            receivedDetails.put("kind", command.kind());
            receivedDetails.put("initiator", caller.initiator());
            receivedDetails.put("read_only", command.readOnly());
            receivedDetails.put("parameters_digest", Hashing.sha256Hex(
                    Jsons.toCanonicalJson(SensitiveDataMasker.masked(command.parameters()))));
            stores.audit().append(executionId, AuditEventType.RECEIVED, receivedDetails);

            PolicyDecision decision = PolicyEvaluator.evaluate(caller, command, flags.get());
            stores.audit().append(executionId, AuditEventType.POLICY_EVAL, Map.of(
                    "verdict", decision.verdict().name(),
                    "reason", decision.reason(),
                    "stage", decision.stage(),
                    "tier", caller.tier().name()
            ));

            ExecutionRecord evaluated = received.withVerdict(decision.verdict());
            return switch (decision.verdict()) {
                case DENY -> {
                    ExecutionRecord rejected = evaluated.failed(null,
                            ExecutionFailure.of(ErrorType.POLICY_DENIED, decision.reason()));
                    move(ExecutionState.RECEIVED, rejected);
                    stores.audit().append(executionId, AuditEventType.REJECTED, Map.of(
                            "error_type", ErrorType.POLICY_DENIED.name(),
                            "reason", decision.reason()
                    ));
                    yield WriteOutcome.of(WriteDisposition.REJECTED, rejected, decision.reason());
                }
                case REQUIRE_APPROVAL -> {
                    Approval approval = stores.approvals().create(executionId);
                    ExecutionRecord blocked = evaluated.blocked(approval.approvalId());
                    move(ExecutionState.RECEIVED, blocked);
                    stores.audit().append(executionId, AuditEventType.APPROVAL_REQUIRED, Map.of(
                            "approval_id", approval.approvalId(),
                            "reason", decision.reason()
                    ));
                    yield WriteOutcome.of(WriteDisposition.BLOCKED, blocked, decision.reason());
                }
                case ALLOW -> {
                    move(ExecutionState.RECEIVED, evaluated);
                    yield WriteOutcome.of(WriteDisposition.ALLOWED, evaluated, decision.reason());
                }
            };
        });
    }

    /**
     * Applies an allowed or approved command at most once. A terminal execution is answered from
     * the stored outcome and recorded as a replay; the capability is not invoked again.
     */
    public ExecutionRecord commitWrite(String executionId) {
        return stores.locks().withLock(executionId, () -> {
            ExecutionRecord current = requireRecord(executionId);
            Optional<IndexEntry> indexed = stores.idempotency().lookup(executionId);
            if (indexed.isPresent() && !indexed.get().committed()) {
                throw new CommandGateException(ErrorType.INVALID_STATE, "idempotency_in_progress: " + executionId);
            }
            if (indexed.isPresent() || current.isTerminal()) {
                stores.audit().append(executionId, AuditEventType.IDEMPOTENT_REPLAY, Map.of(
                        "outcome_state", current.state().name(),
                        "source", indexed.isPresent() ? "idempotency_index" : "execution_record"
                ));
                return current;
            }
            requireDispatchable(current);
            if (!stores.idempotency().reserve(executionId)) {
                throw new CommandGateException(ErrorType.INVALID_STATE, "idempotency_in_progress: " + executionId);
            }
            ExecutionRecord dispatched = current.dispatched();
            boolean moved;
            try {
                moved = stores.executions().transition(current.state(), dispatched);
            } catch (RuntimeException e) {
                stores.idempotency().release(executionId);
                throw e;
            }
            if (!moved) {
                stores.idempotency().release(executionId);
                throw new CommandGateException(ErrorType.INVALID_STATE, "concurrent_transition: " + executionId);
            }

            RoutingResult routed = router.execute(dispatched.command());
            ExecutionRecord outcome = routed.success()
                    ? dispatched.completed(routed.agentId(), routed.result())
                    : dispatched.failed(routed.agentId(), ExecutionFailure.of(routed.errorType(), routed.error()));
            move(ExecutionState.DISPATCHED, outcome);
            stores.idempotency().complete(outcome);

            Map<String, Object> details = new LinkedHashMap<>();
            details.put("agent_id", routed.agentId() == null ? "" : routed.agentId());
            details.put("attempt", outcome.attemptCount());
            if (routed.success()) {
                details.put("result_digest", Hashing.sha256Hex(Jsons.toCanonicalJson(outcome.result())));
                stores.audit().append(executionId, AuditEventType.APPLIED, details);
            } else {
                details.put("error_type", routed.errorType().name());
                details.put("reason", outcome.failure().reason());
                stores.audit().append(executionId, AuditEventType.FAILED, details);
            }
            return outcome;
        });
    }

    /**
     * Records an operator decision. A second decision on the same approval fails with
     * {@code APPROVAL_CONFLICT} and changes nothing.
     */
    public ExecutionRecord decideApproval(String approvalId, ApprovalOutcome outcome, String decidedBy) {
        if (outcome == null) {
            throw new CommandGateException(ErrorType.INVALID_COMMAND, "approval outcome is required");
        }
        Approval approval = stores.approvals().get(approvalId)
                .orElseThrow(() -> CommandGateException.notFound("approval", approvalId));
        String decider = decidedBy == null || decidedBy.isBlank() ? DEFAULT_DECIDER : decidedBy.trim();
        String executionId = approval.executionId();
        return stores.locks().withLock(executionId, () -> {
            Approval decided = stores.approvals().decide(approvalId, outcome, decider);
            return applyDecision(requireRecord(executionId), decided);
        });
    }

    /**
     * Completes a decision whose approval was stored but whose execution is still BLOCKED, as
     * left by a process that stopped between the two writes.
     *
     * @return the moved record, or empty while the approval is still pending
     */
    public Optional<ExecutionRecord> resumeDecided(String executionId) {
        return stores.locks().withLock(executionId, () -> {
            ExecutionRecord current = requireRecord(executionId);
            if (current.state() != ExecutionState.BLOCKED) {
                return Optional.empty();
            }
            Optional<Approval> approval = stores.approvals().findByExecution(executionId);
            if (approval.isEmpty() || approval.get().isPending()) {
                return Optional.empty();
            }
            return Optional.of(applyDecision(current, approval.get()));
        });
    }

    private ExecutionRecord applyDecision(ExecutionRecord current, Approval decided) {
        String executionId = current.executionId();
        String decider = decided.decidedBy() == null ? DEFAULT_DECIDER : decided.decidedBy();
        if (decided.status() == ApprovalStatus.APPROVED) {
            ExecutionRecord approved = current.moveTo(ExecutionState.APPROVED);
            move(ExecutionState.BLOCKED, approved);
            stores.audit().append(executionId, AuditEventType.APPROVED, Map.of(
                    "approval_id", decided.approvalId(),
                    "decided_by", decider
            ));
            return approved;
        }
        ExecutionRecord rejected = current.failed(null, ExecutionFailure.of(ErrorType.APPROVAL_REJECTED));
        move(ExecutionState.BLOCKED, rejected);
        stores.audit().append(executionId, AuditEventType.REJECTED, Map.of(
                "approval_id", decided.approvalId(),
                "decided_by", decider,
                "error_type", ErrorType.APPROVAL_REJECTED.name(),
                "reason", ErrorType.APPROVAL_REJECTED.code()
        ));
        return rejected;
    }

    /**
     * Terminates an execution that cannot be driven further. Blocked executions are never
     * failed this way: they wait for a decision.
     */
    public ExecutionRecord failExecution(String executionId, ErrorType errorType, String reason) {
        return stores.locks().withLock(executionId, () -> {
            ExecutionRecord current = requireRecord(executionId);
            if (current.isTerminal()) {
                return current;
            }
            if (current.state() == ExecutionState.BLOCKED) {
                throw new CommandGateException(ErrorType.INVALID_STATE, "approval_pending: " + executionId);
            }
            ExecutionRecord failed = current.failed(current.agentId(), ExecutionFailure.of(errorType, reason));
            move(current.state(), failed);
            if (current.state() == ExecutionState.DISPATCHED) {
                // The capability may have run; the failure stands in for its unknown outcome.
                stores.idempotency().complete(failed);
            }
            stores.audit().append(executionId, AuditEventType.FAILED, Map.of(
                    "error_type", errorType.name(),
                    "reason", failed.failure().reason()
            ));
            return failed;
        });
    }

    public ExecutionRecord status(String executionId) {
        return requireRecord(executionId);
    }

    public Optional<ExecutionRecord> find(String executionId) {
        return stores.executions().get(executionId);
    }

    public List<ExecutionRecord> listByState(ExecutionState state) {
        return stores.executions().listByState(state);
    }

    public List<Approval> pendingApprovals() {
        return stores.approvals().listPending();
    }

    public Optional<Approval> approval(String approvalId) {
        return stores.approvals().get(approvalId);
    }

    public boolean hasEligibleAgent(String kind) {
        return router.hasEligibleAgent(kind);
    }

    private void requireDispatchable(ExecutionRecord current) {
        if (current.isDispatchable()) {
            if (current.state() == ExecutionState.APPROVED) {
                Approval approval = stores.approvals().get(current.approvalId()).orElse(null);
                if (approval == null || approval.status() != ApprovalStatus.APPROVED) {
                    throw new CommandGateException(ErrorType.INVALID_STATE,
                            "approval_not_granted: " + current.executionId());
                }
            }
            return;
        }
        String reason = switch (current.state()) {
            case BLOCKED -> "approval_pending";
            case DISPATCHED -> "execution_in_flight";
            default -> "not_dispatchable";
        };
        throw new CommandGateException(ErrorType.INVALID_STATE, reason + ": " + current.executionId());
    }

    private ExecutionRecord requireRecord(String executionId) {
        return stores.executions().get(executionId)
                .orElseThrow(() -> CommandGateException.notFound("execution", executionId));
    }

    private void move(ExecutionState expected, ExecutionRecord next) {
        if (!stores.executions().transition(expected, next)) {
            throw new IllegalStateException("Execution " + next.executionId() + " left state " + expected
                    + " concurrently");
        }
    }

    static Command validate(Command command) {
        if (command == null) {
            throw invalid("command is required");
        }
        if (command.executionId() == null || command.executionId().isBlank()) {
            throw invalid("execution_id is required");
        }
        if (command.kind() == null || command.kind().isBlank()) {
            throw invalid("kind is required");
        }
        if (command.initiator() == null || command.initiator().isBlank()) {
            throw invalid("initiator is required");
        }
        if (command.parameters() == null) {
            throw invalid("parameters are required");
        }
        if (command.commandId() == null || command.commandId().isBlank()) {
            return command.withCommandId("cmd_" + UUID.randomUUID());
        }
        return command;
    }

    private static CommandGateException invalid(String message) {
        return new CommandGateException(ErrorType.INVALID_COMMAND, message);
    }
}
