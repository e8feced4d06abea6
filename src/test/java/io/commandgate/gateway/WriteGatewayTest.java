package io.commandgate.gateway;

import io.commandgate.agent.AgentRegistration;
import io.commandgate.agent.AgentRegistry;
import io.commandgate.agent.AgentRouter;
import io.commandgate.agent.Capability;
import io.commandgate.agent.CapabilityRequest;
import io.commandgate.agent.CapabilityResult;
import io.commandgate.model.Approval;
import io.commandgate.model.ApprovalOutcome;
import io.commandgate.model.ApprovalStatus;
import io.commandgate.model.AuditEvent;
import io.commandgate.model.AuditEventType;
import io.commandgate.model.Command;
import io.commandgate.model.CommandGateException;
import io.commandgate.model.ErrorType;
import io.commandgate.model.ExecutionRecord;
import io.commandgate.model.ExecutionState;
import io.commandgate.model.InitiatorContext;
import io.commandgate.policy.SystemFlags;
import io.commandgate.storage.StateStores;
import io.commandgate.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

final class WriteGatewayTest {
    private static final SystemFlags NO_WRITE_APPROVAL =
            new SystemFlags(false, Set.of(), Set.of(), Set.of(), false, Set.of(), Set.of());

    @Test
    void allowedWriteIsAppliedOnceAndReplayedAfterwards() {
        AtomicInteger invocations = new AtomicInteger();
        StateStores stores = StateStores.inMemory();
        WriteGateway gateway = gateway(stores, invocations, NO_WRITE_APPROVAL);

        WriteOutcome outcome = gateway.requestWrite(write("exec-1"), null);
        Assertions.assertEquals(WriteDisposition.ALLOWED, outcome.disposition());
        Assertions.assertEquals(ExecutionState.RECEIVED, outcome.state());
        Assertions.assertNull(outcome.approvalId());

        ExecutionRecord committed = gateway.commitWrite("exec-1");
        Assertions.assertEquals(ExecutionState.COMPLETED, committed.state());
        Assertions.assertEquals(1, committed.attemptCount());
        Assertions.assertEquals("writer", committed.agentId());

        ExecutionRecord replay = gateway.commitWrite("exec-1");
        Assertions.assertEquals(committed.result(), replay.result());
        Assertions.assertEquals(1, invocations.get());
        Assertions.assertEquals(List.of(
                AuditEventType.RECEIVED,
                AuditEventType.POLICY_EVAL,
                AuditEventType.APPLIED,
                AuditEventType.IDEMPOTENT_REPLAY
        ), types(stores.audit().eventsFor("exec-1")));
        Assertions.assertTrue(stores.idempotency().lookup("exec-1").orElseThrow().committed());
    }

    @Test
    void concurrentCommitsInvokeTheCapabilityOnce() throws Exception {
        AtomicInteger invocations = new AtomicInteger();
        StateStores stores = StateStores.inMemory();
        WriteGateway gateway = gateway(stores, invocations, NO_WRITE_APPROVAL);
        gateway.requestWrite(write("exec-race"), null);

        int racers = 8;
        ExecutorService pool = Executors.newFixedThreadPool(racers);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<ExecutionRecord>> futures = new ArrayList<>();
            for (int i = 0; i < racers; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return gateway.commitWrite("exec-race");
                }));
            }
            start.countDown();
            for (Future<ExecutionRecord> future : futures) {
                Assertions.assertEquals(ExecutionState.COMPLETED, future.get(30, TimeUnit.SECONDS).state());
            }
        } finally {
            pool.shutdownNow();
        }
        Assertions.assertEquals(1, invocations.get());
        long applied = stores.audit().eventsFor("exec-race").stream()
                .filter(e -> e.eventType() == AuditEventType.APPLIED)
                .count();
        Assertions.assertEquals(1L, applied);
    }

    @Test
    void blockedWriteCannotBeCommittedUntilApproved() {
        AtomicInteger invocations = new AtomicInteger();
        StateStores stores = StateStores.inMemory();
        WriteGateway gateway = gateway(stores, invocations, SystemFlags.defaults());

        WriteOutcome outcome = gateway.requestWrite(write("exec-1"), null);
        Assertions.assertEquals(WriteDisposition.BLOCKED, outcome.disposition());
        Assertions.assertEquals("write_requires_approval", outcome.reason());
        Assertions.assertNotNull(outcome.approvalId());

        CommandGateException premature = Assertions.assertThrows(CommandGateException.class,
                () -> gateway.commitWrite("exec-1"));
        Assertions.assertEquals(ErrorType.INVALID_STATE, premature.errorType());
        Assertions.assertEquals(0, invocations.get());
        Assertions.assertTrue(stores.idempotency().lookup("exec-1").isEmpty());

        ExecutionRecord approved = gateway.decideApproval(outcome.approvalId(), ApprovalOutcome.APPROVE, "bob");
        Assertions.assertEquals(ExecutionState.APPROVED, approved.state());
        Assertions.assertEquals(ExecutionState.COMPLETED, gateway.commitWrite("exec-1").state());
        Assertions.assertEquals(1, invocations.get());

        Assertions.assertEquals(List.of(
                AuditEventType.RECEIVED,
                AuditEventType.POLICY_EVAL,
                AuditEventType.APPROVAL_REQUIRED,
                AuditEventType.APPROVED,
                AuditEventType.APPLIED
        ), types(stores.audit().eventsFor("exec-1")));
    }

    @Test
    void approvalCreatedThroughOneGatewayIsDecidableThroughAnother() {
        AtomicInteger invocations = new AtomicInteger();
        StateStores shared = StateStores.inMemory();
        WriteGateway submitter = gateway(shared, invocations, SystemFlags.defaults());
        WriteGateway operator = gateway(shared, invocations, SystemFlags.defaults());

        WriteOutcome outcome = submitter.requestWrite(write("exec-1"), null);
        List<Approval> pending = operator.pendingApprovals();
        Assertions.assertEquals(1, pending.size());
        Assertions.assertEquals(outcome.approvalId(), pending.get(0).approvalId());
        Assertions.assertEquals("exec-1", pending.get(0).executionId());

        operator.decideApproval(outcome.approvalId(), ApprovalOutcome.APPROVE, null);
        Assertions.assertEquals(ApprovalStatus.APPROVED, submitter.approval(outcome.approvalId()).orElseThrow().status());
        Assertions.assertEquals(WriteGateway.DEFAULT_DECIDER, submitter.approval(outcome.approvalId()).orElseThrow().decidedBy());
        Assertions.assertEquals(ExecutionState.COMPLETED, submitter.commitWrite("exec-1").state());
    }

    @Test
    void rejectionIsTerminalAndSecondDecisionConflicts() {
        AtomicInteger invocations = new AtomicInteger();
        StateStores stores = StateStores.inMemory();
        WriteGateway gateway = gateway(stores, invocations, SystemFlags.defaults());
        WriteOutcome outcome = gateway.requestWrite(write("exec-1"), null);

        ExecutionRecord rejected = gateway.decideApproval(outcome.approvalId(), ApprovalOutcome.REJECT, "bob");
        Assertions.assertEquals(ExecutionState.FAILED, rejected.state());
        Assertions.assertEquals(ErrorType.APPROVAL_REJECTED, rejected.failure().errorType());
        Assertions.assertEquals("approval_rejected", rejected.failure().reason());

        CommandGateException conflict = Assertions.assertThrows(CommandGateException.class,
                () -> gateway.decideApproval(outcome.approvalId(), ApprovalOutcome.APPROVE, "carol"));
        Assertions.assertEquals(ErrorType.APPROVAL_CONFLICT, conflict.errorType());
        Assertions.assertEquals(ExecutionState.FAILED, gateway.status("exec-1").state());

        Assertions.assertEquals(ExecutionState.FAILED, gateway.commitWrite("exec-1").state());
        Assertions.assertEquals(0, invocations.get());

        CommandGateException missing = Assertions.assertThrows(CommandGateException.class,
                () -> gateway.decideApproval("apr_missing", ApprovalOutcome.APPROVE, "bob"));
        Assertions.assertEquals(ErrorType.NOT_FOUND, missing.errorType());
    }

    @Test
    void deniedWriteIsRejectedWithReason() {
        AtomicInteger invocations = new AtomicInteger();
        StateStores stores = StateStores.inMemory();
        WriteGateway gateway = gateway(stores, invocations, SystemFlags.defaults().withSafeMode(true));

        WriteOutcome outcome = gateway.requestWrite(write("exec-1"), null);
        Assertions.assertEquals(WriteDisposition.REJECTED, outcome.disposition());
        Assertions.assertEquals("safe_mode_enabled", outcome.reason());

        ExecutionRecord record = gateway.status("exec-1");
        Assertions.assertEquals(ExecutionState.FAILED, record.state());
        Assertions.assertEquals(ErrorType.POLICY_DENIED, record.failure().errorType());
        Assertions.assertTrue(stores.approvals().listPending().isEmpty());
        Assertions.assertEquals(List.of(AuditEventType.RECEIVED, AuditEventType.POLICY_EVAL, AuditEventType.REJECTED),
                types(stores.audit().eventsFor("exec-1")));

        gateway.commitWrite("exec-1");
        Assertions.assertEquals(0, invocations.get());
    }

    @Test
    void malformedCommandsLeaveNoTrace() {
        StateStores stores = StateStores.inMemory();
        WriteGateway gateway = gateway(stores, new AtomicInteger(), SystemFlags.defaults());

        List<Command> malformed = List.of(
                Command.write(" ", "update_record", Map.of(), "alice"),
                Command.write("exec-1", "", Map.of(), "alice"),
                Command.write("exec-1", "update_record", Map.of(), null),
                Command.write("exec-1", "update_record", null, "alice")
        );
        for (Command command : malformed) {
            CommandGateException error = Assertions.assertThrows(CommandGateException.class,
                    () -> gateway.requestWrite(command, null));
            Assertions.assertEquals(ErrorType.INVALID_COMMAND, error.errorType());
        }
        Assertions.assertThrows(CommandGateException.class, () -> gateway.requestWrite(null, null));
        Assertions.assertTrue(gateway.find("exec-1").isEmpty());
        Assertions.assertTrue(stores.audit().tail(10).isEmpty());

        CommandGateException unknown = Assertions.assertThrows(CommandGateException.class,
                () -> gateway.commitWrite("exec-unknown"));
        Assertions.assertEquals(ErrorType.NOT_FOUND, unknown.errorType());
    }

    @Test
    void duplicateExecutionIdIsRefused() {
        WriteGateway gateway = gateway(StateStores.inMemory(), new AtomicInteger(), NO_WRITE_APPROVAL);
        gateway.requestWrite(write("exec-1"), null);

        CommandGateException duplicate = Assertions.assertThrows(CommandGateException.class,
                () -> gateway.requestWrite(write("exec-1"), InitiatorContext.standard("mallory")));
        Assertions.assertEquals(ErrorType.INVALID_STATE, duplicate.errorType());
        Assertions.assertEquals("alice", gateway.status("exec-1").command().initiator());
    }

    @Test
    void generatesCommandIdWhenMissing() {
        WriteGateway gateway = gateway(StateStores.inMemory(), new AtomicInteger(), NO_WRITE_APPROVAL);
        gateway.requestWrite(write("exec-1"), null);
        Assertions.assertTrue(gateway.status("exec-1").command().commandId().startsWith("cmd_"));
    }

    @Test
    void secretsInParametersNeverReachTheAuditTrail() {
        StateStores stores = StateStores.inMemory();
        WriteGateway gateway = gateway(stores, new AtomicInteger(), NO_WRITE_APPROVAL);
        gateway.requestWrite(Command.write("exec-1", "update_record",
                Map.of("user", "alice", "password", "hunter2-super-secret"), "alice"), null);
        gateway.commitWrite("exec-1");

        String trail = Jsons.toJson(stores.audit().eventsFor("exec-1"));
        Assertions.assertFalse(trail.contains("hunter2-super-secret"));
        Assertions.assertTrue(stores.audit().eventsFor("exec-1").get(0).details().containsKey("parameters_digest"));
    }

    @Test
    void blockedExecutionCannotBeFailedAdministratively() {
        WriteGateway gateway = gateway(StateStores.inMemory(), new AtomicInteger(), SystemFlags.defaults());
        gateway.requestWrite(write("exec-1"), null);

        CommandGateException error = Assertions.assertThrows(CommandGateException.class,
                () -> gateway.failExecution("exec-1", ErrorType.RETRY_EXHAUSTED, "retry_exhausted"));
        Assertions.assertEquals(ErrorType.INVALID_STATE, error.errorType());
        Assertions.assertEquals(ExecutionState.BLOCKED, gateway.status("exec-1").state());
    }

    private static WriteGateway gateway(StateStores stores, AtomicInteger invocations, SystemFlags flags) {
        Capability counting = new Capability() {
            @Override
            public String type() {
                return "counting";
            }

            @Override
            public CapabilityResult execute(CapabilityRequest request) {
                int n = invocations.incrementAndGet();
                return CapabilityResult.ok(Map.of("invocation", n, "execution_id", request.executionId()));
            }
        };
        AgentRegistry registry = new AgentRegistry()
                .register(AgentRegistration.of("writer", List.of("*"), 4, counting));
        return new WriteGateway(stores, new AgentRouter(registry, 0L), () -> flags);
    }

    private static Command write(String executionId) {
        return Command.write(executionId, "update_record", Map.of("id", 7), "alice");
    }

    private static List<AuditEventType> types(List<AuditEvent> events) {
        return events.stream().map(AuditEvent::eventType).toList();
    }
}
