package io.commandgate.runtime;

import io.commandgate.audit.AuditIntegrity;
import io.commandgate.config.CommandGateConfig;
import io.commandgate.config.RuntimeSettings;
import io.commandgate.gateway.WriteDisposition;
import io.commandgate.model.ApprovalOutcome;
import io.commandgate.model.AuditEvent;
import io.commandgate.model.AuditEventType;
import io.commandgate.model.Command;
import io.commandgate.model.ErrorType;
import io.commandgate.model.ExecutionRecord;
import io.commandgate.model.ExecutionState;
import io.commandgate.model.PolicyVerdict;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

final class CommandGateRuntimeTest {
    private static final String OPEN_WRITES = "{\"storage\":\"sqlite\",\"requireApprovalForWrites\":false}";

    @Test
    void recoveryFailsInterruptedDispatchAndRequeuesPendingWork() throws Exception {
        Path root = Files.createTempDirectory("commandgate-test-recover");
        try {
            CommandGateConfig config = new CommandGateConfig(root);
            RuntimeSettings settings = RuntimeSettings.fromJson(OPEN_WRITES);
            try (CommandGateRuntime first = CommandGateRuntime.open(config, settings, List.of())) {
                Assertions.assertEquals(WriteDisposition.ALLOWED, first.orchestrator()
                        .requestWrite(write("queued-1"), null).disposition());

                ExecutionRecord inFlight = ExecutionRecord.received(write("inflight-1")).withVerdict(PolicyVerdict.ALLOW);
                Assertions.assertTrue(first.stores().executions().create(inFlight));
                Assertions.assertTrue(first.stores().executions().transition(ExecutionState.RECEIVED, inFlight.dispatched()));

                Assertions.assertTrue(first.stores().executions()
                        .create(ExecutionRecord.received(write("half-written-1"))));
            }

            try (CommandGateRuntime second = CommandGateRuntime.open(config, settings, List.of())) {
                Orchestrator orchestrator = second.orchestrator();
                RecoveryOutcome recovery = orchestrator.recover();
                Assertions.assertTrue(recovery.interrupted().contains("inflight-1"));
                Assertions.assertTrue(recovery.interrupted().contains("half-written-1"));
                Assertions.assertEquals(List.of("queued-1"), recovery.requeued());

                Assertions.assertEquals(1, orchestrator.drain());
                Assertions.assertEquals(ExecutionState.COMPLETED, orchestrator.executionStatus("queued-1").state());

                ExecutionRecord interrupted = orchestrator.executionStatus("inflight-1");
                Assertions.assertEquals(ExecutionState.FAILED, interrupted.state());
                Assertions.assertEquals(ErrorType.DISPATCH_INTERRUPTED, interrupted.failure().errorType());
                Assertions.assertEquals("request_interrupted",
                        orchestrator.executionStatus("half-written-1").failure().reason());

                Assertions.assertTrue(orchestrator.recover().requeued().isEmpty());
                AuditIntegrity integrity = second.verifyAudit();
                Assertions.assertTrue(integrity.ok());
            }
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void recoveryResumesDecisionsStoredWhileExecutionStillBlocked() throws Exception {
        Path root = Files.createTempDirectory("commandgate-test-recover-blocked");
        try {
            CommandGateConfig config = new CommandGateConfig(root);
            RuntimeSettings settings = RuntimeSettings.fromJson("{\"storage\":\"sqlite\"}");
            String pendingApproval;
            try (CommandGateRuntime first = CommandGateRuntime.open(config, settings, List.of())) {
                Orchestrator orchestrator = first.orchestrator();
                String approveId = orchestrator.requestWrite(write("rec-1"), null).approvalId();
                String rejectId = orchestrator.requestWrite(write("rec-2"), null).approvalId();
                pendingApproval = orchestrator.requestWrite(write("rec-3"), null).approvalId();

                // Decision stored, execution transition never written.
                first.stores().approvals().decide(approveId, ApprovalOutcome.APPROVE, "ops");
                first.stores().approvals().decide(rejectId, ApprovalOutcome.REJECT, "ops");
                Assertions.assertEquals(ExecutionState.BLOCKED, orchestrator.executionStatus("rec-1").state());
            }

            try (CommandGateRuntime second = CommandGateRuntime.open(config, settings, List.of())) {
                Orchestrator orchestrator = second.orchestrator();
                second.start();

                ExecutionRecord approved = orchestrator.awaitTerminal("rec-1", Duration.ofSeconds(10));
                Assertions.assertEquals(ExecutionState.COMPLETED, approved.state());
                List<AuditEventType> types = orchestrator.auditTrail("rec-1").stream()
                        .map(AuditEvent::eventType)
                        .toList();
                Assertions.assertTrue(types.indexOf(AuditEventType.APPROVED) < types.indexOf(AuditEventType.APPLIED));

                ExecutionRecord rejected = orchestrator.executionStatus("rec-2");
                Assertions.assertEquals(ExecutionState.FAILED, rejected.state());
                Assertions.assertEquals(ErrorType.APPROVAL_REJECTED, rejected.failure().errorType());
                Assertions.assertEquals("approval_rejected", rejected.failure().reason());

                Assertions.assertEquals(ExecutionState.BLOCKED, orchestrator.executionStatus("rec-3").state());
                Assertions.assertEquals(List.of(pendingApproval), orchestrator.pendingApprovals().stream()
                        .map(a -> a.approvalId())
                        .toList());
                Assertions.assertTrue(second.verifyAudit().ok());
            }
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void startedWorkersCompleteQueuedExecutions() throws Exception {
        Path root = Files.createTempDirectory("commandgate-test-workers");
        try {
            CommandGateConfig config = new CommandGateConfig(root);
            try (CommandGateRuntime runtime = CommandGateRuntime.open(config, RuntimeSettings.fromJson(OPEN_WRITES), List.of())) {
                runtime.start();
                runtime.orchestrator().requestWrite(write("w-1"), null);
                runtime.orchestrator().requestWrite(write("w-2"), null);

                Assertions.assertEquals(ExecutionState.COMPLETED,
                        runtime.orchestrator().awaitTerminal("w-1", Duration.ofSeconds(10)).state());
                Assertions.assertEquals(ExecutionState.COMPLETED,
                        runtime.orchestrator().awaitTerminal("w-2", Duration.ofSeconds(10)).state());
            }
            Assertions.assertTrue(Files.exists(config.dbFile()));
            Assertions.assertTrue(Files.exists(config.auditFile()));
            Assertions.assertTrue(Files.exists(config.auditSigningKeyFile()));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void synchronousDispatchCommitsOnTheCallingThread() {
        CommandGateConfig config = new CommandGateConfig(Path.of("unused-root"));
        RuntimeSettings settings = RuntimeSettings.fromJson(
                "{\"storage\":\"memory\",\"synchronousDispatch\":true}");
        try (CommandGateRuntime runtime = CommandGateRuntime.open(config, settings, List.of())) {
            Orchestrator orchestrator = runtime.orchestrator();
            Assertions.assertTrue(orchestrator.isSynchronous());

            String approvalId = orchestrator.requestWrite(write("s-1"), null).approvalId();
            ExecutionRecord decided = orchestrator.decideApproval(approvalId,
                    ApprovalOutcome.APPROVE, "operator-1");
            Assertions.assertEquals(ExecutionState.COMPLETED, decided.state());
            Assertions.assertEquals(0, orchestrator.queueDepth());
        }
    }

    @Test
    void configuredAgentsReplaceTheDefaultEchoAgent() {
        CommandGateConfig config = new CommandGateConfig(Path.of("unused-root"));
        RuntimeSettings settings = RuntimeSettings.fromJson("""
                {"storage":"memory","agents":[
                  {"id":"pages","type":"echo","capabilities":["notion.create_page"],"maxConcurrency":2},
                  {"id":"broken","type":"teleport","capabilities":["*"]}
                ]}
                """);
        try (CommandGateRuntime runtime = CommandGateRuntime.open(config, settings, List.of())) {
            Assertions.assertEquals(1, runtime.agents().size());
            Assertions.assertEquals("pages", runtime.agents().get(0).agentId());
            Assertions.assertEquals(2, runtime.agents().get(0).maxConcurrency());
        }
    }

    private static Command write(String executionId) {
        return Command.write(executionId, "notion.create_page", Map.of("title", executionId), "alice");
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
