package io.commandgate.cli;

import io.commandgate.audit.AuditIntegrity;
import io.commandgate.config.CommandGateConfig;
import io.commandgate.gateway.WriteOutcome;
import io.commandgate.model.ApprovalOutcome;
import io.commandgate.model.Command;
import io.commandgate.model.CommandGateException;
import io.commandgate.model.ErrorType;
import io.commandgate.model.ExecutionRecord;
import io.commandgate.model.InitiatorContext;
import io.commandgate.runtime.CommandGateRuntime;
import io.commandgate.runtime.Orchestrator;
import io.commandgate.runtime.RecoveryOutcome;
import io.commandgate.util.Jsons;
import picocli.CommandLine;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;

@CommandLine.Command(
        name = "commandgate",
        mixinStandardHelpOptions = true,
        description = "Governance-gated command pipeline CLI",
        subcommands = {
                CommandGateCommand.InitCommand.class,
                CommandGateCommand.SubmitCommand.class,
                CommandGateCommand.StatusCommand.class,
                CommandGateCommand.ApprovalsCommand.class,
                CommandGateCommand.DecideCommand.class,
                CommandGateCommand.WorkerCommand.class,
                CommandGateCommand.AuditCommand.class,
                CommandGateCommand.AuditVerifyCommand.class,
                CommandGateCommand.AgentsCommand.class
        }
)
public final class CommandGateCommand implements Runnable {
    static final int EXIT_REJECTED = 2;

    @Option(names = {"--root"}, description = "Runtime data root directory", defaultValue = CommandGateConfig.DEFAULT_ROOT)
    String root;

    /**
     * Command line with the gate's error mapping: a {@link CommandGateException} prints its error
     * type and message as JSON on stderr and exits with {@value #EXIT_REJECTED}.
     */
    public static CommandLine commandLine() {
        CommandLine cmd = new CommandLine(new CommandGateCommand());
        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            if (ex instanceof CommandGateException gateError) {
                Map<String, Object> error = new LinkedHashMap<>();
                error.put("error_type", gateError.errorType().name());
                error.put("message", gateError.getMessage());
                commandLine.getErr().println(Jsons.toJson(error));
                return EXIT_REJECTED;
            }
            throw ex;
        });
        return cmd;
    }

    @Override
    public void run() {
        System.out.println("Use subcommands: init | submit | status | approvals | decide | worker | audit | audit-verify | agents");
    }

    CommandGateRuntime runtime() {
        return CommandGateRuntime.open(CommandGateConfig.fromRoot(root));
    }

    @CommandLine.Command(name = "init", description = "Initialize directories, SQLite schema and audit signing key")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        CommandGateCommand parent;

        @Override
        public Integer call() {
            try (CommandGateRuntime runtime = parent.runtime()) {
                System.out.println("Initialized CommandGate at: " + runtime.config().rootDir());
            }
            return 0;
        }
    }

    @CommandLine.Command(name = "submit", description = "Submit a command for governance and dispatch")
    static final class SubmitCommand implements Callable<Integer> {
        @ParentCommand
        CommandGateCommand parent;

        @Option(names = {"--execution-id"}, required = true, description = "Execution id, also the idempotency key")
        String executionId;

        @Option(names = {"--kind"}, required = true, description = "Command kind")
        String kind;

        @Option(names = {"--params"}, defaultValue = "{}", description = "Command parameters as a JSON object")
        String params;

        @Option(names = {"--initiator"}, required = true, description = "Initiator identity")
        String initiator;

        @Option(names = {"--credential"}, description = "Privileged credential")
        String credential;

        @Option(names = {"--read-only"}, defaultValue = "false", description = "Mark the command read-only")
        boolean readOnly;

        @Option(names = {"--requires-approval"}, defaultValue = "false", description = "Request operator approval")
        boolean requiresApproval;

        @Override
        public Integer call() {
            try (CommandGateRuntime runtime = parent.runtime()) {
                Command command = new Command(null, executionId, kind, parseParams(params), initiator, readOnly, Map.of());
                if (requiresApproval) {
                    command = command.requiringApproval();
                }
                InitiatorContext caller = runtime.resolveInitiator(initiator, credential);
                WriteOutcome outcome = runtime.orchestrator().requestWrite(command, caller);
                System.out.println(Jsons.toJson(outcome));
            }
            return 0;
        }

        private static Map<String, Object> parseParams(String raw) {
            try {
                return Jsons.readMap(raw);
            } catch (RuntimeException e) {
                throw new CommandGateException(ErrorType.INVALID_COMMAND,
                        "--params must be a JSON object: " + e.getMessage());
            }
        }
    }

    @CommandLine.Command(name = "status", description = "Show an execution record")
    static final class StatusCommand implements Callable<Integer> {
        @ParentCommand
        CommandGateCommand parent;

        @Parameters(index = "0", description = "Execution id")
        String executionId;

        @Override
        public Integer call() {
            try (CommandGateRuntime runtime = parent.runtime()) {
                ExecutionRecord record = runtime.orchestrator().executionStatus(executionId);
                System.out.println(Jsons.toJson(record));
            }
            return 0;
        }
    }

    @CommandLine.Command(name = "approvals", description = "List pending approvals")
    static final class ApprovalsCommand implements Callable<Integer> {
        @ParentCommand
        CommandGateCommand parent;

        @Override
        public Integer call() {
            try (CommandGateRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.orchestrator().pendingApprovals()));
            }
            return 0;
        }
    }

    @CommandLine.Command(name = "decide", description = "Approve or reject a pending approval")
    static final class DecideCommand implements Callable<Integer> {
        @ParentCommand
        CommandGateCommand parent;

        @Parameters(index = "0", description = "Approval id")
        String approvalId;

        @Option(names = {"--outcome"}, required = true, description = "approve|reject")
        String outcome;

        @Option(names = {"--by"}, description = "Deciding operator")
        String decidedBy;

        @Override
        public Integer call() {
            ApprovalOutcome parsed;
            try {
                parsed = ApprovalOutcome.fromString(outcome);
            } catch (IllegalArgumentException e) {
                throw new CommandGateException(ErrorType.INVALID_COMMAND, e.getMessage());
            }
            try (CommandGateRuntime runtime = parent.runtime()) {
                ExecutionRecord record = runtime.orchestrator().decideApproval(approvalId, parsed, decidedBy);
                System.out.println(Jsons.toJson(record));
            }
            return 0;
        }
    }

    @CommandLine.Command(name = "worker", description = "Run workers, or drain the queue once")
    static final class WorkerCommand implements Callable<Integer> {
        @ParentCommand
        CommandGateCommand parent;

        @Option(names = {"--once"}, defaultValue = "false", description = "Recover, process queued executions and exit")
        boolean once;

        @Override
        public Integer call() throws Exception {
            CommandGateRuntime runtime = parent.runtime();
            if (once) {
                try (runtime) {
                    Orchestrator orchestrator = runtime.orchestrator();
                    RecoveryOutcome recovered = orchestrator.recover();
                    int processed = orchestrator.drain();
                    Map<String, Object> out = new LinkedHashMap<>();
                    out.put("recovered", recovered);
                    out.put("processed", processed);
                    out.put("jobs", runtime.queue().snapshot());
                    System.out.println(Jsons.toJson(out));
                }
                return 0;
            }
            CountDownLatch stopped = new CountDownLatch(1);
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                runtime.close();
                stopped.countDown();
            }, "commandgate-shutdown-hook"));
            runtime.start();
            System.out.println("Workers running at " + runtime.config().rootDir() + "; Ctrl+C to stop");
            stopped.await();
            return 0;
        }
    }

    @CommandLine.Command(name = "audit", description = "Show the audit trail of an execution")
    static final class AuditCommand implements Callable<Integer> {
        @ParentCommand
        CommandGateCommand parent;

        @Parameters(index = "0", description = "Execution id")
        String executionId;

        @Override
        public Integer call() {
            try (CommandGateRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.orchestrator().auditTrail(executionId)));
            }
            return 0;
        }
    }

    @CommandLine.Command(name = "audit-verify", description = "Verify the audit hash chain and signatures")
    static final class AuditVerifyCommand implements Callable<Integer> {
        @ParentCommand
        CommandGateCommand parent;

        @Override
        public Integer call() {
            try (CommandGateRuntime runtime = parent.runtime()) {
                AuditIntegrity integrity = runtime.verifyAudit();
                System.out.println(Jsons.toJson(integrity));
                return integrity.ok() ? 0 : 1;
            }
        }
    }

    @CommandLine.Command(name = "agents", description = "List registered agents and their routing state")
    static final class AgentsCommand implements Callable<Integer> {
        @ParentCommand
        CommandGateCommand parent;

        @Override
        public Integer call() {
            try (CommandGateRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.agents()));
            }
            return 0;
        }
    }
}
