package io.commandgate.runtime;

import io.commandgate.audit.AuditTrail;
import io.commandgate.gateway.WriteDisposition;
import io.commandgate.gateway.WriteGateway;
import io.commandgate.gateway.WriteOutcome;
import io.commandgate.model.Approval;
import io.commandgate.model.ApprovalOutcome;
import io.commandgate.model.AuditEvent;
import io.commandgate.model.Command;
import io.commandgate.model.CommandGateException;
import io.commandgate.model.ErrorType;
import io.commandgate.model.ExecutionRecord;
import io.commandgate.model.ExecutionState;
import io.commandgate.model.InitiatorContext;
import io.commandgate.queue.ExecutionQueue;
import io.commandgate.queue.ExecutionWorker;
import io.commandgate.queue.WorkerOutcome;
import io.commandgate.queue.WorkerPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Entry point for callers. Submissions go through the gateway; allowed and approved executions
 * are handed to the queue, or committed on the calling thread when dispatch is synchronous.
 * Resubmitting a known execution id never creates a second execution.
 */
public final class Orchestrator implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(Orchestrator.class);
    private static final String DRAIN_WORKER = "drain";
    private static final long AWAIT_POLL_MS = 10L;

    private final WriteGateway gateway;
    private final ExecutionQueue queue;
    private final ExecutionWorker worker;
    private final WorkerPool workers;
    private final AuditTrail audit;
    private final boolean synchronousDispatch;

    public Orchestrator(
            WriteGateway gateway,
            ExecutionQueue queue,
            ExecutionWorker worker,
            WorkerPool workers,
            AuditTrail audit,
            boolean synchronousDispatch
    ) {
        this.gateway = gateway;
        this.queue = queue;
        this.worker = worker;
        this.workers = workers;
        this.audit = audit;
        this.synchronousDispatch = synchronousDispatch;
    }

    public ExecutionRecord submitExecution(Command command) {
        return submitExecution(command, null);
    }

    public ExecutionRecord submitExecution(Command command, InitiatorContext initiator) {
        WriteOutcome outcome = requestWrite(command, initiator);
        return gateway.status(outcome.executionId());
    }

    public WriteOutcome requestWrite(Command command, InitiatorContext initiator) {
        Optional<ExecutionRecord> existing = findExisting(command);
        if (existing.isPresent()) {
            return WriteOutcome.fromRecord(resubmit(existing.get()));
        }
        WriteOutcome outcome;
        try {
            outcome = gateway.requestWrite(command, initiator);
        } catch (CommandGateException e) {
            // Lost a race with a concurrent submission of the same execution id.
            Optional<ExecutionRecord> raced = e.errorType() == ErrorType.INVALID_STATE
                    ? findExisting(command)
                    : Optional.empty();
            if (raced.isPresent()) {
                return WriteOutcome.fromRecord(resubmit(raced.get()));
            }
            throw e;
        }
        if (outcome.disposition() != WriteDisposition.ALLOWED) {
            return outcome;
        }
        ExecutionRecord after = dispatch(outcome.executionId());
        return new WriteOutcome(outcome.executionId(), outcome.disposition(), after.state(),
                outcome.approvalId(), outcome.reason());
    }

    /**
     * Records the decision and, on approval, hands the execution to dispatch.
     */
    public ExecutionRecord decideApproval(String approvalId, ApprovalOutcome outcome, String decidedBy) {
        ExecutionRecord decided = gateway.decideApproval(approvalId, outcome, decidedBy);
        if (decided.state() == ExecutionState.APPROVED) {
            return dispatch(decided.executionId());
        }
        return decided;
    }

    public ExecutionRecord executionStatus(String executionId) {
        return gateway.status(executionId);
    }

    public List<Approval> pendingApprovals() {
        return gateway.pendingApprovals();
    }

    public Optional<Approval> approval(String approvalId) {
        return gateway.approval(approvalId);
    }

    public List<AuditEvent> auditTrail(String executionId) {
        return audit.eventsFor(executionId);
    }

    /**
     * Polls until the execution is terminal or the timeout passes, and returns the last
     * observed record either way.
     */
    public ExecutionRecord awaitTerminal(String executionId, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        ExecutionRecord current = gateway.status(executionId);
        while (!current.isTerminal() && System.nanoTime() < deadline) {
            Thread.sleep(AWAIT_POLL_MS);
            current = gateway.status(executionId);
        }
        return current;
    }

    /**
     * Runs queued jobs on the calling thread until none is left, waiting out delayed retries.
     *
     * @return number of jobs processed
     */
    public int drain() {
        int processed = 0;
        while (true) {
            WorkerOutcome outcome;
            try {
                outcome = worker.runOnce(DRAIN_WORKER, Math.max(0L, queue.millisUntilNextRetry()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return processed;
            }
            if (outcome.processed()) {
                processed++;
            } else if (queue.millisUntilNextRetry() < 0L) {
                return processed;
            }
        }
    }

    /**
     * Reconciles state left by a previous process. Must run before workers start: a DISPATCHED
     * record is taken to be abandoned and fails with {@code DISPATCH_INTERRUPTED}, since its
     * capability may or may not have run. A BLOCKED record whose approval was already decided is
     * moved on as that decision says. Dispatchable records are queued again.
     */
    public RecoveryOutcome recover() {
        List<String> interrupted = new ArrayList<>();
        for (ExecutionRecord record : gateway.listByState(ExecutionState.DISPATCHED)) {
            gateway.failExecution(record.executionId(), ErrorType.DISPATCH_INTERRUPTED, ErrorType.DISPATCH_INTERRUPTED.code());
            interrupted.add(record.executionId());
        }
        List<String> requeued = new ArrayList<>();
        for (ExecutionRecord record : gateway.listByState(ExecutionState.RECEIVED)) {
            if (record.verdict() == null) {
                gateway.failExecution(record.executionId(), ErrorType.DISPATCH_INTERRUPTED, "request_interrupted");
                interrupted.add(record.executionId());
            } else if (record.isDispatchable()) {
                queue.enqueue(record.executionId());
                requeued.add(record.executionId());
            }
        }
        for (ExecutionRecord record : gateway.listByState(ExecutionState.BLOCKED)) {
            Optional<ExecutionRecord> resumed = gateway.resumeDecided(record.executionId());
            if (resumed.isPresent()) {
                log.info("Execution {} had a stored decision but was still blocked, moved to {}",
                        record.executionId(), resumed.get().state());
            }
        }
        for (ExecutionRecord record : gateway.listByState(ExecutionState.APPROVED)) {
            queue.enqueue(record.executionId());
            requeued.add(record.executionId());
        }
        if (!interrupted.isEmpty() || !requeued.isEmpty()) {
            log.info("Recovery failed {} interrupted executions and requeued {}", interrupted.size(), requeued.size());
        }
        return new RecoveryOutcome(interrupted, requeued);
    }

    public void start() {
        recover();
        if (!synchronousDispatch) {
            workers.start();
        }
    }

    public boolean isSynchronous() {
        return synchronousDispatch;
    }

    public int queueDepth() {
        return queue.depth();
    }

    @Override
    public void close() {
        workers.close();
    }

    private ExecutionRecord resubmit(ExecutionRecord existing) {
        if (existing.isTerminal()) {
            return gateway.commitWrite(existing.executionId());
        }
        if (existing.isDispatchable()) {
            return dispatch(existing.executionId());
        }
        return existing;
    }

    private ExecutionRecord dispatch(String executionId) {
        if (!synchronousDispatch) {
            queue.enqueue(executionId);
            return gateway.status(executionId);
        }
        try {
            return gateway.commitWrite(executionId);
        } catch (CommandGateException e) {
            if (e.errorType() != ErrorType.INVALID_STATE) {
                throw e;
            }
            log.debug("Inline commit of {} skipped: {}", executionId, e.getMessage());
            return gateway.status(executionId);
        }
    }

    private Optional<ExecutionRecord> findExisting(Command command) {
        if (command == null || command.executionId() == null || command.executionId().isBlank()) {
            return Optional.empty();
        }
        return gateway.find(command.executionId());
    }
}
