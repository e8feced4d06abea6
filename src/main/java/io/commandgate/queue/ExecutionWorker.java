package io.commandgate.queue;

import io.commandgate.gateway.WriteGateway;
import io.commandgate.model.CommandGateException;
import io.commandgate.model.ErrorType;
import io.commandgate.model.ExecutionRecord;
import io.commandgate.model.ExecutionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Drives one claimed job through the gateway. Routing unavailability is retried within the
 * queue's bound; the final attempt commits anyway so the execution ends FAILED with
 * {@code NO_AVAILABLE_AGENT} instead of lingering. That retry is held back by
 * {@code noAgentRetryDelayMs} so a slot can free up or an operator can rehabilitate an agent.
 */
public final class ExecutionWorker {
    private static final Logger log = LoggerFactory.getLogger(ExecutionWorker.class);

    private final ExecutionQueue queue;
    private final WriteGateway gateway;
    private final long noAgentRetryDelayMs;

    public ExecutionWorker(ExecutionQueue queue, WriteGateway gateway) {
        this(queue, gateway, 0L);
    }

    public ExecutionWorker(ExecutionQueue queue, WriteGateway gateway, long noAgentRetryDelayMs) {
        this.queue = queue;
        this.gateway = gateway;
        this.noAgentRetryDelayMs = Math.max(0L, noAgentRetryDelayMs);
    }

    public WorkerOutcome runOnce(String workerId, long claimTimeoutMs) throws InterruptedException {
        Optional<Job> claimed = queue.claim(claimTimeoutMs);
        if (claimed.isEmpty()) {
            return WorkerOutcome.idle(workerId);
        }
        return process(workerId, claimed.get());
    }

    WorkerOutcome process(String workerId, Job job) {
        String executionId = job.executionId();
        try {
            ExecutionRecord current = gateway.status(executionId);
            if (current.state() == ExecutionState.BLOCKED) {
                queue.ack(job.jobId());
                return outcome(workerId, job, current.state(), "Awaiting approval");
            }
            if (current.isDispatchable() && !job.isFinalAttempt()
                    && !gateway.hasEligibleAgent(current.command().kind())) {
                queue.nack(job.jobId(), ErrorType.NO_AVAILABLE_AGENT.code(), true, noAgentRetryDelayMs);
                log.info("No eligible agent for {} ({}), retry in {} ms", executionId, current.command().kind(),
                        noAgentRetryDelayMs);
                return outcome(workerId, job, current.state(), "Retry scheduled: no eligible agent");
            }
            ExecutionRecord committed = gateway.commitWrite(executionId);
            queue.ack(job.jobId());
            return outcome(workerId, job, committed.state(), "Committed");
        } catch (CommandGateException e) {
            if (e.errorType() == ErrorType.INVALID_STATE || e.errorType() == ErrorType.NOT_FOUND) {
                queue.nack(job.jobId(), e.getMessage(), false);
                log.warn("Dropping job {} for {}: {}", job.jobId(), executionId, e.getMessage());
                return outcome(workerId, job, null, "Dropped: " + e.getMessage());
            }
            return retryOrFail(workerId, job, e);
        } catch (RuntimeException e) {
            return retryOrFail(workerId, job, e);
        }
    }

    private WorkerOutcome retryOrFail(String workerId, Job job, RuntimeException error) {
        String message = error.getClass().getSimpleName() + ":" + error.getMessage();
        NackOutcome nack = queue.nack(job.jobId(), message, true);
        if (nack == NackOutcome.REQUEUED) {
            log.warn("Job {} for {} failed on attempt {}, requeued: {}", job.jobId(), job.executionId(), job.attempts(), message);
            return outcome(workerId, job, null, "Requeued after error: " + message);
        }
        log.error("Job {} for {} exhausted its retries: {}", job.jobId(), job.executionId(), message, error);
        ExecutionRecord failed = gateway.failExecution(job.executionId(), ErrorType.RETRY_EXHAUSTED,
                ErrorType.RETRY_EXHAUSTED.code() + ":" + message);
        return outcome(workerId, job, failed.state(), "Failed after retries: " + message);
    }

    private static WorkerOutcome outcome(String workerId, Job job, ExecutionState state, String message) {
        return new WorkerOutcome(workerId, true, job.jobId(), job.executionId(), state, message);
    }
}
