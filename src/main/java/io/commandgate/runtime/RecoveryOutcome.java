package io.commandgate.runtime;

import java.util.List;

/**
 * What a restart did: executions failed because their dispatch was cut short, and executions
 * put back on the queue.
 */
public record RecoveryOutcome(List<String> interrupted, List<String> requeued) {
    public RecoveryOutcome {
        interrupted = List.copyOf(interrupted);
        requeued = List.copyOf(requeued);
    }
}
