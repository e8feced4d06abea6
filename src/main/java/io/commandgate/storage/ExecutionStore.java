package io.commandgate.storage;

import io.commandgate.model.ExecutionRecord;
import io.commandgate.model.ExecutionState;

import java.util.List;
import java.util.Optional;

public interface ExecutionStore {
    /**
     * Inserts a new record.
     *
     * @return false when a record with the same execution id already exists
     */
    boolean create(ExecutionRecord record);

    Optional<ExecutionRecord> get(String executionId);

    /**
     * Compare-and-set on state: stores {@code next} only if the stored record is still in
     * {@code expected}. Moving backwards or out of a terminal state is refused.
     *
     * @return false when the stored state no longer matches
     */
    boolean transition(ExecutionState expected, ExecutionRecord next);

    List<ExecutionRecord> listByState(ExecutionState state);

    static void checkForward(ExecutionState expected, ExecutionRecord next) {
        if (expected != next.state() && !expected.canTransitionTo(next.state())) {
            throw new IllegalStateException("Illegal execution transition " + expected + " -> " + next.state()
                    + " for " + next.executionId());
        }
    }
}
