package io.commandgate.storage;

import io.commandgate.model.ExecutionRecord;

import java.util.Optional;

/**
 * execution_id to committed outcome. A side effect may only be started by the caller that won
 * {@link #reserve(String)} for that execution id.
 */
public interface IdempotencyIndex {
    Optional<IndexEntry> lookup(String executionId);

    /**
     * Claims the execution id for a commit in progress.
     *
     * @return false when any entry, reserved or committed, already exists
     */
    boolean reserve(String executionId);

    /**
     * Replaces the reservation with the terminal outcome.
     */
    void complete(ExecutionRecord outcome);

    /**
     * Drops a reservation whose commit never reached the capability.
     */
    void release(String executionId);
}
