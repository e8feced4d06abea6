package io.commandgate.storage;

import io.commandgate.model.ExecutionRecord;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public final class InMemoryIdempotencyIndex implements IdempotencyIndex {
    private final Map<String, IndexEntry> entries = new ConcurrentHashMap<>();

    @Override
    public Optional<IndexEntry> lookup(String executionId) {
        return executionId == null ? Optional.empty() : Optional.ofNullable(entries.get(executionId));
    }

    @Override
    public boolean reserve(String executionId) {
        return entries.putIfAbsent(executionId, IndexEntry.processing(executionId)) == null;
    }

    @Override
    public void complete(ExecutionRecord outcome) {
        if (!outcome.isTerminal()) {
            throw new IllegalArgumentException("Only terminal outcomes can be indexed: " + outcome.executionId());
        }
        entries.put(outcome.executionId(), IndexEntry.forOutcome(outcome));
    }

    @Override
    public void release(String executionId) {
        entries.computeIfPresent(executionId, (id, entry) -> entry.committed() ? entry : null);
    }
}
