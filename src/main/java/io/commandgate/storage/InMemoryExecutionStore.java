package io.commandgate.storage;

import io.commandgate.model.ExecutionRecord;
import io.commandgate.model.ExecutionState;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

public final class InMemoryExecutionStore implements ExecutionStore {
    private final Map<String, ExecutionRecord> records = new ConcurrentHashMap<>();

    @Override
    public boolean create(ExecutionRecord record) {
        return records.putIfAbsent(record.executionId(), record) == null;
    }

    @Override
    public Optional<ExecutionRecord> get(String executionId) {
        return executionId == null ? Optional.empty() : Optional.ofNullable(records.get(executionId));
    }

    @Override
    public boolean transition(ExecutionState expected, ExecutionRecord next) {
        ExecutionStore.checkForward(expected, next);
        AtomicBoolean applied = new AtomicBoolean(false);
        records.computeIfPresent(next.executionId(), (id, current) -> {
            if (current.state() != expected) {
                return current;
            }
            applied.set(true);
            return next;
        });
        return applied.get();
    }

    @Override
    public List<ExecutionRecord> listByState(ExecutionState state) {
        return records.values().stream()
                .filter(r -> r.state() == state)
                .sorted(Comparator.comparingLong(ExecutionRecord::createdAtMs).thenComparing(ExecutionRecord::executionId))
                .toList();
    }
}
