package io.commandgate.audit;

import io.commandgate.model.AuditEvent;
import io.commandgate.model.AuditEventType;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-local trail. Each execution's event list is replaced on append, so readers always see
 * an immutable snapshot and appends for different executions do not contend.
 */
public final class InMemoryAuditTrail implements AuditTrail {
    private final Map<String, List<AuditEvent>> byExecution = new ConcurrentHashMap<>();
    private final ConcurrentLinkedDeque<AuditEvent> all = new ConcurrentLinkedDeque<>();

    @Override
    public AuditEvent append(String executionId, AuditEventType type, Map<String, Object> details) {
        AtomicReference<AuditEvent> appended = new AtomicReference<>();
        byExecution.compute(executionId, (id, events) -> {
            List<AuditEvent> out = events == null ? new ArrayList<>() : new ArrayList<>(events);
            AuditEvent event = AuditEvents.create(id, out.size() + 1L, type, details);
            out.add(event);
            all.addLast(event);
            appended.set(event);
            return List.copyOf(out);
        });
        return appended.get();
    }

    @Override
    public List<AuditEvent> eventsFor(String executionId) {
        return byExecution.getOrDefault(executionId, List.of());
    }

    @Override
    public List<AuditEvent> tail(int limit) {
        List<AuditEvent> snapshot = new ArrayList<>(all);
        int from = Math.max(0, snapshot.size() - Math.max(1, limit));
        return List.copyOf(snapshot.subList(from, snapshot.size()));
    }

    @Override
    public AuditIntegrity verifyIntegrity() {
        int rows = all.size();
        return AuditIntegrity.intact(rows, rows == 0 ? "" : all.peekLast().payloadDigest());
    }
}
