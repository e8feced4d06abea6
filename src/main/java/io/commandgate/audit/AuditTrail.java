package io.commandgate.audit;

import io.commandgate.model.AuditEvent;
import io.commandgate.model.AuditEventType;

import java.util.List;
import java.util.Map;

/**
 * Append-only audit log. Events of one execution come back in append order with a
 * 1-based {@code sequence}.
 */
public interface AuditTrail {
    AuditEvent append(String executionId, AuditEventType type, Map<String, Object> details);

    List<AuditEvent> eventsFor(String executionId);

    List<AuditEvent> tail(int limit);

    AuditIntegrity verifyIntegrity();
}
