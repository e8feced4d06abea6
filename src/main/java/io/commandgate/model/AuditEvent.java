package io.commandgate.model;

import java.util.Map;

public record AuditEvent(
        String eventId,
        String executionId,
        long sequence,
        AuditEventType eventType,
        String timestamp,
        String payloadDigest,
        Map<String, Object> details
) {
}
