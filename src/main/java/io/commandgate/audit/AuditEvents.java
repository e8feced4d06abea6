package io.commandgate.audit;

import io.commandgate.model.AuditEvent;
import io.commandgate.model.AuditEventType;
import io.commandgate.util.Hashing;
import io.commandgate.util.Jsons;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

final class AuditEvents {
    private AuditEvents() {
    }

    static AuditEvent create(String executionId, long sequence, AuditEventType type, Map<String, Object> details) {
        Map<String, Object> copy = details == null || details.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(details));
        return new AuditEvent(
                "evt_" + UUID.randomUUID(),
                executionId,
                sequence,
                type,
                Instant.now().toString(),
                digest(copy),
                copy
        );
    }

    static String digest(Map<String, Object> details) {
        return Hashing.sha256Hex(Jsons.toCanonicalJson(details == null ? Map.of() : details));
    }
}
