package io.commandgate.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A proposed write against a system of record. {@code executionId} is its identity and its
 * idempotency key.
 */
public record Command(
        String commandId,
        String executionId,
        String kind,
        Map<String, Object> parameters,
        String initiator,
        boolean readOnly,
        Map<String, Object> metadata
) {
    public static final String REQUIRES_APPROVAL = "requires_approval";

    public Command {
        parameters = parameters == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static Command write(String executionId, String kind, Map<String, Object> parameters, String initiator) {
        return new Command(null, executionId, kind, parameters, initiator, false, Map.of());
    }

    public Command withCommandId(String id) {
        return new Command(id, executionId, kind, parameters, initiator, readOnly, metadata);
    }

    public Command requiringApproval() {
        Map<String, Object> meta = new LinkedHashMap<>(metadata);
        meta.put(REQUIRES_APPROVAL, true);
        return new Command(commandId, executionId, kind, parameters, initiator, readOnly, meta);
    }

    @JsonIgnore
    public boolean requestsApproval() {
        Object raw = metadata.get(REQUIRES_APPROVAL);
        if (raw instanceof Boolean flag) {
            return flag;
        }
        return raw != null && Boolean.parseBoolean(raw.toString());
    }
}
