package io.commandgate.agent;

import java.util.Map;

/**
 * {@code readOnly} is what the initiator claimed; a capability that performs writes for this kind
 * should refuse the request when it is set.
 */
public record CapabilityRequest(
        String executionId,
        String kind,
        Map<String, Object> parameters,
        String agentId,
        boolean readOnly
) {
}
