package io.commandgate.agent;

import java.util.Set;

/**
 * Point-in-time view of one agent as seen by the router.
 */
public record AgentDescriptor(
        String agentId,
        String type,
        Set<String> capabilities,
        AgentHealth health,
        boolean isolated,
        int load,
        int maxConcurrency,
        long successCount,
        long failureCount,
        String lastError,
        Long lastSuccessAtMs,
        Long lastFailureAtMs
) {
}
