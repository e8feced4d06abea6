package io.commandgate.agent;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

public record AgentRegistration(
        String agentId,
        Set<String> capabilities,
        int maxConcurrency,
        Capability handler
) {
    public static final String ANY_KIND = "*";

    public AgentRegistration {
        if (agentId == null || agentId.isBlank()) {
            throw new IllegalArgumentException("agent id cannot be empty");
        }
        if (handler == null) {
            throw new IllegalArgumentException("agent handler cannot be null: " + agentId);
        }
        Set<String> normalized = new LinkedHashSet<>();
        if (capabilities != null) {
            for (String kind : capabilities) {
                if (kind != null && !kind.isBlank()) {
                    normalized.add(kind.trim().toLowerCase(Locale.ROOT));
                }
            }
        }
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("agent must declare at least one capability: " + agentId);
        }
        agentId = agentId.trim();
        capabilities = Set.copyOf(normalized);
        maxConcurrency = Math.max(1, maxConcurrency);
    }

    public static AgentRegistration of(String agentId, List<String> kinds, int maxConcurrency, Capability handler) {
        return new AgentRegistration(agentId, new LinkedHashSet<>(kinds), maxConcurrency, handler);
    }

    public boolean serves(String kind) {
        return capabilities.contains(ANY_KIND) || capabilities.contains(kind.trim().toLowerCase(Locale.ROOT));
    }
}
