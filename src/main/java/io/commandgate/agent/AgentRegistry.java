package io.commandgate.agent;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Static agent registry. Registration order is routing order. {@link #freeze()} resolves the
 * kind-to-candidates table once; after that the registry is read-only.
 */
public final class AgentRegistry {
    private final Map<String, AgentRegistration> agents = new LinkedHashMap<>();
    private volatile Map<String, List<AgentRegistration>> candidatesByKind;
    private volatile List<AgentRegistration> wildcardAgents;

    public synchronized AgentRegistry register(AgentRegistration registration) {
        if (candidatesByKind != null) {
            throw new IllegalStateException("Agent registry is frozen; cannot register " + registration.agentId());
        }
        if (agents.putIfAbsent(registration.agentId(), registration) != null) {
            throw new IllegalArgumentException("Duplicate agent id: " + registration.agentId());
        }
        return this;
    }

    public synchronized AgentRegistry freeze() {
        if (candidatesByKind != null) {
            return this;
        }
        Set<String> kinds = new LinkedHashSet<>();
        List<AgentRegistration> wildcard = new ArrayList<>();
        for (AgentRegistration registration : agents.values()) {
            for (String kind : registration.capabilities()) {
                if (!AgentRegistration.ANY_KIND.equals(kind)) {
                    kinds.add(kind);
                }
            }
            if (registration.capabilities().contains(AgentRegistration.ANY_KIND)) {
                wildcard.add(registration);
            }
        }
        Map<String, List<AgentRegistration>> index = new LinkedHashMap<>();
        for (String kind : kinds) {
            List<AgentRegistration> candidates = new ArrayList<>();
            for (AgentRegistration registration : agents.values()) {
                if (registration.serves(kind)) {
                    candidates.add(registration);
                }
            }
            index.put(kind, List.copyOf(candidates));
        }
        wildcardAgents = List.copyOf(wildcard);
        candidatesByKind = Map.copyOf(index);
        return this;
    }

    public boolean isFrozen() {
        return candidatesByKind != null;
    }

    public synchronized boolean isEmpty() {
        return agents.isEmpty();
    }

    public synchronized Optional<AgentRegistration> findById(String agentId) {
        return Optional.ofNullable(agents.get(agentId));
    }

    public synchronized List<AgentRegistration> all() {
        return List.copyOf(agents.values());
    }

    public List<AgentRegistration> candidatesFor(String kind) {
        Map<String, List<AgentRegistration>> index = candidatesByKind;
        if (index == null) {
            throw new IllegalStateException("Agent registry must be frozen before routing");
        }
        if (kind == null || kind.isBlank()) {
            return List.of();
        }
        return index.getOrDefault(kind.trim().toLowerCase(Locale.ROOT), wildcardAgents);
    }
}
