package io.commandgate.agent;

import io.commandgate.model.Command;
import io.commandgate.model.ErrorType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Routes a command to the first eligible agent in registry order. An agent is eligible when it
 * serves the kind, is healthy, is not isolated and has a free load slot. A failed execution
 * isolates its agent until {@link #rehabilitate(String)}.
 */
public final class AgentRouter {
    private static final Logger log = LoggerFactory.getLogger(AgentRouter.class);

    private final AgentRegistry registry;
    private final long slotWaitMs;
    private final Map<String, AgentState> states = new LinkedHashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition slotFreed = lock.newCondition();

    public AgentRouter(AgentRegistry registry, long slotWaitMs) {
        this.registry = registry.freeze();
        this.slotWaitMs = Math.max(0L, slotWaitMs);
        for (AgentRegistration registration : registry.all()) {
            states.put(registration.agentId(), new AgentState(registration));
        }
    }

    public Optional<AgentDescriptor> select(String kind) {
        lock.lock();
        try {
            for (AgentRegistration candidate : registry.candidatesFor(kind)) {
                AgentState state = states.get(candidate.agentId());
                if (state.eligible() && state.hasFreeSlot()) {
                    return Optional.of(state.describe());
                }
            }
            return Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    /**
     * True when some capable agent is healthy and not isolated, whether or not it is busy.
     */
    public boolean hasEligibleAgent(String kind) {
        lock.lock();
        try {
            for (AgentRegistration candidate : registry.candidatesFor(kind)) {
                if (states.get(candidate.agentId()).eligible()) {
                    return true;
                }
            }
            return false;
        } finally {
            lock.unlock();
        }
    }

    public RoutingResult execute(Command command) {
        if (Thread.currentThread().isInterrupted()) {
            return RoutingResult.fail(null, ErrorType.NO_AVAILABLE_AGENT, "interrupted_awaiting_slot");
        }
        LoadSlot slot = acquireOrNull(command.kind());
        if (slot == null) {
            return RoutingResult.fail(null, ErrorType.NO_AVAILABLE_AGENT,
                    "no_available_agent_for_kind:" + command.kind());
        }
        try (slot) {
            AgentRegistration agent = slot.state().registration;
            CapabilityRequest request = new CapabilityRequest(
                    command.executionId(), command.kind(), command.parameters(), agent.agentId(), command.readOnly());
            RoutingResult outcome = invoke(agent, request);
            if (outcome.success()) {
                recordSuccess(slot.state());
            } else {
                recordFailure(slot.state(), outcome.error());
            }
            return outcome;
        }
    }

    public void isolate(String agentId) {
        lock.lock();
        try {
            AgentState state = requireState(agentId);
            state.isolated = true;
            log.info("Agent {} isolated by operator", agentId);
        } finally {
            lock.unlock();
        }
    }

    public AgentDescriptor rehabilitate(String agentId) {
        lock.lock();
        try {
            AgentState state = requireState(agentId);
            state.isolated = false;
            state.health = AgentHealth.HEALTHY;
            slotFreed.signalAll();
            log.info("Agent {} rehabilitated", agentId);
            return state.describe();
        } finally {
            lock.unlock();
        }
    }

    public List<AgentDescriptor> snapshot() {
        lock.lock();
        try {
            List<AgentDescriptor> out = new ArrayList<>(states.size());
            for (AgentState state : states.values()) {
                out.add(state.describe());
            }
            return out;
        } finally {
            lock.unlock();
        }
    }

    private LoadSlot acquireOrNull(String kind) {
        try {
            return acquire(kind);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return null;
        }
    }

    private LoadSlot acquire(String kind) throws InterruptedException {
        long remainingNanos = TimeUnit.MILLISECONDS.toNanos(slotWaitMs);
        lock.lockInterruptibly();
        try {
            while (true) {
                boolean anyEligible = false;
                for (AgentRegistration candidate : registry.candidatesFor(kind)) {
                    AgentState state = states.get(candidate.agentId());
                    if (!state.eligible()) {
                        continue;
                    }
                    anyEligible = true;
                    if (state.hasFreeSlot()) {
                        state.load++;
                        return new LoadSlot(this, state);
                    }
                }
                if (!anyEligible || remainingNanos <= 0L) {
                    return null;
                }
                remainingNanos = slotFreed.awaitNanos(remainingNanos);
            }
        } finally {
            lock.unlock();
        }
    }

    void release(AgentState state) {
        lock.lock();
        try {
            state.load = Math.max(0, state.load - 1);
            slotFreed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    private RoutingResult invoke(AgentRegistration agent, CapabilityRequest request) {
        try {
            CapabilityResult result = agent.handler().execute(request);
            if (result == null) {
                return RoutingResult.fail(agent.agentId(), ErrorType.EXECUTOR_FAILURE, "write_failed:empty_result");
            }
            if (result.success()) {
                return RoutingResult.ok(agent.agentId(), result.output());
            }
            return RoutingResult.fail(agent.agentId(), ErrorType.EXECUTOR_FAILURE, "write_failed:" + result.error());
        } catch (PollTimeoutException e) {
            return RoutingResult.fail(agent.agentId(), ErrorType.TIMEOUT, ErrorType.TIMEOUT.code());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return RoutingResult.fail(agent.agentId(), ErrorType.EXECUTOR_FAILURE, failureReason(e));
        } catch (Exception e) {
            return RoutingResult.fail(agent.agentId(), ErrorType.EXECUTOR_FAILURE, failureReason(e));
        }
    }

    private void recordSuccess(AgentState state) {
        lock.lock();
        try {
            state.health = AgentHealth.HEALTHY;
            state.successCount++;
            state.lastSuccessAtMs = Instant.now().toEpochMilli();
        } finally {
            lock.unlock();
        }
    }

    private void recordFailure(AgentState state, String error) {
        lock.lock();
        try {
            state.health = AgentHealth.UNHEALTHY;
            state.isolated = true;
            state.failureCount++;
            state.lastError = error;
            state.lastFailureAtMs = Instant.now().toEpochMilli();
        } finally {
            lock.unlock();
        }
        log.warn("Agent {} isolated after failed execution: {}", state.registration.agentId(), error);
    }

    private AgentState requireState(String agentId) {
        AgentState state = states.get(agentId);
        if (state == null) {
            throw new IllegalArgumentException("Unknown agent: " + agentId);
        }
        return state;
    }

    static String failureReason(Exception e) {
        String message = e.getMessage() == null ? "" : e.getMessage();
        return "write_failed:" + e.getClass().getSimpleName() + ":" + message;
    }

    /**
     * Mutable routing state of one agent. Guarded by the router lock.
     */
    static final class AgentState {
        private final AgentRegistration registration;
        private AgentHealth health = AgentHealth.HEALTHY;
        private boolean isolated;
        private int load;
        private long successCount;
        private long failureCount;
        private String lastError;
        private Long lastSuccessAtMs;
        private Long lastFailureAtMs;

        AgentState(AgentRegistration registration) {
            this.registration = registration;
        }

        boolean eligible() {
            return health == AgentHealth.HEALTHY && !isolated;
        }

        boolean hasFreeSlot() {
            return load < registration.maxConcurrency();
        }

        AgentDescriptor describe() {
            return new AgentDescriptor(
                    registration.agentId(),
                    registration.handler().type(),
                    registration.capabilities(),
                    health,
                    isolated,
                    load,
                    registration.maxConcurrency(),
                    successCount,
                    failureCount,
                    lastError,
                    lastSuccessAtMs,
                    lastFailureAtMs
            );
        }
    }
}
