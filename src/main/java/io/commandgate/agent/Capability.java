package io.commandgate.agent;

/**
 * Performs the side effect for the command kinds an agent serves. Implementations need no
 * idempotency of their own: each execution id reaches a capability at most once.
 */
public interface Capability {
    String type();

    CapabilityResult execute(CapabilityRequest request) throws Exception;
}
