package io.commandgate.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Initiator identity resolved once per request. The credential is kept only for the lifetime of
 * the request and is never persisted.
 */
public record InitiatorContext(String initiator, PrivilegeTier tier, @JsonIgnore String credential) {
    public static InitiatorContext standard(String initiator) {
        return new InitiatorContext(initiator, PrivilegeTier.STANDARD, null);
    }

    @JsonIgnore
    public boolean privileged() {
        return tier == PrivilegeTier.PRIVILEGED;
    }

    @Override
    public String toString() {
        return "InitiatorContext[initiator=" + initiator + ", tier=" + tier + "]";
    }
}
