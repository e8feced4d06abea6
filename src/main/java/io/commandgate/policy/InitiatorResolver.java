package io.commandgate.policy;

import io.commandgate.model.InitiatorContext;
import io.commandgate.model.PrivilegeTier;
import io.commandgate.util.Hashing;

/**
 * Resolves the caller's privilege tier once per request. Only the SHA-256 of the privileged
 * credential is configured; the presented credential is compared in constant time.
 */
public final class InitiatorResolver {
    private final String privilegedCredentialSha256;

    public InitiatorResolver(String privilegedCredentialSha256) {
        this.privilegedCredentialSha256 = privilegedCredentialSha256 == null
                ? ""
                : privilegedCredentialSha256.trim().toLowerCase();
    }

    public static InitiatorResolver disabled() {
        return new InitiatorResolver("");
    }

    public InitiatorContext resolve(String initiator, String presentedCredential) {
        if (initiator == null || initiator.isBlank()) {
            throw new IllegalArgumentException("initiator cannot be empty");
        }
        String name = initiator.trim();
        if (privilegedCredentialSha256.isEmpty() || presentedCredential == null || presentedCredential.isBlank()) {
            return InitiatorContext.standard(name);
        }
        String presentedHash = Hashing.sha256Hex(presentedCredential.trim());
        if (Hashing.constantTimeEquals(presentedHash, privilegedCredentialSha256)) {
            return new InitiatorContext(name, PrivilegeTier.PRIVILEGED, presentedCredential.trim());
        }
        return InitiatorContext.standard(name);
    }
}
