package io.commandgate.policy;

import io.commandgate.model.PolicyVerdict;

public record PolicyDecision(PolicyVerdict verdict, String reason, String stage) {
    public static PolicyDecision allow(String stage) {
        return new PolicyDecision(PolicyVerdict.ALLOW, "allowed", stage);
    }

    public static PolicyDecision deny(String reason, String stage) {
        return new PolicyDecision(PolicyVerdict.DENY, reason, stage);
    }

    public static PolicyDecision requireApproval(String reason, String stage) {
        return new PolicyDecision(PolicyVerdict.REQUIRE_APPROVAL, reason, stage);
    }
}
