package io.commandgate.policy;

import io.commandgate.model.Command;
import io.commandgate.model.InitiatorContext;

/**
 * Pure policy function. The privilege tier is consulted first: a privileged initiator is judged
 * only by the privilege-scoped lists, never by the blanket restrictions meant for standard
 * initiators. An approval the command itself asks for is honoured for every tier.
 * <p>
 * {@code readOnly} is the caller's claim. It only exempts a command from safe mode and from
 * approval when nothing else marks the command as governed: a command that requests approval, or
 * whose kind requires one, is treated as a write.
 */
public final class PolicyEvaluator {
    static final String STAGE_PRIVILEGE = "privilege_scope";
    static final String STAGE_BLANKET = "blanket_restriction";
    static final String STAGE_APPROVAL = "approval";

    private PolicyEvaluator() {
    }

    public static PolicyDecision evaluate(InitiatorContext initiator, Command command, SystemFlags flags) {
        if (initiator != null && initiator.privileged()) {
            PolicyDecision scoped = privilegeScoped(command, flags);
            if (scoped != null) {
                return scoped;
            }
            return explicitApproval(command, flags, false);
        }
        PolicyDecision blanket = blanketRestrictions(command, flags);
        if (blanket != null) {
            return blanket;
        }
        return explicitApproval(command, flags, flags.requireApprovalForWrites());
    }

    private static PolicyDecision privilegeScoped(Command command, SystemFlags flags) {
        if (SystemFlags.matches(flags.privilegedDeniedKinds(), command.kind())) {
            return PolicyDecision.deny("privileged_kind_denied", STAGE_PRIVILEGE);
        }
        if (!flags.privilegedKinds().isEmpty() && !SystemFlags.matches(flags.privilegedKinds(), command.kind())) {
            return PolicyDecision.deny("privileged_kind_out_of_scope", STAGE_PRIVILEGE);
        }
        return null;
    }

    private static PolicyDecision blanketRestrictions(Command command, SystemFlags flags) {
        if (flags.safeMode() && !treatedAsRead(command, flags)) {
            return PolicyDecision.deny("safe_mode_enabled", STAGE_BLANKET);
        }
        if (SystemFlags.matches(flags.deniedKinds(), command.kind())) {
            return PolicyDecision.deny("kind_denied", STAGE_BLANKET);
        }
        if (!flags.allowedKinds().isEmpty() && !SystemFlags.matches(flags.allowedKinds(), command.kind())) {
            return PolicyDecision.deny("kind_not_allowed", STAGE_BLANKET);
        }
        return null;
    }

    private static PolicyDecision explicitApproval(Command command, SystemFlags flags, boolean writesNeedApproval) {
        if (command.requestsApproval()) {
            return PolicyDecision.requireApproval("approval_requested", STAGE_APPROVAL);
        }
        if (SystemFlags.matches(flags.approvalRequiredKinds(), command.kind())) {
            return PolicyDecision.requireApproval("kind_requires_approval", STAGE_APPROVAL);
        }
        if (writesNeedApproval && !command.readOnly()) {
            return PolicyDecision.requireApproval("write_requires_approval", STAGE_APPROVAL);
        }
        return PolicyDecision.allow(STAGE_APPROVAL);
    }

    static boolean treatedAsRead(Command command, SystemFlags flags) {
        return command.readOnly()
                && !command.requestsApproval()
                && !SystemFlags.matches(flags.approvalRequiredKinds(), command.kind());
    }
}
