package io.commandgate.model;

import java.util.Locale;

public enum ApprovalOutcome {
    APPROVE,
    REJECT;

    public static ApprovalOutcome fromString(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("approval outcome cannot be empty");
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "approve", "approved" -> APPROVE;
            case "reject", "rejected" -> REJECT;
            default -> throw new IllegalArgumentException("Unsupported approval outcome: " + raw);
        };
    }

    public ApprovalStatus toStatus() {
        return this == APPROVE ? ApprovalStatus.APPROVED : ApprovalStatus.REJECTED;
    }
}
