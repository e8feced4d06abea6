package io.commandgate.model;

public enum ApprovalStatus {
    PENDING,
    APPROVED,
    REJECTED
}
