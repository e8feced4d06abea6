package io.commandgate.model;

public enum AuditEventType {
    RECEIVED,
    POLICY_EVAL,
    REJECTED,
    APPROVAL_REQUIRED,
    APPROVED,
    APPLIED,
    FAILED,
    IDEMPOTENT_REPLAY
}
