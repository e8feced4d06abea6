package io.commandgate.model;

import java.util.Locale;

public enum ErrorType {
    INVALID_COMMAND,
    POLICY_DENIED,
    APPROVAL_CONFLICT,
    APPROVAL_REJECTED,
    NOT_FOUND,
    INVALID_STATE,
    NO_AVAILABLE_AGENT,
    EXECUTOR_FAILURE,
    TIMEOUT,
    RETRY_EXHAUSTED,
    DISPATCH_INTERRUPTED;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
