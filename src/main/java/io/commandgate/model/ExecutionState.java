package io.commandgate.model;

public enum ExecutionState {
    RECEIVED,
    BLOCKED,
    APPROVED,
    DISPATCHED,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * Forward-only transition table. Terminal states accept nothing.
     */
    public boolean canTransitionTo(ExecutionState next) {
        return switch (this) {
            case RECEIVED -> next == BLOCKED || next == DISPATCHED || next == FAILED;
            case BLOCKED -> next == APPROVED || next == FAILED;
            case APPROVED -> next == DISPATCHED || next == FAILED;
            case DISPATCHED -> next == COMPLETED || next == FAILED;
            case COMPLETED, FAILED -> false;
        };
    }
}
