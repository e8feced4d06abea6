package io.commandgate.model;

public record ExecutionFailure(ErrorType errorType, String reason) {
    public static ExecutionFailure of(ErrorType errorType) {
        return new ExecutionFailure(errorType, errorType.code());
    }

    public static ExecutionFailure of(ErrorType errorType, String reason) {
        return new ExecutionFailure(errorType, reason == null || reason.isBlank() ? errorType.code() : reason);
    }
}
