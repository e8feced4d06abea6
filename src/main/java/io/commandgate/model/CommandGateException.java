package io.commandgate.model;

public final class CommandGateException extends RuntimeException {
    private final ErrorType errorType;

    public CommandGateException(ErrorType errorType, String message) {
        super(message);
        this.errorType = errorType;
    }

    public ErrorType errorType() {
        return errorType;
    }

    public static CommandGateException notFound(String what, String id) {
        return new CommandGateException(ErrorType.NOT_FOUND, what + " not found: " + id);
    }
}
