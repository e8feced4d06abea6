package io.commandgate.agent;

public final class PollTimeoutException extends Exception {
    private final int attempts;
    private final long elapsedMs;

    public PollTimeoutException(String jobId, int attempts, long elapsedMs) {
        super("remote job " + jobId + " still pending after " + attempts + " polls / " + elapsedMs + "ms");
        this.attempts = attempts;
        this.elapsedMs = elapsedMs;
    }

    public int attempts() {
        return attempts;
    }

    public long elapsedMs() {
        return elapsedMs;
    }
}
