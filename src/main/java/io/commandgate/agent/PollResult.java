package io.commandgate.agent;

import java.util.Map;

/**
 * One observation of a remote job.
 */
public record PollResult(Status status, Map<String, Object> result, String error) {
    public enum Status {
        PENDING,
        DONE,
        FAILED
    }

    public static PollResult pending() {
        return new PollResult(Status.PENDING, null, null);
    }

    public static PollResult done(Map<String, Object> result) {
        return new PollResult(Status.DONE, result == null ? Map.of() : result, null);
    }

    public static PollResult failed(String error) {
        return new PollResult(Status.FAILED, null, error == null ? "remote job failed" : error);
    }
}
