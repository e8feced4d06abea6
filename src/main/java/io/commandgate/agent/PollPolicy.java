package io.commandgate.agent;

import io.commandgate.config.CommandGateConfig;

public record PollPolicy(long intervalMs, int maxAttempts, long deadlineMs) {
    public PollPolicy {
        intervalMs = Math.max(1L, intervalMs);
        maxAttempts = Math.max(1, maxAttempts);
        deadlineMs = Math.max(1L, deadlineMs);
    }

    public static PollPolicy defaults() {
        return new PollPolicy(
                CommandGateConfig.DEFAULT_POLL_INTERVAL_MS,
                CommandGateConfig.DEFAULT_POLL_MAX_ATTEMPTS,
                CommandGateConfig.DEFAULT_POLL_DEADLINE_MS
        );
    }
}
