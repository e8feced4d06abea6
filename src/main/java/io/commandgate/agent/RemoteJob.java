package io.commandgate.agent;

/**
 * Handle on a long-running job started by a capability on an external system.
 */
public interface RemoteJob {
    String jobId();

    PollResult poll() throws Exception;

    /**
     * Best-effort cancellation once the caller stops waiting.
     */
    default void cancel() {
    }
}
