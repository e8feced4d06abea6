package io.commandgate.queue;

public enum JobStatus {
    QUEUED,
    PROCESSING,
    SUCCEEDED,
    FAILED;

    public boolean isActive() {
        return this == QUEUED || this == PROCESSING;
    }
}
