package io.commandgate.queue;

public enum NackOutcome {
    REQUEUED,
    FAILED
}
