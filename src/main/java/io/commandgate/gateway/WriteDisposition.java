package io.commandgate.gateway;

public enum WriteDisposition {
    ALLOWED,
    BLOCKED,
    REJECTED
}
