package io.commandgate.model;

public enum PolicyVerdict {
    ALLOW,
    DENY,
    REQUIRE_APPROVAL
}
