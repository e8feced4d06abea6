package io.commandgate.model;

public enum PrivilegeTier {
    STANDARD,
    PRIVILEGED
}
