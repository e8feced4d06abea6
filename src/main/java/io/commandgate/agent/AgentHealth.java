package io.commandgate.agent;

public enum AgentHealth {
    HEALTHY,
    UNHEALTHY
}
