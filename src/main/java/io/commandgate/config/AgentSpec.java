package io.commandgate.config;

import java.util.List;

/**
 * One agent entry of the settings file.
 */
public record AgentSpec(
        String id,
        String type,
        List<String> capabilities,
        Integer maxConcurrency,
        List<String> command
) {
}
