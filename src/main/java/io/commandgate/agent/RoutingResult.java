package io.commandgate.agent;

import io.commandgate.model.ErrorType;

import java.util.Map;

public record RoutingResult(
        boolean success,
        String agentId,
        Map<String, Object> result,
        ErrorType errorType,
        String error
) {
    public static RoutingResult ok(String agentId, Map<String, Object> result) {
        return new RoutingResult(true, agentId, result, null, null);
    }

    public static RoutingResult fail(String agentId, ErrorType errorType, String error) {
        return new RoutingResult(false, agentId, null, errorType, error);
    }
}
