package io.commandgate.agent;

import java.util.Map;

public record CapabilityResult(
        boolean success,
        Map<String, Object> output,
        String error
) {
    public static CapabilityResult ok(Map<String, Object> output) {
        return new CapabilityResult(true, output == null ? Map.of() : output, null);
    }

    public static CapabilityResult fail(String error) {
        return new CapabilityResult(false, null, error);
    }
}
