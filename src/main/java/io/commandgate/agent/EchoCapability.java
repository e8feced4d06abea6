package io.commandgate.agent;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

public final class EchoCapability implements Capability {
    @Override
    public String type() {
        return "echo";
    }

    @Override
    public CapabilityResult execute(CapabilityRequest request) {
        Map<String, Object> output = new LinkedHashMap<>();
        output.put("agent", request.agentId());
        output.put("kind", request.kind());
        output.put("execution_id", request.executionId());
        output.put("read_only", request.readOnly());
        output.put("applied_at", Instant.now().toString());
        output.put("received", request.parameters());
        return CapabilityResult.ok(output);
    }
}
