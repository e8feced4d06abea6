package io.commandgate.agent;

public final class FailCapability implements Capability {
    @Override
    public String type() {
        return "fail";
    }

    @Override
    public CapabilityResult execute(CapabilityRequest request) {
        return CapabilityResult.fail("intentional failure from fail capability");
    }
}
