package io.commandgate.agent;

import java.util.Map;

/**
 * Base for capabilities whose side effect runs as a remote job. Subclasses start the job; the
 * poller waits for it under the configured attempt and deadline bounds.
 */
public abstract class PollingCapability implements Capability {
    private final RemoteJobPoller poller;
    private final PollPolicy policy;

    protected PollingCapability(RemoteJobPoller poller, PollPolicy policy) {
        this.poller = poller;
        this.policy = policy;
    }

    protected abstract RemoteJob start(CapabilityRequest request) throws Exception;

    @Override
    public final CapabilityResult execute(CapabilityRequest request) throws Exception {
        RemoteJob job = start(request);
        Map<String, Object> result = poller.await(job, policy);
        return CapabilityResult.ok(result);
    }
}
