package io.commandgate.agent;

/**
 * One reserved unit of an agent's concurrency. Closing it returns the unit; closing twice is
 * harmless.
 */
final class LoadSlot implements AutoCloseable {
    private final AgentRouter router;
    private final AgentRouter.AgentState state;
    private boolean released;

    LoadSlot(AgentRouter router, AgentRouter.AgentState state) {
        this.router = router;
        this.state = state;
    }

    AgentRouter.AgentState state() {
        return state;
    }

    @Override
    public void close() {
        if (released) {
            return;
        }
        released = true;
        router.release(state);
    }
}
