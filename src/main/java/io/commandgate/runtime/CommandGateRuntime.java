package io.commandgate.runtime;

import io.commandgate.agent.AgentDescriptor;
import io.commandgate.agent.AgentRegistration;
import io.commandgate.agent.AgentRegistry;
import io.commandgate.agent.AgentRouter;
import io.commandgate.agent.Capability;
import io.commandgate.agent.EchoCapability;
import io.commandgate.agent.FailCapability;
import io.commandgate.agent.RemoteJobPoller;
import io.commandgate.agent.ScriptCapability;
import io.commandgate.audit.AuditIntegrity;
import io.commandgate.audit.AuditTrail;
import io.commandgate.audit.FileAuditTrail;
import io.commandgate.config.AgentSpec;
import io.commandgate.config.CommandGateConfig;
import io.commandgate.config.RuntimeSettings;
import io.commandgate.gateway.WriteGateway;
import io.commandgate.model.InitiatorContext;
import io.commandgate.policy.InitiatorResolver;
import io.commandgate.policy.SystemFlags;
import io.commandgate.queue.ExecutionQueue;
import io.commandgate.queue.ExecutionWorker;
import io.commandgate.queue.WorkerPool;
import io.commandgate.security.AuditSigningKeys;
import io.commandgate.storage.Database;
import io.commandgate.storage.StateStores;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Composition root. Builds one set of shared stores, the agent registry and router, the gateway,
 * the queue with its workers and the orchestrator from a config root and its settings.
 */
public final class CommandGateRuntime implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(CommandGateRuntime.class);
    private static final int POLLER_THREADS = 2;

    private final CommandGateConfig config;
    private final RuntimeSettings settings;
    private final StateStores stores;
    private final RemoteJobPoller poller;
    private final AgentRouter router;
    private final InitiatorResolver initiators;
    private final ExecutionQueue queue;
    private final Orchestrator orchestrator;
    private volatile SystemFlags flags;

    private CommandGateRuntime(
            CommandGateConfig config,
            RuntimeSettings settings,
            StateStores stores,
            RemoteJobPoller poller,
            AgentRegistry registry
    ) {
        this.config = config;
        this.settings = settings;
        this.stores = stores;
        this.poller = poller;
        this.flags = settings.systemFlags();
        this.router = new AgentRouter(registry, settings.slotWaitMs());
        this.initiators = new InitiatorResolver(settings.privilegedCredentialSha256());
        WriteGateway gateway = new WriteGateway(stores, router, () -> flags);
        this.queue = new ExecutionQueue(settings.retryLimit());
        ExecutionWorker worker = new ExecutionWorker(queue, gateway, settings.noAgentRetryDelayMs());
        WorkerPool workers = new WorkerPool(worker, settings.workerCount(), settings.claimTimeoutMs());
        this.orchestrator = new Orchestrator(gateway, queue, worker, workers, stores.audit(),
                settings.synchronousDispatch());
    }

    public static CommandGateRuntime open(CommandGateConfig config) {
        return open(config, RuntimeSettings.load(config), List.of());
    }

    /**
     * @param extraAgents registered after the configured agents, so they route last
     */
    public static CommandGateRuntime open(
            CommandGateConfig config,
            RuntimeSettings settings,
            List<AgentRegistration> extraAgents
    ) {
        StateStores stores;
        if (settings.inMemory()) {
            stores = StateStores.inMemory();
        } else {
            Database database = new Database(config);
            database.init();
            String secret = AuditSigningKeys.loadOrCreate(config.auditSigningKeyFile());
            stores = StateStores.sqlite(database, new FileAuditTrail(config.auditFile(), secret));
        }
        RemoteJobPoller poller = RemoteJobPoller.create(POLLER_THREADS);
        AgentRegistry registry = new AgentRegistry();
        for (AgentSpec spec : settings.agents()) {
            registerConfigured(registry, config, settings, poller, spec);
        }
        for (AgentRegistration extra : extraAgents) {
            registry.register(extra);
        }
        if (registry.isEmpty()) {
            registry.register(AgentRegistration.of("echo", List.of(AgentRegistration.ANY_KIND), 4, new EchoCapability()));
        }
        registry.freeze();
        log.info("Runtime opened at {} (storage={}, agents={})", config.rootDir(), settings.storage(), registry.all().size());
        return new CommandGateRuntime(config, settings, stores, poller, registry);
    }

    public Orchestrator orchestrator() {
        return orchestrator;
    }

    public StateStores stores() {
        return stores;
    }

    public RuntimeSettings settings() {
        return settings;
    }

    public CommandGateConfig config() {
        return config;
    }

    public RemoteJobPoller poller() {
        return poller;
    }

    public ExecutionQueue queue() {
        return queue;
    }

    public InitiatorContext resolveInitiator(String initiator, String credential) {
        return initiators.resolve(initiator, credential);
    }

    public SystemFlags flags() {
        return flags;
    }

    public void setSafeMode(boolean enabled) {
        flags = flags.withSafeMode(enabled);
        log.info("Safe mode {}", enabled ? "enabled" : "disabled");
    }

    public List<AgentDescriptor> agents() {
        return router.snapshot();
    }

    public void isolateAgent(String agentId) {
        router.isolate(agentId);
    }

    public AgentDescriptor rehabilitateAgent(String agentId) {
        return router.rehabilitate(agentId);
    }

    public AuditTrail audit() {
        return stores.audit();
    }

    public AuditIntegrity verifyAudit() {
        return stores.audit().verifyIntegrity();
    }

    public void start() {
        orchestrator.start();
    }

    @Override
    public void close() {
        orchestrator.close();
        poller.close();
    }

    private static void registerConfigured(
            AgentRegistry registry,
            CommandGateConfig config,
            RuntimeSettings settings,
            RemoteJobPoller poller,
            AgentSpec spec
    ) {
        if (spec == null || spec.id() == null || spec.id().isBlank()) {
            log.warn("Skipping agent entry without id");
            return;
        }
        try {
            String type = spec.type() == null ? "echo" : spec.type().trim().toLowerCase(Locale.ROOT);
            Capability handler = switch (type) {
                case "echo" -> new EchoCapability();
                case "fail" -> new FailCapability();
                case "script" -> new ScriptCapability(resolveScriptCommand(config, spec.command()), poller,
                        settings.pollPolicy());
                default -> throw new IllegalArgumentException("unknown agent type: " + spec.type());
            };
            List<String> kinds = spec.capabilities() == null || spec.capabilities().isEmpty()
                    ? List.of(AgentRegistration.ANY_KIND)
                    : spec.capabilities();
            int maxConcurrency = spec.maxConcurrency() == null ? 1 : spec.maxConcurrency();
            registry.register(AgentRegistration.of(spec.id(), kinds, maxConcurrency, handler));
        } catch (IllegalArgumentException e) {
            log.warn("Skipping agent {}: {}", spec.id(), e.getMessage());
        }
    }

    private static List<String> resolveScriptCommand(CommandGateConfig config, List<String> rawCommand) {
        if (rawCommand == null) {
            throw new IllegalArgumentException("script command is required");
        }
        List<String> resolved = new ArrayList<>(rawCommand.size());
        for (String token : rawCommand) {
            if (token == null || token.isBlank()) {
                continue;
            }
            Path candidate = config.rootDir().resolve(token).normalize();
            if (Files.exists(candidate)) {
                resolved.add(candidate.toString());
            } else {
                resolved.add(token);
            }
        }
        if (resolved.isEmpty()) {
            throw new IllegalArgumentException("script command became empty after normalization");
        }
        return resolved;
    }
}
