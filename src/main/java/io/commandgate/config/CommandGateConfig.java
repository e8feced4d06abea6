package io.commandgate.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class CommandGateConfig {
    public static final String DEFAULT_ROOT = "data";
    public static final String SETTINGS_FILE = "commandgate-settings.json";
    public static final int DEFAULT_WORKER_COUNT = 2;
    public static final int DEFAULT_RETRY_LIMIT = 1;
    public static final long DEFAULT_CLAIM_TIMEOUT_MS = 200L;
    public static final long DEFAULT_SLOT_WAIT_MS = 2_000L;
    public static final long DEFAULT_NO_AGENT_RETRY_DELAY_MS = 250L;
    public static final long DEFAULT_POLL_INTERVAL_MS = 500L;
    public static final int DEFAULT_POLL_MAX_ATTEMPTS = 120;
    public static final long DEFAULT_POLL_DEADLINE_MS = 60_000L;

    private final Path rootDir;

    public CommandGateConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static CommandGateConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        return new CommandGateConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path dbFile() {
        return rootDir.resolve("commandgate.db");
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE);
    }

    public Path auditRoot() {
        return rootDir.resolve("audit");
    }

    public Path auditFile() {
        return auditRoot().resolve("audit.log");
    }

    public Path securityRoot() {
        return rootDir.resolve("security");
    }

    public Path auditSigningKeyFile() {
        return securityRoot().resolve("audit-signing.key");
    }
}
