package io.commandgate.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.commandgate.agent.PollPolicy;
import io.commandgate.policy.SystemFlags;
import io.commandgate.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;

public record RuntimeSettings(
        String storage,
        boolean safeMode,
        List<String> deniedKinds,
        List<String> allowedKinds,
        List<String> approvalRequiredKinds,
        boolean requireApprovalForWrites,
        List<String> privilegedKinds,
        List<String> privilegedDeniedKinds,
        String privilegedCredentialSha256,
        int workerCount,
        int retryLimit,
        long claimTimeoutMs,
        long slotWaitMs,
        long noAgentRetryDelayMs,
        long pollIntervalMs,
        int pollMaxAttempts,
        long pollDeadlineMs,
        boolean synchronousDispatch,
        List<AgentSpec> agents
) {
    public static final String STORAGE_MEMORY = "memory";
    public static final String STORAGE_SQLITE = "sqlite";

    public static RuntimeSettings defaults() {
        return new RuntimeSettings(
                STORAGE_SQLITE,
                false,
                List.of(),
                List.of(),
                List.of(),
                true,
                List.of(),
                List.of(),
                "",
                CommandGateConfig.DEFAULT_WORKER_COUNT,
                CommandGateConfig.DEFAULT_RETRY_LIMIT,
                CommandGateConfig.DEFAULT_CLAIM_TIMEOUT_MS,
                CommandGateConfig.DEFAULT_SLOT_WAIT_MS,
                CommandGateConfig.DEFAULT_NO_AGENT_RETRY_DELAY_MS,
                CommandGateConfig.DEFAULT_POLL_INTERVAL_MS,
                CommandGateConfig.DEFAULT_POLL_MAX_ATTEMPTS,
                CommandGateConfig.DEFAULT_POLL_DEADLINE_MS,
                false,
                List.of()
        );
    }

    /**
     * Reads the settings file under the config root; a missing file means defaults.
     */
    public static RuntimeSettings load(CommandGateConfig config) {
        Path file = config.settingsFile();
        if (!Files.exists(file)) {
            return defaults();
        }
        try {
            return fromJson(Files.readString(file));
        } catch (IOException e) {
            throw new RuntimeException("Failed to load runtime settings: " + file, e);
        }
    }

    public static RuntimeSettings fromJson(String json) {
        SettingsFile file = Jsons.read(json, SettingsFile.class);
        return fromFile(file, defaults());
    }

    static RuntimeSettings fromFile(SettingsFile file, RuntimeSettings defaults) {
        if (file == null) {
            return defaults;
        }
        String storage = file.storage() == null ? defaults.storage() : file.storage().trim().toLowerCase(Locale.ROOT);
        if (!STORAGE_MEMORY.equals(storage) && !STORAGE_SQLITE.equals(storage)) {
            throw new IllegalArgumentException("storage must be 'memory' or 'sqlite', got " + file.storage());
        }
        int retryLimit = file.retryLimit() == null ? defaults.retryLimit() : file.retryLimit();
        if (retryLimit < 0 || retryLimit > 1) {
            throw new IllegalArgumentException("retryLimit must be 0 or 1, got " + retryLimit);
        }
        return new RuntimeSettings(
                storage,
                sanitizeBoolean(file.safeMode(), defaults.safeMode()),
                sanitizeList(file.deniedKinds()),
                sanitizeList(file.allowedKinds()),
                sanitizeList(file.approvalRequiredKinds()),
                sanitizeBoolean(file.requireApprovalForWrites(), defaults.requireApprovalForWrites()),
                sanitizeList(file.privilegedKinds()),
                sanitizeList(file.privilegedDeniedKinds()),
                file.privilegedCredentialSha256() == null ? "" : file.privilegedCredentialSha256().trim(),
                sanitizeInt(file.workerCount(), defaults.workerCount(), 1),
                retryLimit,
                sanitizeLong(file.claimTimeoutMs(), defaults.claimTimeoutMs(), 10L),
                sanitizeLong(file.slotWaitMs(), defaults.slotWaitMs(), 0L),
                sanitizeLong(file.noAgentRetryDelayMs(), defaults.noAgentRetryDelayMs(), 0L),
                sanitizeLong(file.pollIntervalMs(), defaults.pollIntervalMs(), 1L),
                sanitizeInt(file.pollMaxAttempts(), defaults.pollMaxAttempts(), 1),
                sanitizeLong(file.pollDeadlineMs(), defaults.pollDeadlineMs(), 1L),
                sanitizeBoolean(file.synchronousDispatch(), defaults.synchronousDispatch()),
                file.agents() == null ? List.of() : List.copyOf(file.agents())
        );
    }

    public SystemFlags systemFlags() {
        return new SystemFlags(
                safeMode,
                new LinkedHashSet<>(deniedKinds),
                new LinkedHashSet<>(allowedKinds),
                new LinkedHashSet<>(approvalRequiredKinds),
                requireApprovalForWrites,
                new LinkedHashSet<>(privilegedKinds),
                new LinkedHashSet<>(privilegedDeniedKinds)
        );
    }

    public PollPolicy pollPolicy() {
        return new PollPolicy(pollIntervalMs, pollMaxAttempts, pollDeadlineMs);
    }

    @JsonIgnore
    public boolean inMemory() {
        return STORAGE_MEMORY.equals(storage);
    }

    private static List<String> sanitizeList(List<String> raw) {
        if (raw == null) {
            return List.of();
        }
        return raw.stream()
                .filter(v -> v != null && !v.isBlank())
                .map(String::trim)
                .toList();
    }

    private static int sanitizeInt(Integer raw, int fallback, int min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static boolean sanitizeBoolean(Boolean raw, boolean fallback) {
        if (raw == null) {
            return fallback;
        }
        return raw;
    }

    private static long sanitizeLong(Long raw, long fallback, long min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    record SettingsFile(
            String storage,
            Boolean safeMode,
            List<String> deniedKinds,
            List<String> allowedKinds,
            List<String> approvalRequiredKinds,
            Boolean requireApprovalForWrites,
            List<String> privilegedKinds,
            List<String> privilegedDeniedKinds,
            String privilegedCredentialSha256,
            Integer workerCount,
            Integer retryLimit,
            Long claimTimeoutMs,
            Long slotWaitMs,
            Long noAgentRetryDelayMs,
            Long pollIntervalMs,
            Integer pollMaxAttempts,
            Long pollDeadlineMs,
            Boolean synchronousDispatch,
            List<AgentSpec> agents
    ) {
    }
}
