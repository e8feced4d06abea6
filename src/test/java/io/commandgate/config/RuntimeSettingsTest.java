package io.commandgate.config;

import io.commandgate.policy.SystemFlags;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

final class RuntimeSettingsTest {
    @Test
    void missingSettingsFileFallsBackToDefaults() throws Exception {
        Path root = Files.createTempDirectory("commandgate-test-settings");
        try {
            RuntimeSettings settings = RuntimeSettings.load(new CommandGateConfig(root));
            Assertions.assertEquals(RuntimeSettings.STORAGE_SQLITE, settings.storage());
            Assertions.assertTrue(settings.requireApprovalForWrites());
            Assertions.assertFalse(settings.safeMode());
            Assertions.assertEquals(CommandGateConfig.DEFAULT_RETRY_LIMIT, settings.retryLimit());
            Assertions.assertTrue(settings.agents().isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void settingsFileOverridesDefaultsAndFeedsPolicyFlags() throws Exception {
        Path root = Files.createTempDirectory("commandgate-test-settings");
        try {
            CommandGateConfig config = new CommandGateConfig(root);
            Files.writeString(config.settingsFile(), """
                    {
                      "storage": " Memory ",
                      "safeMode": true,
                      "deniedKinds": ["wipe", " ", "drop_table "],
                      "approvalRequiredKinds": ["notion.delete_page"],
                      "requireApprovalForWrites": false,
                      "workerCount": 0,
                      "retryLimit": 0,
                      "pollMaxAttempts": 3,
                      "agents": [{"id": "pages", "type": "echo", "capabilities": ["notion.create_page"]}]
                    }
                    """);
            RuntimeSettings settings = RuntimeSettings.load(config);

            Assertions.assertTrue(settings.inMemory());
            Assertions.assertEquals(1, settings.workerCount());
            Assertions.assertEquals(0, settings.retryLimit());
            Assertions.assertEquals(3, settings.pollPolicy().maxAttempts());
            Assertions.assertEquals("pages", settings.agents().get(0).id());

            SystemFlags flags = settings.systemFlags();
            Assertions.assertTrue(flags.safeMode());
            Assertions.assertFalse(flags.requireApprovalForWrites());
            Assertions.assertEquals(SystemFlags.BLOCKED_KINDS.size() + 1, flags.deniedKinds().size());
            Assertions.assertTrue(flags.deniedKinds().contains("drop_table"));
            Assertions.assertTrue(flags.approvalRequiredKinds().contains("notion.delete_page"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void invalidStorageOrRetryLimitIsRefused() {
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> RuntimeSettings.fromJson("{\"storage\":\"postgres\"}"));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> RuntimeSettings.fromJson("{\"retryLimit\":2}"));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> RuntimeSettings.fromJson("{\"retryLimit\":-1}"));
        Assertions.assertThrows(RuntimeException.class,
                () -> RuntimeSettings.fromJson("{\"storage\":"));
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
