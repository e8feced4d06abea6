package io.commandgate.security;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Base64;
import java.util.stream.Stream;

final class AuditSigningKeysTest {
    @Test
    void generatesOnceAndReusesTheStoredSecret() throws Exception {
        Path root = Files.createTempDirectory("commandgate-test-keys");
        try {
            Path keyFile = root.resolve("security").resolve("audit-hmac.key");
            String first = AuditSigningKeys.loadOrCreate(keyFile);
            Assertions.assertEquals(32, Base64.getDecoder().decode(first).length);
            Assertions.assertEquals(first, AuditSigningKeys.loadOrCreate(keyFile));

            Files.writeString(keyFile, "  ");
            String regenerated = AuditSigningKeys.loadOrCreate(keyFile);
            Assertions.assertNotEquals(first, regenerated);
        } finally {
            deleteRecursively(root);
        }
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
