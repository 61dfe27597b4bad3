package io.laneboard.config;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

final class BoardSettingsTest {

    @Test
    void missingFileFallsBackToDefaults() throws Exception {
        Path root = Files.createTempDirectory("laneboard-test-settings-missing-");
        try {
            BoardSettings settings = BoardSettings.load(root.resolve(LaneBoardConfig.SETTINGS_FILE));
            Assertions.assertEquals(BoardSettings.defaults(), settings);
            Assertions.assertEquals(WipPolicy.HARD_FAIL, settings.wipPolicy());
            Assertions.assertEquals(List.of("Backlog", "Todo", "In Progress", "Review", "Done"), settings.defaultColumns());
            Assertions.assertEquals(5_000L, settings.lockTimeoutMs());
            Assertions.assertEquals(50, settings.doneRetention());
            Assertions.assertNull(settings.gatedColumns());
            Assertions.assertTrue(settings.autoCreateBoards());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void fileValuesAreSanitizedAgainstDefaults() throws Exception {
        Path root = Files.createTempDirectory("laneboard-test-settings-parse-");
        try {
            Path file = root.resolve(LaneBoardConfig.SETTINGS_FILE);
            Files.writeString(file, """
                    {
                      "wipPolicy": "warn",
                      "defaultColumns": ["Done", "Doing", " ", "Doing", "QA", "Backlog"],
                      "defaultWipLimits": {"Doing": 2, "QA": 0, "Missing": 4},
                      "gatedColumns": ["QA", "Done", "QA"],
                      "lockTimeoutMs": -10,
                      "lockLeaseMs": 5,
                      "doneRetention": 0,
                      "staleDoneDays": 0,
                      "autoCreateBoards": false
                    }
                    """, StandardCharsets.UTF_8);

            BoardSettings settings = BoardSettings.load(file);

            Assertions.assertEquals(WipPolicy.WARN, settings.wipPolicy());
            Assertions.assertEquals(List.of("Backlog", "Doing", "QA", "Done"), settings.defaultColumns());
            Assertions.assertEquals(Map.of("Doing", 2), settings.defaultWipLimits());
            Assertions.assertEquals(List.of("QA", "Done"), settings.gatedColumns());
            Assertions.assertEquals(0L, settings.lockTimeoutMs());
            Assertions.assertEquals(100L, settings.lockLeaseMs());
            Assertions.assertEquals(0, settings.doneRetention());
            Assertions.assertEquals(1, settings.staleDoneDays());
            Assertions.assertEquals(BoardSettings.DEFAULT_ARCHIVE_RETENTION_DAYS, settings.archiveRetentionDays());
            Assertions.assertFalse(settings.autoCreateBoards());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void unknownKeysAndPoliciesAreRejected() throws Exception {
        Path root = Files.createTempDirectory("laneboard-test-settings-reject-");
        try {
            Path file = root.resolve(LaneBoardConfig.SETTINGS_FILE);
            Files.writeString(file, "{\"wipPolicy\":\"sometimes\"}", StandardCharsets.UTF_8);
            Assertions.assertThrows(IllegalStateException.class, () -> BoardSettings.load(file));

            Files.writeString(file, "{\"wipLimit\":3}", StandardCharsets.UTF_8);
            Assertions.assertThrows(IllegalStateException.class, () -> BoardSettings.load(file));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void namespacesGetTheirOwnRoot() {
        LaneBoardConfig plain = LaneBoardConfig.fromRoot("/tmp/lb-root");
        LaneBoardConfig scoped = LaneBoardConfig.fromRoot("/tmp/lb-root", "Team A/Ops");

        Assertions.assertEquals("default", plain.namespace());
        Assertions.assertEquals(plain.rootBaseDir(), plain.rootDir());
        Assertions.assertEquals("team-a-ops", scoped.namespace());
        Assertions.assertEquals(scoped.rootBaseDir().resolve("namespaces").resolve("team-a-ops"), scoped.rootDir());
        Assertions.assertEquals(scoped.rootDir().resolve("laneboard.db"), scoped.dbFile());
        Assertions.assertEquals(scoped.rootDir().resolve("audit").resolve("audit.log"), scoped.auditFile());
    }

    @Test
    void namesAreSanitizedToStableKeys() {
        Assertions.assertEquals("octo-repo", LaneBoardConfig.sanitizeName("Octo/Repo", "default"));
        Assertions.assertEquals("default", LaneBoardConfig.sanitizeName("   ", "default"));
        Assertions.assertEquals("a-b", LaneBoardConfig.sanitizeName("a  b", "default"));
        Assertions.assertEquals("ns.hidden", LaneBoardConfig.sanitizeName(".hidden", "default"));
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
