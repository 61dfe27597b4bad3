package io.laneboard.observability;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

final class AuditLoggerTest {

    @Test
    void rowsAreHashChainedAcrossInstances() throws Exception {
        Path root = Files.createTempDirectory("laneboard-test-audit-chain-");
        try {
            Path file = root.resolve("audit").resolve("audit.log");
            Clock clock = Clock.fixed(Instant.parse("2026-10-01T00:00:00Z"), ZoneOffset.UTC);
            AuditLogger first = new AuditLogger(file, "default", clock);
            first.log(AuditLogger.AuditEvent.ok("alpha", "add", "ai", "tsk_1", 2L, Map.of("column", "Backlog")));
            first.log(AuditLogger.AuditEvent.rejected("alpha", "move", "ai", "tsk_1", "WIP_LIMIT_EXCEEDED", Map.of("limit", 1)));

            AuditLogger reopened = new AuditLogger(file, "default", clock);
            Assertions.assertEquals(first.currentHash(), reopened.currentHash());
            reopened.log(AuditLogger.AuditEvent.ok("alpha", "drop", "human", "tsk_1", 3L, null));

            Assertions.assertEquals(3, reopened.verifyChain());
            List<JsonNode> tail = reopened.tail(2);
            Assertions.assertEquals(2, tail.size());
            Assertions.assertEquals("WIP_LIMIT_EXCEEDED", tail.get(0).path("result").asText());
            Assertions.assertEquals(tail.get(0).path("hash").asText(), tail.get(1).path("prev_hash").asText());
            Assertions.assertEquals("default", tail.get(1).path("namespace").asText());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void tamperedRowBreaksTheChain() throws Exception {
        Path root = Files.createTempDirectory("laneboard-test-audit-tamper-");
        try {
            Path file = root.resolve("audit.log");
            AuditLogger audit = new AuditLogger(file, "default");
            audit.log(AuditLogger.AuditEvent.ok("alpha", "add", "ai", "tsk_1", 2L, Map.of()));
            audit.log(AuditLogger.AuditEvent.ok("alpha", "move", "ai", "tsk_1", 3L, Map.of("to", "Todo")));

            String content = Files.readString(file, StandardCharsets.UTF_8);
            Files.writeString(file, content.replace("\"Todo\"", "\"Done\""), StandardCharsets.UTF_8);

            IllegalStateException error = Assertions.assertThrows(IllegalStateException.class, audit::verifyChain);
            Assertions.assertTrue(error.getMessage().contains("row 2"));
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
