package io.laneboard.observability;

import com.fasterxml.jackson.databind.JsonNode;
import io.laneboard.util.Hashing;
import io.laneboard.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only JSONL audit trail. Each row carries the hash of the previous row so edits to the
 * file are detectable with {@link #verifyChain()}.
 */
public final class AuditLogger {
    private final Path auditFile;
    private final String namespace;
    private final Clock clock;
    private String previousHash;

    public AuditLogger(Path auditFile, String namespace) {
        this(auditFile, namespace, Clock.systemUTC());
    }

    public AuditLogger(Path auditFile, String namespace, Clock clock) {
        this.auditFile = auditFile;
        this.namespace = namespace == null || namespace.isBlank() ? "default" : namespace.trim();
        this.clock = clock;
        try {
            Files.createDirectories(auditFile.getParent());
            if (!Files.exists(auditFile)) {
                try {
                    Files.createFile(auditFile);
                } catch (FileAlreadyExistsException ignored) {
                    // Another process created it between exists() and createFile().
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize audit log file: " + auditFile, e);
        }
        this.previousHash = loadLastHash();
    }

    public synchronized void log(AuditEvent event) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", clock.instant().toString());
        row.put("namespace", namespace);
        row.put("board", event.board());
        row.put("action", event.action());
        row.put("actor", event.actor());
        row.put("result", event.result());
        row.put("task_id", event.taskId());
        row.put("version", event.version());
        row.put("details", event.details());
        row.put("prev_hash", previousHash);
        String rowHash = Hashing.sha256Hex(Jsons.toCompactJson(row));
        row.put("hash", rowHash);
        String line = Jsons.toCompactJson(row) + System.lineSeparator();
        try {
            Files.writeString(auditFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            previousHash = rowHash;
        } catch (IOException e) {
            throw new RuntimeException("Failed to write audit log", e);
        }
    }

    public synchronized String currentHash() {
        return previousHash;
    }

    public synchronized List<JsonNode> tail(int limit) {
        List<String> lines = readLines();
        int from = Math.max(0, lines.size() - Math.max(1, limit));
        List<JsonNode> out = new ArrayList<>();
        for (String line : lines.subList(from, lines.size())) {
            out.add(parse(line));
        }
        return out;
    }

    /**
     * Recomputes every row hash and checks the prev_hash links.
     *
     * @return number of rows verified
     * @throws IllegalStateException at the first broken row
     */
    public synchronized int verifyChain() {
        String prev = "";
        int rows = 0;
        for (String line : readLines()) {
            JsonNode node = parse(line);
            String stored = node.path("hash").asText("");
            String linked = node.path("prev_hash").asText("");
            if (!prev.equals(linked)) {
                throw new IllegalStateException("Audit chain broken at row " + (rows + 1) + ": prev_hash mismatch");
            }
            @SuppressWarnings("unchecked")
            Map<String, Object> row = Jsons.mapper().convertValue(node, LinkedHashMap.class);
            row.remove("hash");
            String recomputed = Hashing.sha256Hex(Jsons.toCompactJson(row));
            if (!recomputed.equals(stored)) {
                throw new IllegalStateException("Audit chain broken at row " + (rows + 1) + ": hash mismatch");
            }
            prev = stored;
            rows++;
        }
        return rows;
    }

    private List<String> readLines() {
        try {
            List<String> out = new ArrayList<>();
            for (String line : Files.readAllLines(auditFile, StandardCharsets.UTF_8)) {
                if (line != null && !line.isBlank()) {
                    out.add(line);
                }
            }
            return out;
        } catch (IOException e) {
            throw new RuntimeException("Failed to read audit log: " + auditFile, e);
        }
    }

    private JsonNode parse(String line) {
        try {
            return Jsons.mapper().readTree(line);
        } catch (IOException e) {
            throw new IllegalStateException("Corrupt audit row: " + line, e);
        }
    }

    private String loadLastHash() {
        List<String> lines = readLines();
        if (lines.isEmpty()) {
            return "";
        }
        return parse(lines.get(lines.size() - 1)).path("hash").asText("");
    }

    public record AuditEvent(
            String board,
            String action,
            String actor,
            String result,
            String taskId,
            Long version,
            Map<String, Object> details
    ) {
        public static AuditEvent ok(String board, String action, String actor, String taskId, Long version,
                                    Map<String, Object> details) {
            return new AuditEvent(board, action, actor, "ok", taskId, version, details == null ? Map.of() : details);
        }

        /**
         * @param errorKind recorded as the row's result, e.g. {@code WIP_LIMIT_EXCEEDED}
         */
        public static AuditEvent rejected(String board, String action, String actor, String taskId, String errorKind,
                                          Map<String, Object> details) {
            return new AuditEvent(board, action, actor, errorKind, taskId, null, details == null ? Map.of() : details);
        }
    }
}
