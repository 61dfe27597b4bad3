package io.laneboard.cli;

import com.fasterxml.jackson.databind.JsonNode;
import io.laneboard.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.stream.Stream;

final class LaneBoardCommandTest {

    @Test
    void subcommandsPrintJsonAndTypedErrors() throws Exception {
        Path root = Files.createTempDirectory("laneboard-test-cli-");
        try {
            Run created = run(root, "--board", "ops", "create-board", "ops", "--column", "Doing:1", "--column", "Review");
            Assertions.assertEquals(0, created.code());
            Assertions.assertEquals(1L, created.json().path("version").asLong());

            Run a = run(root, "--board", "ops", "add", "Write docs", "--column", "Doing", "--label", "docs");
            Assertions.assertEquals(0, a.code());
            Assertions.assertEquals("Doing", a.json().path("column").asText());

            Run b = run(root, "--board", "ops", "add", "Fix build");
            String bId = b.json().path("id").asText();
            Run rejected = run(root, "--board", "ops", "move", bId, "Doing");
            Assertions.assertEquals(1, rejected.code());
            JsonNode error = Jsons.mapper().readTree(rejected.err());
            Assertions.assertEquals("WIP_LIMIT_EXCEEDED", error.path("error").path("kind").asText());

            Run badPriority = run(root, "--board", "ops", "add", "x", "--priority", "urgent");
            Assertions.assertEquals(1, badPriority.code());

            Run sweep = run(root, "--board", "ops", "sweep", a.json().path("id").asText() + "=Done", bId + "=Doing");
            Assertions.assertEquals(0, sweep.code());
            Assertions.assertEquals(2, sweep.json().path("moved").asInt());

            Run call = run(root, "--board", "ops", "call", "stats");
            Assertions.assertEquals(0, call.code());
            Assertions.assertEquals(1, call.json().path("result").path("byColumn").path("Doing").asInt());

            Run verify = run(root, "audit-verify");
            Assertions.assertTrue(verify.json().path("ok").asBoolean());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void queryStringsAreDecoded() {
        Map<String, String> query = LaneBoardCommand.parseQuery(URI.create("/events?board=octo%2Frepo&x"));
        Assertions.assertEquals("octo/repo", query.get("board"));
        Assertions.assertEquals("", query.get("x"));
        Assertions.assertTrue(LaneBoardCommand.parseQuery(URI.create("/events")).isEmpty());
    }

    private static Run run(Path root, String... args) throws IOException {
        String[] full = new String[args.length + 2];
        full[0] = "--root";
        full[1] = root.toString();
        System.arraycopy(args, 0, full, 2, args.length);
        PrintStream out = System.out;
        PrintStream err = System.err;
        ByteArrayOutputStream outBytes = new ByteArrayOutputStream();
        ByteArrayOutputStream errBytes = new ByteArrayOutputStream();
        try {
            System.setOut(new PrintStream(outBytes, true, StandardCharsets.UTF_8));
            System.setErr(new PrintStream(errBytes, true, StandardCharsets.UTF_8));
            int code = new CommandLine(new LaneBoardCommand()).execute(full);
            return new Run(code, outBytes.toString(StandardCharsets.UTF_8), errBytes.toString(StandardCharsets.UTF_8));
        } finally {
            System.setOut(out);
            System.setErr(err);
        }
    }

    private record Run(int code, String out, String err) {
        JsonNode json() throws IOException {
            return Jsons.mapper().readTree(out);
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
