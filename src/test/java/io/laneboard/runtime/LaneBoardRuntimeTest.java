package io.laneboard.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import io.laneboard.config.BoardSettings;
import io.laneboard.config.LaneBoardConfig;
import io.laneboard.config.WipPolicy;
import io.laneboard.events.BoardEvent;
import io.laneboard.events.EventKind;
import io.laneboard.model.Author;
import io.laneboard.model.TaskDraft;
import io.laneboard.model.TaskView;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

final class LaneBoardRuntimeTest {

    @Test
    void settingsFileShapesNewBoards() throws Exception {
        Path root = Files.createTempDirectory("laneboard-test-runtime-settings-");
        try {
            LaneBoardConfig config = LaneBoardConfig.fromRoot(root.toString(), "team");
            Files.createDirectories(config.settingsFile().getParent());
            Files.writeString(config.settingsFile(), """
                    {"wipPolicy":"warn","defaultColumns":["Backlog","Doing","Done"],"defaultWipLimits":{"Doing":1}}
                    """, StandardCharsets.UTF_8);

            try (LaneBoardRuntime runtime = new LaneBoardRuntime(config)) {
                runtime.init();
                Assertions.assertEquals(WipPolicy.WARN, runtime.settings().wipPolicy());
                TaskView a = runtime.engine().add("default", TaskDraft.titled("A").inColumn("Doing"));
                TaskView b = runtime.engine().add("default", TaskDraft.titled("B"));
                Assertions.assertEquals(1, runtime.engine().move("default", b.id(), "Doing").warnings().size());
                Assertions.assertEquals("Doing", runtime.engine().show("default", a.id()).column());
                Assertions.assertEquals("team", runtime.stats().namespace());
            }
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void subscriberKeepsReceivingAfterBoardIsDeletedAndAutoCreatedAgain() throws Exception {
        Path root = Files.createTempDirectory("laneboard-test-runtime-recreate-");
        try (LaneBoardRuntime runtime = new LaneBoardRuntime(
                LaneBoardConfig.fromRoot(root.toString()), BoardSettings.defaults(), Author.AI, Clock.systemUTC())) {
            runtime.init();
            List<String> seen = new CopyOnWriteArrayList<>();
            CountDownLatch latch = new CountDownLatch(8);
            runtime.events().subscribe("proj", event -> {
                seen.add(event.kind().wireName() + "@" + event.version());
                latch.countDown();
            });

            for (int i = 1; i <= 5; i++) {
                runtime.engine().add("proj", TaskDraft.titled("old " + i));
            }
            runtime.engine().deleteBoard("proj");
            runtime.engine().add("proj", TaskDraft.titled("new 1"));
            runtime.engine().add("proj", TaskDraft.titled("new 2"));

            Assertions.assertTrue(latch.await(5, TimeUnit.SECONDS));
            Assertions.assertEquals(List.of("board-deleted@7", "task-created@2", "task-created@3"),
                    seen.subList(5, 8));
            Assertions.assertEquals(0, runtime.stats().events().droppedStale());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void mutationsReachSubscribersAndTheAuditChain() throws Exception {
        Path root = Files.createTempDirectory("laneboard-test-runtime-events-");
        try (LaneBoardRuntime runtime = new LaneBoardRuntime(
                LaneBoardConfig.fromRoot(root.toString()), BoardSettings.defaults(), Author.HUMAN, Clock.systemUTC())) {
            runtime.init();
            List<BoardEvent> seen = new CopyOnWriteArrayList<>();
            CountDownLatch latch = new CountDownLatch(3);
            runtime.events().subscribe("default", event -> {
                seen.add(event);
                latch.countDown();
            });

            TaskView a = runtime.engine().add("default", TaskDraft.titled("A"));
            runtime.engine().move("default", a.id(), "Todo");
            runtime.engine().comment("default", a.id(), "on it", null);

            Assertions.assertTrue(latch.await(5, TimeUnit.SECONDS));
            Assertions.assertEquals(List.of(EventKind.TASK_CREATED, EventKind.TASK_MOVED, EventKind.COMMENT_ADDED),
                    seen.stream().map(BoardEvent::kind).toList());
            Assertions.assertEquals(Author.HUMAN, runtime.engine().comments("default", a.id()).get(0).author());

            Assertions.assertEquals(3, runtime.verifyAudit());
            List<JsonNode> tail = runtime.auditTail(1);
            Assertions.assertEquals("comment", tail.get(0).path("action").asText());
            Assertions.assertEquals("human", tail.get(0).path("actor").asText());
            Assertions.assertFalse(runtime.schemaMigrations(10).isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void maintenanceRunsAreCountedAndAudited() throws Exception {
        Path root = Files.createTempDirectory("laneboard-test-runtime-maintenance-");
        try (LaneBoardRuntime runtime = new LaneBoardRuntime(LaneBoardConfig.fromRoot(root.toString()), Author.AI)) {
            runtime.init();
            runtime.engine().add("default", TaskDraft.titled("A"));

            runtime.runMaintenance();
            LaneBoardRuntime.RuntimeStats stats = runtime.stats();
            Assertions.assertEquals(1, stats.boards());
            Assertions.assertEquals(1, stats.maintenanceRuns());
            Assertions.assertEquals(0, stats.maintenanceFailures());
            Assertions.assertEquals(0, stats.lastMaintenance().archived());
            Assertions.assertEquals("maintenance", runtime.auditTail(1).get(0).path("action").asText());
            Assertions.assertEquals(2, runtime.verifyAudit());
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
