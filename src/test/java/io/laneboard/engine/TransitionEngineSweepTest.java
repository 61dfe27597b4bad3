package io.laneboard.engine;

import io.laneboard.error.BoardException;
import io.laneboard.error.ErrorKind;
import io.laneboard.error.ValidationException;
import io.laneboard.events.EventKind;
import io.laneboard.model.BoardView;
import io.laneboard.model.Priority;
import io.laneboard.model.SweepMove;
import io.laneboard.model.SweepOutcome;
import io.laneboard.model.TaskDraft;
import io.laneboard.model.TaskPatch;
import io.laneboard.model.TaskView;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

final class TransitionEngineSweepTest {

    @Test
    void failedMoveLeavesBoardUntouched() throws Exception {
        try (EngineHarness h = EngineHarness.create("sweep-atomic")) {
            TransitionEngine engine = h.engine;
            TaskView a = engine.add("default", TaskDraft.titled("A"));
            TaskView b = engine.add("default", TaskDraft.titled("B"));
            TaskView c = engine.add("default", TaskDraft.titled("C"));
            BoardView before = engine.board("default");
            int events = h.events.published.size();

            BoardException error = Assertions.assertThrows(BoardException.class, () -> engine.sweep("default", List.of(
                    new SweepMove(a.id(), "Todo"),
                    new SweepMove(b.id(), "Nowhere"),
                    new SweepMove(c.id(), "Todo")
            )));

            Assertions.assertEquals(ErrorKind.NOT_FOUND, error.kind());
            Assertions.assertEquals(1, error.details().get("failedMove"));
            Assertions.assertEquals(before, engine.board("default"));
            Assertions.assertEquals(events, h.events.published.size());
            Assertions.assertEquals("NOT_FOUND", h.audit.tail(1).get(0).path("result").asText());
        }
    }

    @Test
    void laterMovesSeeEarlierMovesOfTheSameBatch() throws Exception {
        try (EngineHarness h = EngineHarness.create("sweep-ordered")) {
            TransitionEngine engine = h.engine;
            TaskView a = engine.add("default", TaskDraft.titled("A"));
            TaskView c = engine.add("default", TaskDraft.titled("C").blockedBy(List.of(a.id())));
            long version = engine.board("default").version();

            SweepOutcome outcome = engine.sweep("default", List.of(new SweepMove(a.id(), "Done"), new SweepMove(c.id(), "Review")));

            Assertions.assertEquals(2, outcome.moved());
            Assertions.assertEquals("Backlog", outcome.steps().get(1).fromColumn());
            Assertions.assertTrue(outcome.fencingEpoch() >= 1L);
            Assertions.assertEquals(version + 1, engine.board("default").version());
            Assertions.assertEquals(EventKind.BOARD_SWEPT, h.events.last().kind());

            SweepOutcome repeat = engine.sweep("default", List.of(new SweepMove(a.id(), "Done")));
            Assertions.assertEquals(0, repeat.moved());
            Assertions.assertEquals(version + 1, engine.board("default").version());
        }
    }

    @Test
    void gateFailureInsideBatchReportsItsIndex() throws Exception {
        try (EngineHarness h = EngineHarness.create("sweep-gate")) {
            TransitionEngine engine = h.engine;
            TaskView a = engine.add("default", TaskDraft.titled("A"));
            TaskView c = engine.add("default", TaskDraft.titled("C").blockedBy(List.of(a.id())));

            BoardException error = Assertions.assertThrows(BoardException.class, () -> engine.sweep("default",
                    List.of(new SweepMove(c.id(), "Review"), new SweepMove(a.id(), "Done"))));
            Assertions.assertEquals(ErrorKind.DEPENDENCY_UNRESOLVED, error.kind());
            Assertions.assertEquals(0, error.details().get("failedMove"));
            Assertions.assertEquals("Backlog", engine.show("default", a.id()).column());

            Assertions.assertThrows(ValidationException.class, () -> engine.sweep("default", List.of()));
        }
    }

    @Test
    void sweepAndConcurrentEditNeverInterleave() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try (EngineHarness h = EngineHarness.create("sweep-concurrent")) {
            TransitionEngine engine = h.engine;
            for (int round = 0; round < 10; round++) {
                String board = "round-" + round;
                TaskView a = engine.add(board, TaskDraft.titled("A"));
                TaskView c = engine.add(board, TaskDraft.titled("C").blockedBy(List.of(a.id())));
                long start = engine.board(board).version();
                CountDownLatch go = new CountDownLatch(1);

                Future<SweepOutcome> sweep = pool.submit(() -> {
                    go.await();
                    return engine.sweep(board, List.of(new SweepMove(a.id(), "Done"), new SweepMove(c.id(), "Review")));
                });
                Future<TaskView> edit = pool.submit(() -> {
                    go.await();
                    return engine.edit(board, a.id(), TaskPatch.ofPriority(Priority.HIGH));
                });
                go.countDown();
                sweep.get(30, TimeUnit.SECONDS);
                TaskView edited = edit.get(30, TimeUnit.SECONDS);

                TaskView finalA = engine.show(board, a.id());
                Assertions.assertEquals("Done", finalA.column());
                Assertions.assertEquals(Priority.HIGH, finalA.priority());
                Assertions.assertEquals("Review", engine.show(board, c.id()).column());
                Assertions.assertEquals(start + 2, engine.board(board).version());
                Assertions.assertTrue(List.of("Backlog", "Done").contains(edited.column()));
            }
        } finally {
            pool.shutdownNow();
        }
    }
}
