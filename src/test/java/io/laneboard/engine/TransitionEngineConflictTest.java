package io.laneboard.engine;

import io.laneboard.config.BoardSettings;
import io.laneboard.error.ConflictOnWriteException;
import io.laneboard.error.ErrorKind;
import io.laneboard.model.TaskDraft;
import io.laneboard.model.TaskView;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

final class TransitionEngineConflictTest {

    @Test
    void writeThatLosesOneRaceSucceedsOnRetry() throws Exception {
        try (EngineHarness h = EngineHarness.create("conflict-retry", BoardSettings.defaults(),
                InterferingBoardStore::new)) {
            InterferingBoardStore store = (InterferingBoardStore) h.store;
            TransitionEngine engine = h.engine;
            TaskView first = engine.add("ops", TaskDraft.titled("first"));
            Assertions.assertEquals(2L, h.store.get("ops").orElseThrow().version());

            store.loseNextRaces(1);
            TaskView second = engine.add("ops", TaskDraft.titled("second"));

            // 2 -> 3 by the other writer, 3 -> 4 by the retried add
            Assertions.assertEquals(4L, engine.board("ops").version());
            Assertions.assertEquals(List.of(first.id(), second.id()), TransitionEngineTest.columnIds(engine.board("ops"), "Backlog"));
            Assertions.assertEquals(3, store.casCalls());
            Assertions.assertEquals(2, h.events.published.size());
            Assertions.assertEquals(4L, h.events.last().version());
            Assertions.assertEquals("ok", h.audit.tail(1).get(0).path("result").asText());
        }
    }

    @Test
    void writeThatLosesEveryAttemptSurfacesRetryableConflict() throws Exception {
        try (EngineHarness h = EngineHarness.create("conflict-exhausted", BoardSettings.defaults(),
                InterferingBoardStore::new)) {
            InterferingBoardStore store = (InterferingBoardStore) h.store;
            TransitionEngine engine = h.engine;
            TaskView first = engine.add("ops", TaskDraft.titled("first"));

            store.loseNextRaces(TransitionEngine.WRITE_ATTEMPTS);
            ConflictOnWriteException error = Assertions.assertThrows(ConflictOnWriteException.class,
                    () -> engine.add("ops", TaskDraft.titled("second")));

            Assertions.assertEquals(ErrorKind.CONFLICT_ON_WRITE, error.kind());
            Assertions.assertTrue(error.kind().retryable());
            Assertions.assertEquals(TransitionEngine.WRITE_ATTEMPTS, error.details().get("attempts"));
            Assertions.assertEquals(3L, error.details().get("expectedVersion"));

            // only the competing writes landed
            Assertions.assertEquals(4L, engine.board("ops").version());
            Assertions.assertEquals(List.of(first.id()), TransitionEngineTest.columnIds(engine.board("ops"), "Backlog"));
            Assertions.assertEquals(1, h.events.published.size());
            var rows = h.audit.tail(10);
            Assertions.assertEquals(2, rows.size());
            Assertions.assertEquals("CONFLICT_ON_WRITE", rows.get(1).path("result").asText());
            Assertions.assertEquals("add", rows.get(1).path("action").asText());
        }
    }
}
