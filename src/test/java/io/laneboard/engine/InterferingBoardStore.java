package io.laneboard.engine;

import io.laneboard.model.ArchivedTask;
import io.laneboard.model.Board;
import io.laneboard.model.BoardMeta;
import io.laneboard.storage.BoardStore;
import io.laneboard.storage.Database;

import java.util.List;
import java.util.OptionalLong;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Store that lets a test act as a second writer at the worst moment: between an engine's read
 * and its compare-and-swap, or between a board listing and the per-board writes that follow.
 */
final class InterferingBoardStore extends BoardStore {
    private final AtomicInteger racesToLose = new AtomicInteger();
    private final AtomicInteger casCalls = new AtomicInteger();
    private final AtomicReference<String> deleteAfterListing = new AtomicReference<>();

    InterferingBoardStore(Database database) {
        super(database);
    }

    /** The next {@code count} compare-and-swaps find the board already bumped by another writer. */
    void loseNextRaces(int count) {
        racesToLose.set(count);
    }

    /** The next {@link #list()} returns {@code board}, then deletes it before the caller goes on. */
    void deleteAfterNextListing(String board) {
        deleteAfterListing.set(board);
    }

    int casCalls() {
        return casCalls.get();
    }

    @Override
    public OptionalLong compareAndSet(Board next, long expectedVersion, List<ArchivedTask> archived) {
        casCalls.incrementAndGet();
        if (racesToLose.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
            StoredBoard current = get(next.name()).orElseThrow();
            super.compareAndSet(current.board(), current.version(), List.of());
        }
        return super.compareAndSet(next, expectedVersion, archived);
    }

    @Override
    public List<BoardMeta> list() {
        List<BoardMeta> boards = super.list();
        String doomed = deleteAfterListing.getAndSet(null);
        if (doomed != null) {
            delete(doomed);
        }
        return boards;
    }
}
