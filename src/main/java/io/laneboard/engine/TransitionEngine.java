package io.laneboard.engine;

import io.laneboard.config.BoardSettings;
import io.laneboard.config.WipPolicy;
import io.laneboard.error.BoardException;
import io.laneboard.error.ConflictOnWriteException;
import io.laneboard.error.DependencyUnresolvedException;
import io.laneboard.error.ErrorKind;
import io.laneboard.error.NotFoundException;
import io.laneboard.error.ValidationException;
import io.laneboard.error.WipLimitExceededException;
import io.laneboard.events.BoardEvent;
import io.laneboard.events.EventBroadcaster;
import io.laneboard.events.EventKind;
import io.laneboard.lock.LockManager;
import io.laneboard.model.ArchivedTask;
import io.laneboard.model.Assignee;
import io.laneboard.model.Author;
import io.laneboard.model.Board;
import io.laneboard.model.BoardMeta;
import io.laneboard.model.BoardStats;
import io.laneboard.model.BoardView;
import io.laneboard.model.Column;
import io.laneboard.model.ColumnSpec;
import io.laneboard.model.Comment;
import io.laneboard.model.DroppedTask;
import io.laneboard.model.MoveOutcome;
import io.laneboard.model.Priority;
import io.laneboard.model.SearchHit;
import io.laneboard.model.SweepMove;
import io.laneboard.model.SweepOutcome;
import io.laneboard.model.Task;
import io.laneboard.model.TaskDraft;
import io.laneboard.model.TaskFilter;
import io.laneboard.model.TaskPatch;
import io.laneboard.model.TaskView;
import io.laneboard.observability.AuditLogger;
import io.laneboard.observability.AuditLogger.AuditEvent;
import io.laneboard.storage.BoardStore;
import io.laneboard.storage.BoardStore.StoredBoard;
import io.laneboard.util.Ids;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalLong;
import java.util.Set;
import java.util.function.Supplier;
import java.util.stream.Stream;

/**
 * Board state machine. Every mutation reads the current snapshot, applies the change to a
 * {@link WorkingBoard}, and writes it back with a compare-and-swap on the board version. A lost
 * race is retried once against a fresh read before surfacing as CONFLICT_ON_WRITE. Each committed
 * write publishes exactly one event and appends one audit row; rejected calls are audited too.
 *
 * <p>Reads take no lock. Only {@link #sweep} holds the board lock.
 */
public final class TransitionEngine {
    static final int WRITE_ATTEMPTS = 2;
    private static final int MAX_COLUMN_NAME_LENGTH = 80;

    private final BoardStore store;
    private final BoardRouter router;
    private final DependencyEngine dependencies;
    private final LockManager locks;
    private final EventBroadcaster events;
    private final AuditLogger audit;
    private final BoardSettings settings;
    private final Clock clock;
    private final Supplier<Author> actor;

    public TransitionEngine(
            BoardStore store,
            BoardRouter router,
            DependencyEngine dependencies,
            LockManager locks,
            EventBroadcaster events,
            AuditLogger audit,
            BoardSettings settings,
            Clock clock,
            Supplier<Author> actor
    ) {
        this.store = store;
        this.router = router;
        this.dependencies = dependencies;
        this.locks = locks;
        this.events = events;
        this.audit = audit;
        this.settings = settings;
        this.clock = clock;
        this.actor = actor;
    }

    public BoardSettings settings() {
        return settings;
    }

    public TaskView add(String board, TaskDraft draft) {
        if (draft == null || draft.title() == null || draft.title().isBlank()) {
            throw new ValidationException("Task title must not be blank");
        }
        List<String> blockedBy = validIds(draft.blockedBy(), "blockedBy");
        validateHints(draft.autoPullThreshold(), draft.autoReleaseMinutes());
        String target = draft.column() == null || draft.column().isBlank() ? BoardSettings.BACKLOG : draft.column().trim();
        return mutate(board, "add", null, (working, now) -> {
            WorkingBoard.Lane lane = working.lane(target);
            String id = Ids.newTaskId();
            Task task = new Task(
                    id,
                    draft.title().trim(),
                    blankToNull(draft.description()),
                    draft.priority(),
                    draft.assignee(),
                    cleanList(draft.labels()),
                    cleanList(draft.links()),
                    blankToNull(draft.context()),
                    withoutSelf(blockedBy, id),
                    draft.autoPullThreshold(),
                    draft.autoReleaseMinutes(),
                    actor.get(),
                    now,
                    now
            );
            List<String> warnings = new ArrayList<>();
            admit(working, task, lane, warnings);
            working.putTask(task);
            lane.taskIds.add(id);
            TaskView view = working.view(id);
            return Change.of(view, EventKind.TASK_CREATED,
                    payload("task", view, "column", lane.name, "warnings", warnings));
        });
    }

    /**
     * Moves a task to the end of {@code column}. Entering a gated column requires resolved
     * dependencies; entering a WIP-limited column is checked against the limit under the
     * configured policy. Moving to the task's current column changes nothing.
     */
    public MoveOutcome move(String board, String taskId, String column) {
        requireTaskId(taskId);
        String target = requireColumnName(column);
        return mutate(board, "move", taskId, (working, now) -> {
            Task task = working.task(taskId);
            String from = working.columnOf(taskId);
            WorkingBoard.Lane to = working.lane(target);
            if (to.name.equals(from)) {
                return Change.unchanged(new MoveOutcome(working.view(taskId), from, List.of()));
            }
            List<String> warnings = new ArrayList<>();
            relocate(working, task, from, to, null, warnings, now);
            MoveOutcome outcome = new MoveOutcome(working.view(taskId), from, warnings);
            return Change.of(outcome, EventKind.TASK_MOVED,
                    payload("task", outcome.task(), "from", from, "to", to.name, "warnings", warnings));
        });
    }

    /**
     * Reinserts a task in {@code column} directly before {@code beforeId}, or at the end when
     * {@code beforeId} is null or not in that column.
     */
    public MoveOutcome reorder(String board, String taskId, String column, String beforeId) {
        requireTaskId(taskId);
        String target = requireColumnName(column);
        String before = beforeId == null || beforeId.isBlank() ? null : beforeId.trim();
        return mutate(board, "reorder", taskId, (working, now) -> {
            Task task = working.task(taskId);
            String from = working.columnOf(taskId);
            WorkingBoard.Lane to = working.lane(target);
            List<String> warnings = new ArrayList<>();
            if (!relocate(working, task, from, to, before, warnings, now)) {
                return Change.unchanged(new MoveOutcome(working.view(taskId), from, List.of()));
            }
            MoveOutcome outcome = new MoveOutcome(working.view(taskId), from, warnings);
            return Change.of(outcome, EventKind.TASK_REORDERED, payload(
                    "task", outcome.task(), "from", from, "to", to.name,
                    "position", to.taskIds.indexOf(taskId), "warnings", warnings));
        });
    }

    public TaskView edit(String board, String taskId, TaskPatch patch) {
        requireTaskId(taskId);
        if (patch == null || patch.isEmpty()) {
            throw new ValidationException("Patch must change at least one field");
        }
        if (patch.title() != null && patch.title().isBlank()) {
            throw new ValidationException("Task title must not be blank");
        }
        List<String> blockedBy = patch.blockedBy() == null ? null : validIds(patch.blockedBy(), "blockedBy");
        validateHints(patch.autoPullThreshold(), patch.autoReleaseMinutes());
        return mutate(board, "edit", taskId, (working, now) -> {
            Task current = working.task(taskId);
            Task next = new Task(
                    current.id(),
                    patch.title() == null ? current.title() : patch.title().trim(),
                    patch.description() == null ? current.description() : blankToNull(patch.description()),
                    patch.priority() == null ? current.priority() : patch.priority(),
                    patch.assignee() == null ? current.assignee() : patch.assignee(),
                    patch.labels() == null ? current.labels() : cleanList(patch.labels()),
                    patch.links() == null ? current.links() : cleanList(patch.links()),
                    patch.context() == null ? current.context() : blankToNull(patch.context()),
                    blockedBy == null ? current.blockedBy() : withoutSelf(blockedBy, taskId),
                    patch.autoPullThreshold() == null ? current.autoPullThreshold() : patch.autoPullThreshold(),
                    patch.autoReleaseMinutes() == null ? current.autoReleaseMinutes() : patch.autoReleaseMinutes(),
                    current.createdBy(),
                    current.createdAtMs(),
                    now
            );
            working.putTask(next);
            TaskView view = working.view(taskId);
            return Change.of(view, EventKind.TASK_UPDATED, payload("task", view, "fields", patchedFields(patch)));
        });
    }

    /**
     * Adds or removes a single dependency. Adding a task to its own {@code blockedBy} is ignored.
     */
    public TaskView block(String board, String taskId, String blockerId, boolean remove) {
        requireTaskId(taskId);
        String blocker = blockerId == null ? null : blockerId.trim();
        if (!Ids.isValid(blocker)) {
            throw new ValidationException("Invalid task id in blockedBy: " + blockerId, Map.of("field", "blockedBy"));
        }
        return mutate(board, "block", taskId, (working, now) -> {
            Task current = working.task(taskId);
            List<String> next = new ArrayList<>(current.blockedBy());
            if (remove) {
                next.remove(blocker);
            } else if (!blocker.equals(taskId) && !next.contains(blocker)) {
                next.add(blocker);
            }
            if (next.equals(current.blockedBy())) {
                return Change.unchanged(working.view(taskId));
            }
            working.putTask(current.withBlockedBy(next, now));
            TaskView view = working.view(taskId);
            return Change.of(view, EventKind.TASK_UPDATED, payload(
                    "task", view, "fields", List.of("blockedBy"), remove ? "removed" : "added", blocker));
        });
    }

    /**
     * Destroys a task and its comments and removes its id from every other task's
     * {@code blockedBy}.
     */
    public DroppedTask drop(String board, String taskId) {
        requireTaskId(taskId);
        return mutate(board, "drop", taskId, (working, now) -> {
            TaskView view = TaskView.of(working.task(taskId), working.columnOf(taskId), working.commentsFor(taskId));
            working.removeTask(taskId);
            List<String> unblocked = new ArrayList<>();
            for (Task other : List.copyOf(working.tasks())) {
                if (other.blockedBy().contains(taskId)) {
                    List<String> rest = new ArrayList<>(other.blockedBy());
                    rest.removeIf(taskId::equals);
                    working.putTask(other.withBlockedBy(rest, now));
                    unblocked.add(other.id());
                }
            }
            DroppedTask dropped = new DroppedTask(view, unblocked);
            return Change.of(dropped, EventKind.TASK_DELETED, payload("task", view, "unblocked", unblocked));
        });
    }

    public Comment comment(String board, String taskId, String content, Author author) {
        requireTaskId(taskId);
        if (content == null || content.isBlank()) {
            throw new ValidationException("Comment content must not be blank");
        }
        return mutate(board, "comment", taskId, (working, now) -> {
            working.task(taskId);
            Comment comment = new Comment(Ids.newCommentId(), taskId, author == null ? actor.get() : author,
                    content.trim(), now);
            working.comments().add(comment);
            return Change.of(comment, EventKind.COMMENT_ADDED, payload("comment", comment));
        });
    }

    /**
     * Adds, removes, repositions or re-limits a column. New columns go right before Done unless
     * a position is given; positions are clamped to stay after Backlog and before Done. Removing a
     * column sends its tasks to the end of Backlog. A {@code wipLimit} of 0 clears the limit.
     */
    public BoardView column(String board, String name, boolean remove, Integer position, Integer wipLimit) {
        String columnName = requireColumnName(name);
        if (columnName.length() > MAX_COLUMN_NAME_LENGTH) {
            throw new ValidationException("Column name is too long: " + columnName.length() + " > " + MAX_COLUMN_NAME_LENGTH);
        }
        if (wipLimit != null && wipLimit < 0) {
            throw new ValidationException("WIP limit must not be negative", Map.of("wipLimit", wipLimit));
        }
        boolean fixed = isFixed(columnName);
        return mutate(board, "column", null, (working, now) -> {
            WorkingBoard.Lane existing = working.findLane(columnName);
            Map<String, Object> payload;
            if (remove) {
                if (fixed) {
                    throw new ValidationException("Column " + columnName + " cannot be removed", Map.of("column", columnName));
                }
                if (existing == null) {
                    throw NotFoundException.column(columnName);
                }
                List<String> relocated = List.copyOf(existing.taskIds);
                working.lane(BoardSettings.BACKLOG).taskIds.addAll(relocated);
                working.lanes().remove(existing);
                if (working.explicitGatedColumns() != null) {
                    List<String> gated = new ArrayList<>(working.explicitGatedColumns());
                    gated.remove(columnName);
                    working.setExplicitGatedColumns(gated);
                }
                payload = payload("action", "removed", "column", columnName, "relocated", relocated);
            } else if (existing != null) {
                if (wipLimit == null && position == null) {
                    throw new ValidationException("Column already exists: " + columnName, Map.of("column", columnName));
                }
                if (wipLimit != null) {
                    existing.wipLimit = wipLimit == 0 ? null : wipLimit;
                }
                if (position != null) {
                    if (fixed) {
                        throw new ValidationException("Column " + columnName + " cannot be repositioned", Map.of("column", columnName));
                    }
                    working.lanes().remove(existing);
                    working.lanes().add(clampPosition(position, working.lanes().size()), existing);
                }
                payload = payload("action", "updated", "column", columnName, "wipLimit", existing.wipLimit);
            } else {
                WorkingBoard.Lane lane = new WorkingBoard.Lane(columnName, new ArrayList<>(),
                        wipLimit == null || wipLimit == 0 ? null : wipLimit);
                int index = position == null
                        ? working.indexOf(BoardSettings.DONE)
                        : clampPosition(position, working.lanes().size());
                working.lanes().add(index, lane);
                payload = payload("action", "added", "column", columnName, "position", index);
            }
            return Change.versioned(this::boardView, EventKind.COLUMNS_CHANGED, payload);
        });
    }

    /**
     * Archives every task in Done.
     *
     * @return number of tasks archived
     */
    public int clear(String board) {
        Integer archived = mutate(board, "clear", null, (working, now) -> {
            List<String> ids = List.copyOf(working.lane(BoardSettings.DONE).taskIds);
            if (ids.isEmpty()) {
                return Change.unchanged(0);
            }
            for (String id : ids) {
                working.archive(id, now);
            }
            return Change.of(ids.size(), EventKind.BOARD_CLEARED, payload("archived", ids.size(), "taskIds", ids));
        });
        return archived;
    }

    /**
     * Applies {@code moves} in order under the board lock, all or nothing. Each move is checked
     * against the state the earlier moves produced; the first failure aborts the batch with its
     * index in the error's {@code failedMove} detail and nothing is written.
     */
    public SweepOutcome sweep(String board, List<SweepMove> moves) {
        if (moves == null || moves.isEmpty()) {
            throw new ValidationException("Sweep needs at least one move");
        }
        List<SweepMove> batch = List.copyOf(moves);
        String key = router.key(board);
        try {
            return locks.withLock(LockManager.boardWriteKey(key), grant -> write(key, "sweep", null, true, (working, now) -> {
                List<SweepOutcome.Step> steps = new ArrayList<>();
                List<String> warnings = new ArrayList<>();
                int moved = 0;
                for (int i = 0; i < batch.size(); i++) {
                    SweepMove move = batch.get(i);
                    try {
                        if (move == null || move.id() == null || move.id().isBlank()
                                || move.column() == null || move.column().isBlank()) {
                            throw new ValidationException("Sweep move needs an id and a column");
                        }
                        Task task = working.task(move.id().trim());
                        String from = working.columnOf(task.id());
                        WorkingBoard.Lane to = working.lane(move.column().trim());
                        if (!to.name.equals(from)) {
                            relocate(working, task, from, to, null, warnings, now);
                            moved++;
                        }
                        steps.add(new SweepOutcome.Step(task.id(), from, to.name));
                    } catch (BoardException e) {
                        throw e.withDetail("failedMove", i);
                    }
                }
                SweepOutcome outcome = new SweepOutcome(key, moved, steps, warnings, grant.fencingEpoch());
                if (moved == 0) {
                    return Change.unchanged(outcome);
                }
                return Change.of(outcome, EventKind.BOARD_SWEPT,
                        payload("moves", steps, "warnings", warnings, "fencingEpoch", grant.fencingEpoch()));
            }));
        } catch (BoardException e) {
            // failures inside the lock were already audited by write()
            if (e.kind() == ErrorKind.LOCK_TIMEOUT) {
                audit.log(AuditEvent.rejected(key, "sweep", actor.get().wireName(), null, e.kind().name(), e.details()));
            }
            throw e;
        }
    }

    /**
     * Case-insensitive substring search over title, description and context. Each call to
     * {@code iterator()} reads the current snapshot and yields matches lazily in display order.
     */
    public Iterable<TaskView> search(String board, String query) {
        String needle = needle(query);
        String key = router.key(board);
        return () -> views(router.load(key, clock.millis()).board())
                .filter(view -> matches(view, needle))
                .iterator();
    }

    /**
     * Same matching as {@link #search} over every stored board, in board listing order. Boards
     * are read one at a time as the iterator advances; a board deleted mid-iteration is skipped.
     * Nothing is auto-created.
     */
    public Iterable<SearchHit> searchAll(String query) {
        String needle = needle(query);
        return () -> store.list().stream()
                .flatMap(meta -> store.get(meta.name()).stream())
                .flatMap(stored -> views(stored.board())
                        .filter(view -> matches(view, needle))
                        .map(view -> new SearchHit(stored.board().name(), view)))
                .iterator();
    }

    public List<TaskView> list(String board, TaskFilter filter) {
        TaskFilter effective = filter == null ? TaskFilter.none() : filter;
        return views(read(board).board()).filter(effective::matches).toList();
    }

    /**
     * Tasks assigned to the AI actor that are not yet in Done.
     */
    public List<TaskView> mine(String board) {
        return views(read(board).board())
                .filter(view -> view.assignee() == Assignee.AI && !BoardSettings.DONE.equals(view.column()))
                .toList();
    }

    public TaskView show(String board, String taskId) {
        requireTaskId(taskId);
        Board snapshot = read(board).board();
        Task task = snapshot.tasks().get(taskId);
        if (task == null) {
            throw NotFoundException.task(taskId);
        }
        return TaskView.of(task, snapshot.columnOf(taskId).orElse(null), commentsOf(snapshot, taskId));
    }

    public List<Comment> comments(String board, String taskId) {
        requireTaskId(taskId);
        Board snapshot = read(board).board();
        if (!snapshot.tasks().containsKey(taskId)) {
            throw NotFoundException.task(taskId);
        }
        return commentsOf(snapshot, taskId);
    }

    public BoardView board(String board) {
        StoredBoard stored = read(board);
        return boardView(stored.board(), stored.version());
    }

    public BoardStats stats(String board) {
        Board snapshot = read(board).board();
        Map<String, Integer> byColumn = new LinkedHashMap<>();
        List<BoardStats.WipStatus> wip = new ArrayList<>();
        for (Column column : snapshot.columns()) {
            int count = column.taskIds().size();
            byColumn.put(column.name(), count);
            if (column.wipLimit() != null) {
                int limit = column.wipLimit();
                wip.add(new BoardStats.WipStatus(column.name(), count, limit, count >= limit, count > limit));
            }
        }
        Map<String, Integer> byPriority = new LinkedHashMap<>();
        for (Priority priority : Priority.values()) {
            byPriority.put(priority.wireName(), 0);
        }
        Map<String, Integer> byAssignee = new LinkedHashMap<>();
        for (Assignee assignee : Assignee.values()) {
            byAssignee.put(assignee.wireName(), 0);
        }
        for (Task task : snapshot.tasks().values()) {
            byPriority.merge(task.priority().wireName(), 1, Integer::sum);
            byAssignee.merge(task.assignee().wireName(), 1, Integer::sum);
        }
        return new BoardStats(snapshot.name(), snapshot.tasks().size(), byColumn, wip, byPriority, byAssignee);
    }

    public List<BoardMeta> boards() {
        return store.list();
    }

    public BoardView createBoard(String name, List<ColumnSpec> columns) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("Board name must not be blank");
        }
        String key = router.key(name);
        String actorName = actor.get().wireName();
        try {
            long now = clock.millis();
            Board board = router.newBoard(key, columns, now);
            if (!store.insert(board)) {
                throw new ValidationException("Board already exists: " + key, Map.of("board", key));
            }
            events.publish(new BoardEvent(key, EventKind.BOARD_CREATED, 1L, payload("columns", board.columnNames()), now));
            audit.log(AuditEvent.ok(key, "create-board", actorName, null, 1L, Map.of("columns", board.columnNames())));
            return boardView(board, 1L);
        } catch (BoardException e) {
            audit.log(AuditEvent.rejected(key, "create-board", actorName, null, e.kind().name(), e.details()));
            throw e;
        }
    }

    /**
     * Deletes a board with its archive. The default board cannot be deleted.
     */
    public BoardMeta deleteBoard(String name) {
        String key = router.key(name);
        String actorName = actor.get().wireName();
        try {
            if (BoardRouter.DEFAULT_BOARD.equals(key)) {
                throw new ValidationException("The default board cannot be deleted", Map.of("board", key));
            }
            StoredBoard stored = router.find(key).orElseThrow(() -> NotFoundException.board(key));
            if (!store.delete(key)) {
                throw NotFoundException.board(key);
            }
            long version = stored.version() + 1L;
            events.publish(new BoardEvent(key, EventKind.BOARD_DELETED, version, payload("board", key), clock.millis()));
            audit.log(AuditEvent.ok(key, "delete-board", actorName, null, version, Map.of()));
            Board board = stored.board();
            return new BoardMeta(key, board.tasks().size(), stored.version(), board.createdAtMs(), board.updatedAtMs());
        } catch (BoardException e) {
            audit.log(AuditEvent.rejected(key, "delete-board", actorName, null, e.kind().name(), e.details()));
            throw e;
        }
    }

    /**
     * The most recently updated board, or the default board when none exist yet.
     */
    public BoardView activeBoard() {
        List<BoardMeta> boards = store.list();
        return board(boards.isEmpty() ? BoardRouter.DEFAULT_BOARD : boards.get(0).name());
    }

    public List<ArchivedTask> archived(String board, int limit) {
        String key = router.key(board);
        if (router.find(key).isEmpty()) {
            throw NotFoundException.board(key);
        }
        return store.listArchived(key, limit);
    }

    /**
     * Archives Done tasks untouched for {@code staleDoneDays} on every board, then purges archive
     * rows older than {@code archiveRetentionDays}.
     */
    public MaintenanceReport runMaintenance() {
        long now = clock.millis();
        long staleBefore = now - Duration.ofDays(settings.staleDoneDays()).toMillis();
        int visited = 0;
        int archived = 0;
        for (BoardMeta meta : store.list()) {
            int count;
            try {
                count = archiveStale(meta.name(), staleBefore);
            } catch (NotFoundException e) {
                // deleted after the listing
                continue;
            }
            visited++;
            archived += count;
        }
        int purged = store.purgeArchivedOlderThan(now - Duration.ofDays(settings.archiveRetentionDays()).toMillis());
        return new MaintenanceReport(visited, archived, purged);
    }

    private int archiveStale(String key, long staleBefore) {
        return write(key, "archive-stale", null, false, (working, ts) -> {
            WorkingBoard.Lane done = working.findLane(BoardSettings.DONE);
            if (done == null) {
                return Change.unchanged(0);
            }
            List<String> stale = new ArrayList<>();
            for (String id : done.taskIds) {
                if (working.task(id).updatedAtMs() < staleBefore) {
                    stale.add(id);
                }
            }
            if (stale.isEmpty()) {
                return Change.unchanged(0);
            }
            for (String id : stale) {
                working.archive(id, ts);
            }
            return Change.of(stale.size(), EventKind.TASKS_ARCHIVED, payload("archived", stale.size(), "taskIds", stale));
        });
    }

    public record MaintenanceReport(int boards, int archived, int purged) {
    }

    private <R> R mutate(String board, String action, String taskId, Mutation<R> mutation) {
        return write(router.key(board), action, taskId, true, mutation);
    }

    private <R> R write(String key, String action, String taskId, boolean createIfMissing, Mutation<R> mutation) {
        String actorName = actor.get().wireName();
        try {
            long expected = -1L;
            for (int attempt = 1; attempt <= WRITE_ATTEMPTS; attempt++) {
                long now = clock.millis();
                StoredBoard stored = createIfMissing
                        ? router.load(key, now)
                        : router.find(key).orElseThrow(() -> NotFoundException.board(key));
                expected = stored.version();
                WorkingBoard working = WorkingBoard.from(stored.board());
                Change<R> change = mutation.apply(working, now);
                if (!change.changed()) {
                    return change.result().build(stored.board(), stored.version());
                }
                int autoArchived = autoArchive(working, now);
                Board next = working.toBoard(now);
                OptionalLong version = store.compareAndSet(next, stored.version(), working.archived());
                if (version.isEmpty()) {
                    continue;
                }
                long committed = version.getAsLong();
                Map<String, Object> payload = new LinkedHashMap<>(change.payload());
                if (autoArchived > 0) {
                    payload.put("autoArchived", autoArchived);
                }
                events.publish(new BoardEvent(key, change.kind(), committed, payload, now));
                audit.log(AuditEvent.ok(key, action, actorName, taskId, committed, auditDetails(payload)));
                return change.result().build(next, committed);
            }
            throw new ConflictOnWriteException(key, expected, WRITE_ATTEMPTS);
        } catch (BoardException e) {
            audit.log(AuditEvent.rejected(key, action, actorName, taskId, e.kind().name(), e.details()));
            throw e;
        }
    }

    /**
     * Keeps at most {@code doneRetention} tasks in Done by archiving the least recently updated
     * surplus.
     */
    private int autoArchive(WorkingBoard working, long nowMs) {
        int retention = settings.doneRetention();
        WorkingBoard.Lane done = working.findLane(BoardSettings.DONE);
        if (retention <= 0 || done == null || done.size() <= retention) {
            return 0;
        }
        List<String> oldestFirst = new ArrayList<>(done.taskIds);
        oldestFirst.sort(Comparator.comparingLong(id -> working.task(id).updatedAtMs()));
        int surplus = done.size() - retention;
        for (String id : oldestFirst.subList(0, surplus)) {
            working.archive(id, nowMs);
        }
        return surplus;
    }

    /**
     * Moves {@code task} into {@code to} before {@code beforeId} (or at the end), enforcing the
     * gate and WIP rules when the column changes.
     *
     * @return false when the column sequence is unchanged
     */
    private boolean relocate(WorkingBoard working, Task task, String from, WorkingBoard.Lane to, String beforeId,
                             List<String> warnings, long nowMs) {
        boolean changesColumn = !to.name.equals(from);
        if (changesColumn) {
            admit(working, task, to, warnings);
        }
        List<String> previous = changesColumn ? List.of() : List.copyOf(to.taskIds);
        if (from != null) {
            working.lane(from).taskIds.remove(task.id());
        }
        int index = beforeId == null ? -1 : to.taskIds.indexOf(beforeId);
        if (index < 0) {
            to.taskIds.add(task.id());
        } else {
            to.taskIds.add(index, task.id());
        }
        if (!changesColumn && previous.equals(to.taskIds)) {
            return false;
        }
        working.putTask(task.touched(nowMs));
        return true;
    }

    /**
     * Gate and WIP checks for {@code task} entering {@code lane}.
     */
    private void admit(WorkingBoard working, Task task, WorkingBoard.Lane lane, List<String> warnings) {
        Set<String> gated = working.gatedColumns(settings.gatedColumns());
        if (gated.contains(lane.name)) {
            List<String> unresolved = dependencies.unresolved(working, task);
            if (!unresolved.isEmpty()) {
                throw new DependencyUnresolvedException(task.id(), lane.name, unresolved);
            }
        }
        if (lane.wipLimit != null && lane.size() + 1 > lane.wipLimit) {
            if (settings.wipPolicy() == WipPolicy.HARD_FAIL) {
                throw new WipLimitExceededException(task.id(), lane.name, lane.size(), lane.wipLimit);
            }
            warnings.add("Column " + lane.name + " is over its WIP limit (" + (lane.size() + 1) + "/" + lane.wipLimit + ")");
        }
    }

    BoardView boardView(Board board, long version) {
        Set<String> gated = WorkingBoard.from(board).gatedColumns(settings.gatedColumns());
        List<BoardView.ColumnView> columns = new ArrayList<>(board.columns().size());
        for (Column column : board.columns()) {
            List<TaskView> tasks = column.taskIds().stream()
                    .filter(board.tasks()::containsKey)
                    .map(id -> TaskView.of(board.tasks().get(id), column.name()))
                    .toList();
            columns.add(new BoardView.ColumnView(column.name(), column.wipLimit(), gated.contains(column.name()), tasks));
        }
        return new BoardView(board.name(), version, columns, board.createdAtMs(), board.updatedAtMs());
    }

    private static Stream<TaskView> views(Board board) {
        return board.columns().stream().flatMap(column -> column.taskIds().stream()
                .filter(board.tasks()::containsKey)
                .map(id -> TaskView.of(board.tasks().get(id), column.name())));
    }

    private static List<Comment> commentsOf(Board board, String taskId) {
        return board.comments().stream().filter(c -> c.taskId().equals(taskId)).toList();
    }

    private StoredBoard read(String board) {
        return router.load(router.key(board), clock.millis());
    }

    private static void requireTaskId(String taskId) {
        if (taskId == null || taskId.isBlank()) {
            throw new ValidationException("Task id must not be blank");
        }
    }

    private static String requireColumnName(String column) {
        if (column == null || column.isBlank()) {
            throw new ValidationException("Column name must not be blank");
        }
        return column.trim();
    }

    private static boolean isFixed(String column) {
        return BoardSettings.BACKLOG.equals(column) || BoardSettings.DONE.equals(column);
    }

    /**
     * Index between Backlog (0) and Done (last), for a column list of {@code size} lanes.
     */
    private static int clampPosition(int position, int size) {
        return Math.max(1, Math.min(position, size - 1));
    }

    private static List<String> validIds(List<String> ids, String field) {
        if (ids == null) {
            return List.of();
        }
        LinkedHashSet<String> out = new LinkedHashSet<>();
        for (String id : ids) {
            String trimmed = id == null ? null : id.trim();
            if (!Ids.isValid(trimmed)) {
                throw new ValidationException("Invalid task id in " + field + ": " + id, Map.of("field", field));
            }
            out.add(trimmed);
        }
        return new ArrayList<>(out);
    }

    private static void validateHints(Integer autoPullThreshold, Integer autoReleaseMinutes) {
        if (autoPullThreshold != null && autoPullThreshold < 0) {
            throw new ValidationException("autoPullThreshold must be >= 0", Map.of("autoPullThreshold", autoPullThreshold));
        }
        if (autoReleaseMinutes != null && autoReleaseMinutes <= 0) {
            throw new ValidationException("autoReleaseMinutes must be > 0", Map.of("autoReleaseMinutes", autoReleaseMinutes));
        }
    }

    private static List<String> withoutSelf(List<String> ids, String selfId) {
        return ids.stream().filter(id -> !id.equals(selfId)).toList();
    }

    private static List<String> cleanList(List<String> raw) {
        if (raw == null) {
            return List.of();
        }
        LinkedHashSet<String> out = new LinkedHashSet<>();
        for (String value : raw) {
            if (value != null && !value.isBlank()) {
                out.add(value.trim());
            }
        }
        return new ArrayList<>(out);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static String needle(String query) {
        if (query == null || query.isBlank()) {
            throw new ValidationException("Search query must not be blank");
        }
        return query.trim().toLowerCase(Locale.ROOT);
    }

    private static boolean matches(TaskView view, String needle) {
        return contains(view.title(), needle)
                || contains(view.description(), needle)
                || contains(view.context(), needle);
    }

    private static boolean contains(String haystack, String needle) {
        return haystack != null && haystack.toLowerCase(Locale.ROOT).contains(needle);
    }

    private static List<String> patchedFields(TaskPatch patch) {
        List<String> fields = new ArrayList<>();
        if (patch.title() != null) fields.add("title");
        if (patch.description() != null) fields.add("description");
        if (patch.priority() != null) fields.add("priority");
        if (patch.assignee() != null) fields.add("assignee");
        if (patch.labels() != null) fields.add("labels");
        if (patch.links() != null) fields.add("links");
        if (patch.context() != null) fields.add("context");
        if (patch.blockedBy() != null) fields.add("blockedBy");
        if (patch.autoPullThreshold() != null) fields.add("autoPullThreshold");
        if (patch.autoReleaseMinutes() != null) fields.add("autoReleaseMinutes");
        return fields;
    }

    private static Map<String, Object> payload(Object... keyValues) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            out.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
        }
        return out;
    }

    /**
     * Event payload minus the full task/comment bodies, which the audit row does not need.
     */
    private static Map<String, Object> auditDetails(Map<String, Object> payload) {
        Map<String, Object> out = new LinkedHashMap<>(payload);
        out.remove("task");
        out.remove("comment");
        return out;
    }

    private interface Mutation<R> {
        Change<R> apply(WorkingBoard working, long nowMs);
    }

    private interface Result<R> {
        R build(Board written, long version);
    }

    private record Change<R>(boolean changed, Result<R> result, EventKind kind, Map<String, Object> payload) {
        static <R> Change<R> of(R value, EventKind kind, Map<String, Object> payload) {
            return new Change<>(true, (board, version) -> value, kind, payload);
        }

        static <R> Change<R> versioned(Result<R> result, EventKind kind, Map<String, Object> payload) {
            return new Change<>(true, result, kind, payload);
        }

        static <R> Change<R> unchanged(R value) {
            return new Change<>(false, (board, version) -> value, null, Map.of());
        }
    }
}
