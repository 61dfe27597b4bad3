package io.laneboard.engine;

import io.laneboard.config.BoardSettings;
import io.laneboard.error.NotFoundException;
import io.laneboard.model.ArchivedTask;
import io.laneboard.model.Board;
import io.laneboard.model.Column;
import io.laneboard.model.Comment;
import io.laneboard.model.Task;
import io.laneboard.model.TaskView;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Mutable copy of a board snapshot. Every mutation in one write (a single operation or a whole
 * sweep) is applied here, then frozen back into a {@link Board} for the compare-and-swap.
 */
final class WorkingBoard {
    private final String name;
    private final List<Lane> lanes;
    private final Map<String, Task> tasks;
    private final List<Comment> comments;
    private List<String> gatedColumns;
    private final long createdAtMs;
    private final List<ArchivedTask> archived = new ArrayList<>();

    private WorkingBoard(String name, List<Lane> lanes, Map<String, Task> tasks, List<Comment> comments,
                         List<String> gatedColumns, long createdAtMs) {
        this.name = name;
        this.lanes = lanes;
        this.tasks = tasks;
        this.comments = comments;
        this.gatedColumns = gatedColumns;
        this.createdAtMs = createdAtMs;
    }

    static WorkingBoard from(Board board) {
        List<Lane> lanes = new ArrayList<>();
        for (Column column : board.columns()) {
            lanes.add(new Lane(column.name(), new ArrayList<>(column.taskIds()), column.wipLimit()));
        }
        return new WorkingBoard(
                board.name(),
                lanes,
                new LinkedHashMap<>(board.tasks()),
                new ArrayList<>(board.comments()),
                board.gatedColumns() == null ? null : new ArrayList<>(board.gatedColumns()),
                board.createdAtMs()
        );
    }

    Board toBoard(long nowMs) {
        List<Column> columns = new ArrayList<>(lanes.size());
        for (Lane lane : lanes) {
            columns.add(new Column(lane.name, lane.taskIds, lane.wipLimit));
        }
        return new Board(name, columns, tasks, comments, gatedColumns, createdAtMs, nowMs);
    }

    String name() {
        return name;
    }

    List<Lane> lanes() {
        return lanes;
    }

    Lane lane(String columnName) {
        Lane lane = findLane(columnName);
        if (lane == null) {
            throw NotFoundException.column(columnName);
        }
        return lane;
    }

    Lane findLane(String columnName) {
        if (columnName == null) {
            return null;
        }
        for (Lane lane : lanes) {
            if (lane.name.equals(columnName)) {
                return lane;
            }
        }
        return null;
    }

    int indexOf(String columnName) {
        for (int i = 0; i < lanes.size(); i++) {
            if (lanes.get(i).name.equals(columnName)) {
                return i;
            }
        }
        return -1;
    }

    Task task(String taskId) {
        Task task = tasks.get(taskId);
        if (task == null) {
            throw NotFoundException.task(taskId);
        }
        return task;
    }

    boolean hasTask(String taskId) {
        return tasks.containsKey(taskId);
    }

    Collection<Task> tasks() {
        return tasks.values();
    }

    void putTask(Task task) {
        tasks.put(task.id(), task);
    }

    /**
     * @return the column holding {@code taskId}, or null when the task is not on the board
     */
    String columnOf(String taskId) {
        for (Lane lane : lanes) {
            if (lane.taskIds.contains(taskId)) {
                return lane.name;
            }
        }
        return null;
    }

    TaskView view(String taskId) {
        return TaskView.of(task(taskId), columnOf(taskId));
    }

    List<Comment> comments() {
        return comments;
    }

    List<Comment> commentsFor(String taskId) {
        List<Comment> out = new ArrayList<>();
        for (Comment comment : comments) {
            if (comment.taskId().equals(taskId)) {
                out.add(comment);
            }
        }
        return out;
    }

    /**
     * Removes the task, its comments and its column slot. Other tasks' {@code blockedBy} are left
     * alone; callers decide whether to scrub.
     */
    Task removeTask(String taskId) {
        Task removed = task(taskId);
        for (Lane lane : lanes) {
            lane.taskIds.remove(taskId);
        }
        tasks.remove(taskId);
        comments.removeIf(c -> c.taskId().equals(taskId));
        return removed;
    }

    void archive(String taskId, long nowMs) {
        String column = columnOf(taskId);
        Task task = removeTask(taskId);
        archived.add(new ArchivedTask(name, task, column, nowMs));
    }

    List<ArchivedTask> archived() {
        return List.copyOf(archived);
    }

    List<String> explicitGatedColumns() {
        return gatedColumns;
    }

    void setExplicitGatedColumns(List<String> next) {
        this.gatedColumns = next;
    }

    /**
     * Gated columns in effect: this board's explicit list, else the configured list, else
     * {@code Done} plus the column right before it (unless that is {@code Backlog}).
     */
    Set<String> gatedColumns(List<String> configured) {
        if (gatedColumns != null) {
            return new LinkedHashSet<>(gatedColumns);
        }
        if (configured != null) {
            return new LinkedHashSet<>(configured);
        }
        Set<String> derived = new LinkedHashSet<>();
        int done = indexOf(BoardSettings.DONE);
        if (done > 0) {
            String previous = lanes.get(done - 1).name;
            if (!BoardSettings.BACKLOG.equals(previous)) {
                derived.add(previous);
            }
        }
        derived.add(BoardSettings.DONE);
        return derived;
    }

    static final class Lane {
        final String name;
        final List<String> taskIds;
        Integer wipLimit;

        Lane(String name, List<String> taskIds, Integer wipLimit) {
            this.name = name;
            this.taskIds = taskIds;
            this.wipLimit = wipLimit;
        }

        int size() {
            return taskIds.size();
        }
    }
}
