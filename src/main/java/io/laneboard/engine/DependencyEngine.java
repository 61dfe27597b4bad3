package io.laneboard.engine;

import io.laneboard.config.BoardSettings;
import io.laneboard.model.Board;
import io.laneboard.model.Task;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Decides whether a task's {@code blockedBy} set lets it enter a gated column. A blocker is
 * satisfied when it is missing from the board, is the task itself, or sits in {@code Done}.
 */
public final class DependencyEngine {

    public boolean isResolved(Board board, String taskId) {
        return unresolved(board, taskId).isEmpty();
    }

    public List<String> unresolved(Board board, String taskId) {
        Task task = board.tasks().get(taskId);
        if (task == null) {
            return List.of();
        }
        return unresolved(task, id -> board.tasks().containsKey(id) ? board.columnOf(id).orElse(null) : null);
    }

    List<String> unresolved(WorkingBoard board, Task task) {
        return unresolved(task, id -> board.hasTask(id) ? board.columnOf(id) : null);
    }

    private List<String> unresolved(Task task, Function<String, String> columnOfExisting) {
        List<String> out = new ArrayList<>();
        for (String blocker : task.blockedBy()) {
            if (blocker.equals(task.id())) {
                continue;
            }
            String column = columnOfExisting.apply(blocker);
            if (column != null && !BoardSettings.DONE.equals(column)) {
                out.add(blocker);
            }
        }
        return out;
    }
}
