package io.laneboard.events;

import com.fasterxml.jackson.annotation.JsonValue;

public enum EventKind {
    TASK_CREATED("task-created"),
    TASK_MOVED("task-moved"),
    TASK_REORDERED("task-reordered"),
    TASK_UPDATED("task-updated"),
    TASK_DELETED("task-deleted"),
    COMMENT_ADDED("comment-added"),
    COLUMNS_CHANGED("columns-changed"),
    BOARD_CLEARED("board-cleared"),
    BOARD_SWEPT("board-swept"),
    BOARD_CREATED("board-created"),
    BOARD_DELETED("board-deleted"),
    TASKS_ARCHIVED("tasks-archived");

    private final String wireName;

    EventKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
