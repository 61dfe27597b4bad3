package io.laneboard.model;

public record ArchivedTask(String board, Task task, String column, long archivedAtMs) {
}
