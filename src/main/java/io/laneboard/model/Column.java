package io.laneboard.model;

import java.util.List;

/**
 * Workflow stage. {@code taskIds} order is display order; {@code wipLimit} is null when unlimited.
 */
public record Column(String name, List<String> taskIds, Integer wipLimit) {
    public Column {
        taskIds = taskIds == null ? List.of() : List.copyOf(taskIds);
    }
}
