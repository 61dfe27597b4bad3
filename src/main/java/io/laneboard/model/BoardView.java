package io.laneboard.model;

import java.util.List;

public record BoardView(
        String name,
        long version,
        List<ColumnView> columns,
        long createdAtMs,
        long updatedAtMs
) {
    public record ColumnView(String name, Integer wipLimit, boolean gated, List<TaskView> tasks) {
    }
}
