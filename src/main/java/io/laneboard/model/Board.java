package io.laneboard.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Whole-board snapshot as persisted by the board store.
 *
 * @param gatedColumns explicit gated columns for this board, or null to use the configured/derived set
 */
public record Board(
        String name,
        List<Column> columns,
        Map<String, Task> tasks,
        List<Comment> comments,
        List<String> gatedColumns,
        long createdAtMs,
        long updatedAtMs
) {
    public Board {
        columns = columns == null ? List.of() : List.copyOf(columns);
        tasks = tasks == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(tasks));
        comments = comments == null ? List.of() : List.copyOf(comments);
        gatedColumns = gatedColumns == null ? null : List.copyOf(gatedColumns);
    }

    public Optional<Column> column(String columnName) {
        for (Column column : columns) {
            if (column.name().equals(columnName)) {
                return Optional.of(column);
            }
        }
        return Optional.empty();
    }

    public Optional<String> columnOf(String taskId) {
        for (Column column : columns) {
            if (column.taskIds().contains(taskId)) {
                return Optional.of(column.name());
            }
        }
        return Optional.empty();
    }

    public List<String> columnNames() {
        return columns.stream().map(Column::name).toList();
    }
}
