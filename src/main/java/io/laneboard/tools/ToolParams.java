package io.laneboard.tools;

import io.laneboard.model.Assignee;
import io.laneboard.model.Author;
import io.laneboard.model.ColumnSpec;
import io.laneboard.model.Priority;
import io.laneboard.model.SweepMove;
import io.laneboard.model.TaskDraft;
import io.laneboard.model.TaskFilter;
import io.laneboard.model.TaskPatch;

import java.util.List;

/**
 * Typed parameter shapes for each tool method. Binding fails on keys a shape does not declare.
 */
public final class ToolParams {
    private ToolParams() {
    }

    public record BoardRef(String board) {
    }

    public record TaskRef(String board, String id) {
    }

    public record AddParams(
            String board,
            String title,
            String column,
            Priority priority,
            Assignee assignee,
            List<String> blockedBy,
            String context,
            String description,
            List<String> labels,
            List<String> links,
            Integer autoPullThreshold,
            Integer autoReleaseMinutes
    ) {
        TaskDraft toDraft() {
            return new TaskDraft(title, description, column, priority, assignee, labels, links, context,
                    blockedBy, autoPullThreshold, autoReleaseMinutes);
        }
    }

    public record MoveParams(String board, String id, String column) {
    }

    public record ReorderParams(String board, String id, String column, String beforeId) {
    }

    public record EditParams(
            String board,
            String id,
            String title,
            String description,
            Priority priority,
            Assignee assignee,
            List<String> labels,
            List<String> links,
            String context,
            List<String> blockedBy,
            Integer autoPullThreshold,
            Integer autoReleaseMinutes
    ) {
        TaskPatch toPatch() {
            return new TaskPatch(title, description, priority, assignee, labels, links, context, blockedBy,
                    autoPullThreshold, autoReleaseMinutes);
        }
    }

    public record BlockParams(String board, String id, String blockedBy, Boolean remove) {
    }

    public record SearchParams(String board, String query) {
    }

    public record CommentParams(String board, String id, String content, Author author) {
    }

    public record ColumnParams(String board, String name, Boolean remove, Integer position, Integer wipLimit) {
    }

    public record SweepParams(String board, List<SweepMove> moves) {
    }

    public record ListParams(String board, String column, Assignee assignee, Priority priority, String label) {
        TaskFilter toFilter() {
            return new TaskFilter(column, assignee, priority, label);
        }
    }

    public record CreateBoardParams(String board, List<ColumnSpec> columns) {
    }

    public record ArchivedParams(String board, Integer limit) {
    }
}
