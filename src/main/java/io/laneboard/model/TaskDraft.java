package io.laneboard.model;

import java.util.List;

/**
 * Input for creating a task. Everything except the title is optional.
 */
public record TaskDraft(
        String title,
        String description,
        String column,
        Priority priority,
        Assignee assignee,
        List<String> labels,
        List<String> links,
        String context,
        List<String> blockedBy,
        Integer autoPullThreshold,
        Integer autoReleaseMinutes
) {
    public static TaskDraft titled(String title) {
        return new TaskDraft(title, null, null, null, null, null, null, null, null, null, null);
    }

    public TaskDraft inColumn(String targetColumn) {
        return new TaskDraft(title, description, targetColumn, priority, assignee, labels, links, context,
                blockedBy, autoPullThreshold, autoReleaseMinutes);
    }

    public TaskDraft blockedBy(List<String> ids) {
        return new TaskDraft(title, description, column, priority, assignee, labels, links, context,
                ids, autoPullThreshold, autoReleaseMinutes);
    }

    public TaskDraft assignedTo(Assignee who) {
        return new TaskDraft(title, description, column, priority, who, labels, links, context,
                blockedBy, autoPullThreshold, autoReleaseMinutes);
    }
}
