package io.laneboard.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Task as returned to callers: the stored task plus its derived column, and comments when the
 * caller asked for the full record.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskView(
        String id,
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
        Integer autoReleaseMinutes,
        Author createdBy,
        long createdAtMs,
        long updatedAtMs,
        List<Comment> comments
) {
    public static TaskView of(Task task, String column) {
        return of(task, column, null);
    }

    public static TaskView of(Task task, String column, List<Comment> comments) {
        return new TaskView(
                task.id(),
                task.title(),
                task.description(),
                column,
                task.priority(),
                task.assignee(),
                task.labels(),
                task.links(),
                task.context(),
                task.blockedBy(),
                task.autoPullThreshold(),
                task.autoReleaseMinutes(),
                task.createdBy(),
                task.createdAtMs(),
                task.updatedAtMs(),
                comments
        );
    }
}
