package io.laneboard.model;

import java.util.List;

/**
 * Stored task. The column is not part of the task; it is derived from the board's column
 * sequences.
 */
public record Task(
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
        Integer autoReleaseMinutes,
        Author createdBy,
        long createdAtMs,
        long updatedAtMs
) {
    public Task {
        priority = priority == null ? Priority.MEDIUM : priority;
        assignee = assignee == null ? Assignee.UNASSIGNED : assignee;
        labels = labels == null ? List.of() : List.copyOf(labels);
        links = links == null ? List.of() : List.copyOf(links);
        blockedBy = blockedBy == null ? List.of() : List.copyOf(blockedBy);
    }

    public Task withBlockedBy(List<String> nextBlockedBy, long nowMs) {
        return new Task(id, title, description, priority, assignee, labels, links, context, nextBlockedBy,
                autoPullThreshold, autoReleaseMinutes, createdBy, createdAtMs, nowMs);
    }

    public Task touched(long nowMs) {
        return new Task(id, title, description, priority, assignee, labels, links, context, blockedBy,
                autoPullThreshold, autoReleaseMinutes, createdBy, createdAtMs, nowMs);
    }
}
