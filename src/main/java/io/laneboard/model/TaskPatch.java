package io.laneboard.model;

import java.util.List;

/**
 * Partial task update. A null field means "leave unchanged"; a blank description or context
 * clears it.
 */
public record TaskPatch(
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
    public static TaskPatch empty() {
        return new TaskPatch(null, null, null, null, null, null, null, null, null, null);
    }

    public static TaskPatch ofPriority(Priority priority) {
        return new TaskPatch(null, null, priority, null, null, null, null, null, null, null);
    }

    public static TaskPatch ofBlockedBy(List<String> blockedBy) {
        return new TaskPatch(null, null, null, null, null, null, null, blockedBy, null, null);
    }

    public boolean isEmpty() {
        return title == null && description == null && priority == null && assignee == null
                && labels == null && links == null && context == null && blockedBy == null
                && autoPullThreshold == null && autoReleaseMinutes == null;
    }
}
