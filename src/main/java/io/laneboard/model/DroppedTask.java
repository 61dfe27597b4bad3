package io.laneboard.model;

import java.util.List;

/**
 * Removed task plus the ids of tasks whose {@code blockedBy} referenced it.
 */
public record DroppedTask(TaskView task, List<String> unblocked) {
}
