package io.laneboard.model;

import java.util.List;

/**
 * Result of a column-changing transition. {@code warnings} is only non-empty under the
 * {@code warn} WIP policy.
 */
public record MoveOutcome(TaskView task, String fromColumn, List<String> warnings) {
    public MoveOutcome {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
