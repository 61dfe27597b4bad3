package io.laneboard.model;

import java.util.List;

public record SweepOutcome(String board, int moved, List<Step> steps, List<String> warnings, long fencingEpoch) {
    public SweepOutcome {
        steps = steps == null ? List.of() : List.copyOf(steps);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public record Step(String taskId, String fromColumn, String toColumn) {
    }
}
