package io.laneboard.error;

import java.util.List;
import java.util.Map;

public final class DependencyUnresolvedException extends BoardException {
    private final List<String> unresolved;

    public DependencyUnresolvedException(String taskId, String column, List<String> unresolved) {
        super(
                ErrorKind.DEPENDENCY_UNRESOLVED,
                "Task " + taskId + " cannot enter " + column + " while blocked by " + unresolved,
                Map.of("taskId", taskId, "column", column, "blockedBy", List.copyOf(unresolved))
        );
        this.unresolved = List.copyOf(unresolved);
    }

    public List<String> unresolved() {
        return unresolved;
    }
}
