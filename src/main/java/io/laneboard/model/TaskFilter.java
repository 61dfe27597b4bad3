package io.laneboard.model;

public record TaskFilter(String column, Assignee assignee, Priority priority, String label) {
    public static TaskFilter none() {
        return new TaskFilter(null, null, null, null);
    }

    public boolean matches(TaskView task) {
        if (column != null && !column.isBlank() && !column.trim().equalsIgnoreCase(task.column())) {
            return false;
        }
        if (assignee != null && assignee != task.assignee()) {
            return false;
        }
        if (priority != null && priority != task.priority()) {
            return false;
        }
        return label == null || label.isBlank() || task.labels().contains(label.trim());
    }
}
