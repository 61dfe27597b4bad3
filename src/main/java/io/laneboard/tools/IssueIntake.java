package io.laneboard.tools;

import com.fasterxml.jackson.databind.JsonNode;
import io.laneboard.config.BoardSettings;
import io.laneboard.engine.TransitionEngine;
import io.laneboard.error.ValidationException;
import io.laneboard.model.TaskDraft;
import io.laneboard.model.TaskFilter;
import io.laneboard.model.TaskView;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Turns GitHub issue webhook payloads into board changes. Each repository gets its own board
 * ({@code owner/repo} becomes {@code owner-repo}); an opened issue becomes a Backlog task titled
 * {@code #N: title}, a closed issue moves that task to Done.
 */
public final class IssueIntake {
    private final TransitionEngine engine;

    public IssueIntake(TransitionEngine engine) {
        this.engine = engine;
    }

    public IssueResult handle(JsonNode payload) {
        if (payload == null || !payload.isObject()) {
            throw new ValidationException("Issue payload must be a JSON object");
        }
        String action = payload.path("action").asText("");
        JsonNode issue = payload.path("issue");
        String repository = payload.path("repository").path("full_name").asText("");
        int number = issue.path("number").asInt(-1);
        if (repository.isBlank() || number < 0) {
            throw new ValidationException("Issue payload needs repository.full_name and issue.number");
        }
        String prefix = "#" + number + ":";
        Optional<TaskView> existing = findIssueTask(repository, prefix);
        switch (action) {
            case "opened" -> {
                if (existing.isPresent()) {
                    return new IssueResult(false, action, repository, existing.get().id());
                }
                String title = issue.path("title").asText("").trim();
                String body = issue.path("body").isTextual() ? issue.path("body").asText() : null;
                TaskDraft draft = new TaskDraft(prefix + " " + (title.isEmpty() ? "(untitled)" : title), body,
                        null, null, null, labels(issue), issueLinks(issue), null, null, null, null);
                TaskView created = engine.add(repository, draft);
                return new IssueResult(true, action, repository, created.id());
            }
            case "closed" -> {
                if (existing.isEmpty()) {
                    return new IssueResult(false, action, repository, null);
                }
                TaskView task = existing.get();
                if (BoardSettings.DONE.equals(task.column())) {
                    return new IssueResult(false, action, repository, task.id());
                }
                engine.move(repository, task.id(), BoardSettings.DONE);
                return new IssueResult(true, action, repository, task.id());
            }
            default -> {
                return new IssueResult(false, action, repository, existing.map(TaskView::id).orElse(null));
            }
        }
    }

    private Optional<TaskView> findIssueTask(String repository, String prefix) {
        for (TaskView task : engine.list(repository, TaskFilter.none())) {
            if (task.title().startsWith(prefix)) {
                return Optional.of(task);
            }
        }
        return Optional.empty();
    }

    private static List<String> labels(JsonNode issue) {
        List<String> out = new ArrayList<>();
        for (JsonNode label : issue.path("labels")) {
            String name = label.isTextual() ? label.asText() : label.path("name").asText("");
            if (!name.isBlank()) {
                out.add(name);
            }
        }
        return out;
    }

    private static List<String> issueLinks(JsonNode issue) {
        String url = issue.path("html_url").asText("");
        return url.isBlank() ? List.of() : List.of(url);
    }

    public record IssueResult(boolean processed, String action, String repository, String taskId) {
    }
}
