package io.laneboard.tools;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.laneboard.engine.TransitionEngine;
import io.laneboard.error.BoardException;
import io.laneboard.error.NotFoundException;
import io.laneboard.error.ValidationException;
import io.laneboard.model.SearchHit;
import io.laneboard.model.TaskView;
import io.laneboard.util.Jsons;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Method-name + JSON-params entry point shared by the CLI {@code call} command and the HTTP
 * server. Engine failures come back as typed error responses, never as exceptions.
 */
public final class BoardToolDispatcher {
    public static final List<String> METHODS = List.of(
            "add", "move", "reorder", "edit", "drop", "block", "search", "comment", "comments", "show",
            "board", "column", "clear", "stats", "sweep", "list", "mine",
            "boards", "create-board", "delete-board", "active", "archived", "issue"
    );
    private static final int DEFAULT_ARCHIVED_LIMIT = 50;

    private final TransitionEngine engine;
    private final IssueIntake issues;

    public BoardToolDispatcher(TransitionEngine engine) {
        this.engine = engine;
        this.issues = new IssueIntake(engine);
    }

    public ToolResponse call(String method, JsonNode params) {
        try {
            JsonNode effective = params == null || params.isNull() || params.isMissingNode()
                    ? Jsons.mapper().createObjectNode()
                    : params;
            if (!effective.isObject()) {
                throw new ValidationException("Tool params must be a JSON object");
            }
            return ToolResponse.success(dispatch(method == null ? "" : method.trim(), effective));
        } catch (BoardException e) {
            return ToolResponse.failure(e);
        }
    }

    private Object dispatch(String method, JsonNode params) {
        switch (method) {
            case "add" -> {
                ToolParams.AddParams p = bind(params, ToolParams.AddParams.class);
                return engine.add(p.board(), p.toDraft());
            }
            case "move" -> {
                ToolParams.MoveParams p = bind(params, ToolParams.MoveParams.class);
                return engine.move(p.board(), p.id(), p.column());
            }
            case "reorder" -> {
                ToolParams.ReorderParams p = bind(params, ToolParams.ReorderParams.class);
                return engine.reorder(p.board(), p.id(), p.column(), p.beforeId());
            }
            case "edit" -> {
                ToolParams.EditParams p = bind(params, ToolParams.EditParams.class);
                return engine.edit(p.board(), p.id(), p.toPatch());
            }
            case "drop" -> {
                ToolParams.TaskRef p = bind(params, ToolParams.TaskRef.class);
                return engine.drop(p.board(), p.id());
            }
            case "block" -> {
                ToolParams.BlockParams p = bind(params, ToolParams.BlockParams.class);
                return engine.block(p.board(), p.id(), p.blockedBy(), Boolean.TRUE.equals(p.remove()));
            }
            case "search" -> {
                ToolParams.SearchParams p = bind(params, ToolParams.SearchParams.class);
                if (p.board() == null || p.board().isBlank()) {
                    List<SearchHit> hits = new ArrayList<>();
                    engine.searchAll(p.query()).forEach(hits::add);
                    return hits;
                }
                List<TaskView> out = new ArrayList<>();
                engine.search(p.board(), p.query()).forEach(out::add);
                return out;
            }
            case "comment" -> {
                ToolParams.CommentParams p = bind(params, ToolParams.CommentParams.class);
                return engine.comment(p.board(), p.id(), p.content(), p.author());
            }
            case "comments" -> {
                ToolParams.TaskRef p = bind(params, ToolParams.TaskRef.class);
                return engine.comments(p.board(), p.id());
            }
            case "show" -> {
                ToolParams.TaskRef p = bind(params, ToolParams.TaskRef.class);
                return engine.show(p.board(), p.id());
            }
            case "board" -> {
                return engine.board(bind(params, ToolParams.BoardRef.class).board());
            }
            case "column" -> {
                ToolParams.ColumnParams p = bind(params, ToolParams.ColumnParams.class);
                return engine.column(p.board(), p.name(), Boolean.TRUE.equals(p.remove()), p.position(), p.wipLimit());
            }
            case "clear" -> {
                int archived = engine.clear(bind(params, ToolParams.BoardRef.class).board());
                return Map.of("archived", archived);
            }
            case "stats" -> {
                return engine.stats(bind(params, ToolParams.BoardRef.class).board());
            }
            case "sweep" -> {
                ToolParams.SweepParams p = bind(params, ToolParams.SweepParams.class);
                return engine.sweep(p.board(), p.moves());
            }
            case "list" -> {
                ToolParams.ListParams p = bind(params, ToolParams.ListParams.class);
                return engine.list(p.board(), p.toFilter());
            }
            case "mine" -> {
                return engine.mine(bind(params, ToolParams.BoardRef.class).board());
            }
            case "boards" -> {
                bind(params, ToolParams.BoardRef.class);
                return engine.boards();
            }
            case "create-board" -> {
                ToolParams.CreateBoardParams p = bind(params, ToolParams.CreateBoardParams.class);
                return engine.createBoard(p.board(), p.columns());
            }
            case "delete-board" -> {
                return engine.deleteBoard(bind(params, ToolParams.BoardRef.class).board());
            }
            case "active" -> {
                bind(params, ToolParams.BoardRef.class);
                return engine.activeBoard();
            }
            case "archived" -> {
                ToolParams.ArchivedParams p = bind(params, ToolParams.ArchivedParams.class);
                return engine.archived(p.board(), p.limit() == null ? DEFAULT_ARCHIVED_LIMIT : p.limit());
            }
            case "issue" -> {
                return issues.handle(params);
            }
            default -> throw new NotFoundException("method", method);
        }
    }

    /**
     * Binds params to {@code type}; unknown keys, wrong types and unknown enum values all become
     * VALIDATION_ERROR.
     */
    static <T> T bind(JsonNode params, Class<T> type) {
        try {
            return Jsons.mapper().treeToValue(params, type);
        } catch (JsonProcessingException e) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("params", type.getSimpleName());
            details.put("reason", e.getOriginalMessage() == null ? "invalid params" : e.getOriginalMessage());
            throw new ValidationException("Invalid params: " + e.getOriginalMessage(), details);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Invalid params: " + e.getMessage(), e);
        }
    }
}
