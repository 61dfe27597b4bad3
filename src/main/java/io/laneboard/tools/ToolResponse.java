package io.laneboard.tools;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.laneboard.error.BoardException;

import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ToolResponse(boolean ok, Object result, ToolError error) {
    public static ToolResponse success(Object result) {
        return new ToolResponse(true, result, null);
    }

    public static ToolResponse failure(BoardException e) {
        return new ToolResponse(false, null,
                new ToolError(e.kind().name(), e.getMessage(), e.kind().retryable(), e.details()));
    }

    public record ToolError(String kind, String message, boolean retryable, Map<String, Object> details) {
    }
}
