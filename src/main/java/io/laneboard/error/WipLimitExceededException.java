package io.laneboard.error;

import java.util.Map;

public final class WipLimitExceededException extends BoardException {
    public WipLimitExceededException(String taskId, String column, int current, int limit) {
        super(
                ErrorKind.WIP_LIMIT_EXCEEDED,
                "Column " + column + " is at its WIP limit (" + current + "/" + limit + ")",
                Map.of("taskId", taskId, "column", column, "current", current, "limit", limit)
        );
    }
}
