package io.laneboard.error;

import java.util.Map;

public final class NotFoundException extends BoardException {
    public NotFoundException(String resource, String id) {
        super(ErrorKind.NOT_FOUND, resource + " not found: " + id, Map.of("resource", resource, "id", id));
    }

    public static NotFoundException task(String id) {
        return new NotFoundException("task", id);
    }

    public static NotFoundException board(String id) {
        return new NotFoundException("board", id);
    }

    public static NotFoundException column(String id) {
        return new NotFoundException("column", id);
    }
}
