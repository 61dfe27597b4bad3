package io.laneboard.events;

import java.util.Map;

/**
 * Notification of one committed board write. {@code version} is the board version the write
 * produced, so subscribers can order events per board.
 */
public record BoardEvent(String board, EventKind kind, long version, Map<String, Object> payload, long atMs) {
    public BoardEvent {
        payload = payload == null ? Map.of() : payload;
    }

    public String channel() {
        return "boards:" + board;
    }
}
