package io.laneboard.events;

import java.util.function.Consumer;

/**
 * Best-effort fan-out of board events. Publishing never blocks on, or fails because of, a
 * subscriber.
 */
public interface EventBroadcaster {
    void publish(BoardEvent event);

    /**
     * @param board board to follow, or null for every board
     */
    Subscription subscribe(String board, Consumer<BoardEvent> listener);

    interface Subscription extends AutoCloseable {
        @Override
        void close();
    }
}
