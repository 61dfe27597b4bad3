package io.laneboard.events;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Delivers events to subscribers in this JVM. Each subscriber gets its own single-thread queue,
 * so a slow listener only delays itself. Per board, a subscriber never sees a version older than
 * one it has already received.
 */
public final class InProcessEventBroadcaster implements EventBroadcaster, AutoCloseable {
    private final CopyOnWriteArrayList<Subscriber> subscribers = new CopyOnWriteArrayList<>();
    private final AtomicLong published = new AtomicLong();
    private final AtomicLong delivered = new AtomicLong();
    private final AtomicLong droppedStale = new AtomicLong();
    private final AtomicLong droppedClosed = new AtomicLong();
    private final AtomicLong listenerFailures = new AtomicLong();

    @Override
    public void publish(BoardEvent event) {
        published.incrementAndGet();
        for (Subscriber subscriber : subscribers) {
            if (subscriber.board == null || subscriber.board.equals(event.board())) {
                subscriber.offer(event);
            }
        }
    }

    @Override
    public Subscription subscribe(String board, Consumer<BoardEvent> listener) {
        Subscriber subscriber = new Subscriber(board, listener);
        subscribers.add(subscriber);
        return () -> {
            subscribers.remove(subscriber);
            subscriber.executor.shutdown();
        };
    }

    public Stats stats() {
        return new Stats(subscribers.size(), published.get(), delivered.get(), droppedStale.get(), droppedClosed.get(),
                listenerFailures.get());
    }

    @Override
    public void close() {
        for (Subscriber subscriber : subscribers) {
            subscriber.executor.shutdown();
        }
        for (Subscriber subscriber : subscribers) {
            try {
                subscriber.executor.awaitTermination(1, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        subscribers.clear();
    }

    /**
     * @param droppedStale events older than one the subscriber already received
     * @param droppedClosed events that raced with an unsubscribe or shutdown
     */
    public record Stats(int subscribers, long published, long delivered, long droppedStale, long droppedClosed,
                        long listenerFailures) {
    }

    private final class Subscriber {
        private final String board;
        private final Consumer<BoardEvent> listener;
        private final ExecutorService executor;
        private final Map<String, Long> lastVersion = new ConcurrentHashMap<>();

        private Subscriber(String board, Consumer<BoardEvent> listener) {
            this.board = board;
            this.listener = listener;
            this.executor = Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r, "laneboard-events");
                t.setDaemon(true);
                return t;
            });
        }

        private void offer(BoardEvent event) {
            if (executor.isShutdown()) {
                droppedClosed.incrementAndGet();
                return;
            }
            try {
                executor.execute(() -> deliver(event));
            } catch (RejectedExecutionException e) {
                droppedClosed.incrementAndGet();
            }
        }

        private void deliver(BoardEvent event) {
            Long last = lastVersion.get(event.board());
            // a re-created board starts over at version 1
            boolean restart = event.kind() == EventKind.BOARD_CREATED;
            if (!restart && last != null && event.version() <= last) {
                droppedStale.incrementAndGet();
                return;
            }
            if (event.kind() == EventKind.BOARD_DELETED) {
                // the next write to this board name starts a new version sequence
                lastVersion.remove(event.board());
            } else {
                lastVersion.put(event.board(), event.version());
            }
            try {
                listener.accept(event);
                delivered.incrementAndGet();
            } catch (RuntimeException e) {
                listenerFailures.incrementAndGet();
            }
        }
    }
}
