package io.laneboard.events;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

final class InProcessEventBroadcasterTest {

    @Test
    void subscriberSeesIncreasingVersionsPerBoard() throws Exception {
        try (InProcessEventBroadcaster events = new InProcessEventBroadcaster()) {
            List<Long> versions = new CopyOnWriteArrayList<>();
            CountDownLatch done = new CountDownLatch(1);
            events.subscribe("alpha", event -> {
                versions.add(event.version());
                if (event.kind() == EventKind.BOARD_CLEARED) {
                    done.countDown();
                }
            });

            events.publish(event("alpha", EventKind.TASK_CREATED, 2));
            events.publish(event("alpha", EventKind.TASK_MOVED, 4));
            events.publish(event("alpha", EventKind.TASK_UPDATED, 3));
            events.publish(event("beta", EventKind.TASK_CREATED, 9));
            events.publish(event("alpha", EventKind.BOARD_CLEARED, 5));

            Assertions.assertTrue(done.await(5, TimeUnit.SECONDS));
            Assertions.assertEquals(List.of(2L, 4L, 5L), versions);
            InProcessEventBroadcaster.Stats stats = events.stats();
            Assertions.assertEquals(5, stats.published());
            Assertions.assertEquals(1, stats.droppedStale());
        }
    }

    @Test
    void recreatedBoardRestartsVersionTracking() throws Exception {
        try (InProcessEventBroadcaster events = new InProcessEventBroadcaster()) {
            List<String> seen = new CopyOnWriteArrayList<>();
            CountDownLatch done = new CountDownLatch(3);
            events.subscribe(null, event -> {
                seen.add(event.kind().wireName() + "@" + event.version());
                done.countDown();
            });

            events.publish(event("alpha", EventKind.TASK_CREATED, 7));
            events.publish(event("alpha", EventKind.BOARD_CREATED, 1));
            events.publish(event("alpha", EventKind.TASK_CREATED, 2));

            Assertions.assertTrue(done.await(5, TimeUnit.SECONDS));
            Assertions.assertEquals(List.of("task-created@7", "board-created@1", "task-created@2"), seen);
        }
    }

    @Test
    void deletedBoardRestartsVersionTrackingForLaterWrites() throws Exception {
        try (InProcessEventBroadcaster events = new InProcessEventBroadcaster()) {
            List<String> seen = new CopyOnWriteArrayList<>();
            CountDownLatch done = new CountDownLatch(8);
            events.subscribe("proj", event -> {
                seen.add(event.kind().wireName() + "@" + event.version());
                done.countDown();
            });

            for (long version = 2; version <= 6; version++) {
                events.publish(event("proj", EventKind.TASK_CREATED, version));
            }
            events.publish(event("proj", EventKind.BOARD_DELETED, 7));
            // auto-created again on the next write, without a board-created event
            events.publish(event("proj", EventKind.TASK_CREATED, 2));
            events.publish(event("proj", EventKind.TASK_CREATED, 3));

            Assertions.assertTrue(done.await(5, TimeUnit.SECONDS));
            Assertions.assertEquals(List.of("task-created@2", "task-created@3", "task-created@4", "task-created@5",
                    "task-created@6", "board-deleted@7", "task-created@2", "task-created@3"), seen);
            Assertions.assertEquals(0, events.stats().droppedStale());
        }
    }

    @Test
    void eventsRacingShutdownAreNotCountedAsStale() throws Exception {
        InProcessEventBroadcaster events = new InProcessEventBroadcaster();
        CountDownLatch release = new CountDownLatch(1);
        events.subscribe("alpha", event -> {
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        events.publish(event("alpha", EventKind.TASK_CREATED, 2));

        // close() shuts the queue down, then waits on the blocked listener
        Thread closer = new Thread(events::close, "closer");
        closer.start();
        long version = 3;
        long deadline = System.currentTimeMillis() + 800L;
        while (events.stats().droppedClosed() == 0 && System.currentTimeMillis() < deadline) {
            events.publish(event("alpha", EventKind.TASK_MOVED, version++));
            Thread.sleep(5L);
        }
        release.countDown();
        closer.join(5_000L);

        InProcessEventBroadcaster.Stats stats = events.stats();
        Assertions.assertTrue(stats.droppedClosed() >= 1);
        Assertions.assertEquals(0, stats.droppedStale());
    }

    @Test
    void failingListenerDoesNotAffectOthers() throws Exception {
        try (InProcessEventBroadcaster events = new InProcessEventBroadcaster()) {
            CountDownLatch healthy = new CountDownLatch(2);
            events.subscribe(null, event -> {
                throw new IllegalStateException("listener bug");
            });
            events.subscribe(null, event -> healthy.countDown());

            events.publish(event("alpha", EventKind.TASK_CREATED, 2));
            events.publish(event("alpha", EventKind.TASK_MOVED, 3));

            Assertions.assertTrue(healthy.await(5, TimeUnit.SECONDS));
            long deadline = System.currentTimeMillis() + 5_000L;
            while (events.stats().listenerFailures() < 2 && System.currentTimeMillis() < deadline) {
                Thread.sleep(10L);
            }
            Assertions.assertEquals(2, events.stats().listenerFailures());
        }
    }

    @Test
    void closedSubscriptionStopsDelivery() throws Exception {
        try (InProcessEventBroadcaster events = new InProcessEventBroadcaster()) {
            List<Long> versions = new CopyOnWriteArrayList<>();
            EventBroadcaster.Subscription subscription = events.subscribe("alpha", event -> versions.add(event.version()));
            Assertions.assertEquals(1, events.stats().subscribers());
            subscription.close();
            Assertions.assertEquals(0, events.stats().subscribers());

            events.publish(event("alpha", EventKind.TASK_CREATED, 2));
            Assertions.assertTrue(versions.isEmpty());
            Assertions.assertEquals("boards:alpha", event("alpha", EventKind.TASK_CREATED, 2).channel());
        }
    }

    private static BoardEvent event(String board, EventKind kind, long version) {
        return new BoardEvent(board, kind, version, Map.of("taskId", "tsk_" + version), 1_000L + version);
    }
}
