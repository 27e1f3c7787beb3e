package com.brixo.connecthub.session.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.brixo.connecthub.session.model.SessionEvent;
import com.brixo.connecthub.session.model.SessionEventType;
import com.brixo.connecthub.session.model.SessionSnapshot;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.LongStream;
import org.junit.jupiter.api.Test;

class SnapshotPublisherTest {

    private final SnapshotPublisher publisher = new SnapshotPublisher();

    @Test
    void latestStartsEmpty() {
        assertEquals(0L, publisher.latest().sequence());
        assertTrue(publisher.latest().devices().isEmpty());
    }

    @Test
    void sequencesGrowByOneAndReachSubscribers() {
        List<Long> seen = new ArrayList<>();
        publisher.subscribe(snapshot -> seen.add(snapshot.sequence()));

        SessionSnapshot first = publisher.publish(SnapshotPublisherTest::snapshot);
        SessionSnapshot second = publisher.publish(SnapshotPublisherTest::snapshot);

        assertEquals(1L, first.sequence());
        assertEquals(2L, second.sequence());
        assertSame(second, publisher.latest());
        assertEquals(List.of(1L, 2L), seen);
    }

    @Test
    void failingSubscriberDoesNotStopDelivery() {
        List<SessionSnapshot> delivered = new ArrayList<>();
        publisher.subscribe(snapshot -> {
            throw new IllegalStateException("consumidor roto");
        });
        publisher.subscribe(delivered::add);

        publisher.publish(SnapshotPublisherTest::snapshot);

        assertEquals(1, delivered.size());
    }

    @Test
    void eventsReachSubscribersUntilTheyLeave() {
        List<SessionEvent> events = new ArrayList<>();
        SnapshotSubscriber subscriber = new SnapshotSubscriber() {
            @Override
            public void onSnapshot(SessionSnapshot snapshot) {
            }

            @Override
            public void onEvent(SessionEvent event) {
                events.add(event);
            }
        };
        publisher.subscribe(subscriber);

        publisher.publishEvent(new SessionEvent(SessionEventType.BUS_DISCONNECTED, null, "caído", Instant.EPOCH));
        publisher.unsubscribe(subscriber);
        publisher.publishEvent(new SessionEvent(SessionEventType.BUS_RECONNECTED, null, "vuelto", Instant.EPOCH));

        assertEquals(1, events.size());
        assertEquals(SessionEventType.BUS_DISCONNECTED, events.get(0).type());
    }

    @Test
    void lateSubscriberStartsFromTheLatestSnapshot() {
        publisher.publish(SnapshotPublisherTest::snapshot);
        publisher.publish(SnapshotPublisherTest::snapshot);
        List<Long> seen = new ArrayList<>();

        publisher.subscribe(snapshot -> seen.add(snapshot.sequence()));
        publisher.publish(SnapshotPublisherTest::snapshot);

        assertEquals(List.of(2L, 3L), seen);
    }

    @Test
    void slowSubscriberKeepsItsOrderWithoutHoldingThePublisher() throws Exception {
        ExecutorService delivery = Executors.newCachedThreadPool();
        try {
            SnapshotPublisher async = new SnapshotPublisher(delivery);
            CountDownLatch gate = new CountDownLatch(1);
            List<Long> seen = new CopyOnWriteArrayList<>();
            async.subscribe(snapshot -> {
                try {
                    gate.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                seen.add(snapshot.sequence());
            });

            for (int i = 0; i < 20; i++) {
                async.publish(SnapshotPublisherTest::snapshot);
            }
            assertEquals(20L, async.latest().sequence());
            assertTrue(seen.isEmpty());

            gate.countDown();
            long deadline = System.currentTimeMillis() + 5000;
            while (seen.size() < 20 && System.currentTimeMillis() < deadline) {
                Thread.sleep(10);
            }
            assertEquals(LongStream.rangeClosed(1, 20).boxed().toList(), seen);
        } finally {
            delivery.shutdownNow();
        }
    }

    @Test
    void guardDropsOutOfOrderSnapshots() {
        SnapshotSequenceGuard guard = new SnapshotSequenceGuard();
        SessionSnapshot first = publisher.publish(SnapshotPublisherTest::snapshot);
        SessionSnapshot second = publisher.publish(SnapshotPublisherTest::snapshot);

        assertTrue(guard.accept(second));
        assertFalse(guard.accept(first));
        assertFalse(guard.accept(second));
        assertEquals(2L, guard.lastApplied());
    }

    private static SessionSnapshot snapshot(long sequence) {
        return new SessionSnapshot(sequence, Instant.EPOCH, true, List.of(), List.of(), List.of(), List.of());
    }
}
