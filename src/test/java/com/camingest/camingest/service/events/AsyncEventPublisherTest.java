package com.camingest.camingest.service.events;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import com.camingest.camingest.model.dto.CameraEvent;
import com.camingest.camingest.model.dto.CameraEventType;
import com.camingest.camingest.service.metrics.CameraMetrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

class AsyncEventPublisherTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private AsyncEventPublisher publisher;

    static class CollectingSink implements EventSink {
        final String name;
        final List<CameraEvent> received = new CopyOnWriteArrayList<>();

        CollectingSink(String name) {
            this.name = name;
        }

        @Override
        public String getName() {
            return name;
        }

        @Override
        public void deliver(String channel, CameraEvent event) {
            received.add(event);
        }
    }

    @AfterEach
    void tearDown() {
        if (publisher != null) {
            publisher.stop();
        }
    }

    private static CameraEvent event(String cameraId, long ts) {
        return CameraEvent.builder(cameraId, CameraEventType.FRAME_INGESTED, ts).build();
    }

    private static void awaitSize(List<?> list, int size) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (list.size() < size && System.currentTimeMillis() < deadline) {
            Thread.sleep(5);
        }
        assertEquals(size, list.size());
    }

    @Test
    void deliversToEverySinkInPublishOrder() throws Exception {
        CollectingSink a = new CollectingSink("a");
        CollectingSink b = new CollectingSink("b");
        publisher = new AsyncEventPublisher(16, List.of(a, b), new CameraMetrics(registry));
        publisher.start();

        for (int i = 0; i < 5; i++) {
            publisher.publish(event("cam-1", i));
        }

        awaitSize(a.received, 5);
        awaitSize(b.received, 5);
        for (int i = 0; i < 5; i++) {
            assertEquals(i, a.received.get(i).getTimestamp());
        }
        assertEquals("camera:cam-1", a.received.get(0).getChannel());
    }

    @Test
    void failingSinkDoesNotStarveTheOthers() throws Exception {
        EventSink broken = new EventSink() {
            @Override
            public String getName() {
                return "broken";
            }

            @Override
            public void deliver(String channel, CameraEvent event) throws Exception {
                throw new IOException("socket closed");
            }
        };
        CollectingSink healthy = new CollectingSink("healthy");
        publisher = new AsyncEventPublisher(16, List.of(broken, healthy), new CameraMetrics(registry));
        publisher.start();

        publisher.publish(event("cam-1", 1));
        publisher.publish(event("cam-1", 2));

        awaitSize(healthy.received, 2);
        assertEquals(2.0, registry.get(CameraMetrics.SINK_FAILURES).tag("sink", "broken").counter().count());
    }

    @Test
    void fullQueueDropsInsteadOfBlocking() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        CollectingSink collected = new CollectingSink("collected");
        EventSink slow = new EventSink() {
            @Override
            public String getName() {
                return "slow";
            }

            @Override
            public void deliver(String channel, CameraEvent event) throws Exception {
                entered.countDown();
                release.await();
            }
        };
        publisher = new AsyncEventPublisher(2, List.of(slow, collected), new CameraMetrics(registry));
        publisher.start();

        publisher.publish(event("cam-1", 1));
        assertTrue(entered.await(5, TimeUnit.SECONDS));

        publisher.publish(event("cam-1", 2));
        publisher.publish(event("cam-1", 3));
        long started = System.nanoTime();
        publisher.publish(event("cam-1", 4));
        assertTrue(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started) < 500);

        assertEquals(1, publisher.getDroppedCount());
        assertEquals(1.0, registry.get(CameraMetrics.EVENTS_DROPPED).counter().count());

        release.countDown();
        awaitSize(collected.received, 3);
    }

    @Test
    void eventsPublishedBeforeStartAreDropped() {
        CollectingSink sink = new CollectingSink("sink");
        publisher = new AsyncEventPublisher(4, List.of(sink), new CameraMetrics(registry));

        publisher.publish(event("cam-1", 1));

        assertEquals(1, publisher.getDroppedCount());
        assertFalse(publisher.isRunning());
    }

    @Test
    void stopDeliversWhatIsAlreadyQueued() {
        CollectingSink sink = new CollectingSink("sink");
        publisher = new AsyncEventPublisher(64, List.of(sink), new CameraMetrics(registry));
        publisher.start();
        for (int i = 0; i < 20; i++) {
            publisher.publish(event("cam-" + (i % 3), i));
        }
        publisher.stop();

        assertEquals(20, sink.received.size());
        assertEquals(0, publisher.getQueuedCount());
    }
}
