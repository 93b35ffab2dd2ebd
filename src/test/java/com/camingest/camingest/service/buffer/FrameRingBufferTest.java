package com.camingest.camingest.service.buffer;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.Test;

class FrameRingBufferTest {

    @Test
    void emptyBufferHasNoLatest() {
        FrameRingBuffer<Integer> buffer = new FrameRingBuffer<>(3);
        assertTrue(buffer.isEmpty());
        assertEquals(0, buffer.size());
        assertTrue(buffer.getLatest().isEmpty());
        assertTrue(buffer.getAll().isEmpty());
    }

    @Test
    void keepsTheNewestCapacityItemsInOrder() {
        FrameRingBuffer<Integer> buffer = new FrameRingBuffer<>(3);
        for (int i = 1; i <= 7; i++) {
            buffer.put(i);
            assertEquals(Math.min(i, 3), buffer.size());
            assertEquals(i, buffer.getLatest().orElseThrow());
        }
        assertEquals(List.of(5, 6, 7), buffer.getAll());
    }

    @Test
    void partiallyFilledBufferReturnsWhatWasWritten() {
        FrameRingBuffer<String> buffer = new FrameRingBuffer<>(10);
        buffer.put("a");
        buffer.put("b");
        assertEquals(List.of("a", "b"), buffer.getAll());
    }

    @Test
    void rejectsNonPositiveCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new FrameRingBuffer<>(0));
    }

    @Test
    void readersNeverSeeMoreThanCapacityOrOutOfOrderItems() throws Exception {
        FrameRingBuffer<Long> buffer = new FrameRingBuffer<>(4);
        AtomicReference<String> problem = new AtomicReference<>();

        Thread reader = new Thread(() -> {
            for (int i = 0; i < 20_000 && problem.get() == null; i++) {
                List<Long> snapshot = buffer.getAll();
                if (snapshot.size() > buffer.capacity()) {
                    problem.set("snapshot larger than capacity: " + snapshot);
                }
                for (int j = 1; j < snapshot.size(); j++) {
                    if (snapshot.get(j) != snapshot.get(j - 1) + 1) {
                        problem.set("gap or reorder in " + snapshot);
                    }
                }
            }
        });
        reader.start();
        for (long n = 0; n < 200_000; n++) {
            buffer.put(n);
        }
        reader.join();

        assertNull(problem.get(), problem.get());
        assertEquals(199_999L, buffer.getLatest().orElseThrow());
    }
}
