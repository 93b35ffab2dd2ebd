package com.camingest.camingest.service.buffer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReferenceArray;

/**
 * Fixed-capacity, overwrite-oldest buffer of the most recent frames of one camera.
 *
 * One writer (the owning worker) and any number of readers. Writes never take a lock:
 * each slot carries the sequence number it was written with, the slot is stored first and
 * the write count is published afterwards. Readers never block the writer and never see
 * more than {@code capacity} entries.
 */
public class FrameRingBuffer<T> {

    private final int capacity;
    private final AtomicReferenceArray<Slot<T>> slots;
    private volatile long written = 0;

    public FrameRingBuffer(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.slots = new AtomicReferenceArray<>(capacity);
    }

    /**
     * Single writer only. Evicts the oldest entry once full.
     */
    public void put(T item) {
        long n = written;
        slots.set(index(n), new Slot<>(n, item));
        written = n + 1;
    }

    public Optional<T> getLatest() {
        long n = written;
        if (n == 0) {
            return Optional.empty();
        }
        Slot<T> slot = slots.get(index(n - 1));
        return Optional.ofNullable(slot.item);
    }

    /**
     * Oldest to newest. Starts over if the writer overwrote a slot while it was being copied.
     */
    public List<T> getAll() {
        retry:
        while (true) {
            long end = written;
            long start = Math.max(0, end - capacity);
            List<T> copy = new ArrayList<>((int) (end - start));
            for (long seq = start; seq < end; seq++) {
                Slot<T> slot = slots.get(index(seq));
                if (slot == null || slot.seq != seq) {
                    continue retry;
                }
                copy.add(slot.item);
            }
            return Collections.unmodifiableList(copy);
        }
    }

    public int size() {
        return (int) Math.min(written, capacity);
    }

    public int capacity() {
        return capacity;
    }

    public boolean isEmpty() {
        return written == 0;
    }

    private int index(long seq) {
        return (int) (seq % capacity);
    }

    private static final class Slot<T> {
        final long seq;
        final T item;

        Slot(long seq, T item) {
            this.seq = seq;
            this.item = item;
        }
    }
}
