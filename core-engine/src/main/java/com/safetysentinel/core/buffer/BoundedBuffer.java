package com.safetysentinel.core.buffer;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Fixed-capacity FIFO container that evicts its oldest entry once full.
 *
 * <p>
 * Used by every metric and event store in the engine. Eviction is the only
 * back-pressure mechanism: pushing never blocks and never fails.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * All methods synchronize on the buffer. {@link #snapshot()} returns an
 * immutable copy, so readers never observe a deque that is being mutated.
 * </p>
 *
 * @param <T> element type; {@code null} elements are rejected
 * @since 1.0.0
 */
public final class BoundedBuffer<T> {

    private final int capacity;
    private final Deque<T> items;
    private long evicted;

    /**
     * @param capacity maximum number of retained elements; must be &gt;= 1
     * @throws IllegalArgumentException if {@code capacity < 1}
     */
    public BoundedBuffer(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1, got: " + capacity);
        }
        this.capacity = capacity;
        this.items = new ArrayDeque<>(Math.min(capacity, 1024));
    }

    /**
     * Append an element, evicting the oldest one when the buffer is full.
     *
     * @param item element to append; must not be {@code null}
     * @return the evicted element, or {@code null} if nothing was evicted
     */
    public synchronized T push(T item) {
        Objects.requireNonNull(item, "Buffer element must not be null");
        items.addLast(item);
        if (items.size() > capacity) {
            evicted++;
            return items.pollFirst();
        }
        return null;
    }

    /**
     * @return immutable copy of the retained elements, oldest first
     */
    public synchronized List<T> snapshot() {
        return List.copyOf(items);
    }

    /**
     * @return the most recently pushed element, or {@code null} if empty
     */
    public synchronized T peekLast() {
        return items.peekLast();
    }

    public synchronized int size() {
        return items.size();
    }

    public synchronized boolean isEmpty() {
        return items.isEmpty();
    }

    /**
     * @return total number of elements dropped by eviction since creation
     */
    public synchronized long evictedCount() {
        return evicted;
    }

    public int capacity() {
        return capacity;
    }

    @Override
    public synchronized String toString() {
        return "BoundedBuffer{size=" + items.size() + ", capacity=" + capacity + ", evicted=" + evicted + '}';
    }
}
