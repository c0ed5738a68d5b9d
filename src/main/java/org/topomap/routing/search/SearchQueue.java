package org.topomap.routing.search;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Arrays;

/**
 * Binary min-heap keyed by integer priority, used as the open set of grid searches.
 * <p>
 * <strong>Key Features:</strong>
 * <ul>
 * <li><strong>Primitive priorities:</strong> priorities live in a parallel {@code int[]}, so
 * comparisons never unbox.</li>
 * <li><strong>Duplicates allowed:</strong> there is no decrease-key. Callers push a state again
 * when they find a cheaper path; the older entry is still extracted later.</li>
 * <li><strong>Unstable ties:</strong> equal priorities come out in heap order, which depends
 * only on the sequence of operations, never on hashing.</li>
 * </ul>
 * </p>
 * <p><strong>Usage Warning:</strong> This class is NOT thread-safe.</p>
 *
 * @param <T> element type.
 */
public class SearchQueue<T> {
    private static final int DEFAULT_CAPACITY = 64;

    // 1-based heap for simpler parent/child math
    private Object[] values;
    private int[] priorities;

    @Getter
    @Accessors(fluent = true)
    private int size = 0;

    // Diagnostics
    @Getter
    private int peakSize = 0;

    public SearchQueue() {
        this(DEFAULT_CAPACITY);
    }

    /**
     * @param initialCapacity expected number of simultaneously queued elements.
     * @throws IllegalArgumentException if {@code initialCapacity} is not positive.
     */
    public SearchQueue(int initialCapacity) {
        if (initialCapacity <= 0) {
            throw new IllegalArgumentException("initialCapacity must be positive");
        }
        this.values = new Object[initialCapacity + 1];
        this.priorities = new int[initialCapacity + 1];
    }

    /**
     * Inserts a value with the given priority; lower priorities are extracted first.
     */
    public void push(T value, int priority) {
        if (size + 1 >= values.length) {
            grow();
        }
        size++;
        values[size] = value;
        priorities[size] = priority;
        if (size > peakSize) {
            peakSize = size;
        }
        swim(size);
    }

    /**
     * Removes and returns the value with the lowest priority.
     *
     * @throws EmptyQueueException if the queue is empty.
     */
    @SuppressWarnings("unchecked")
    public T extractMin() {
        if (isEmpty()) {
            throw new EmptyQueueException("Queue is empty");
        }
        T min = (T) values[1];
        values[1] = values[size];
        priorities[1] = priorities[size];
        values[size] = null;
        size--;
        if (size > 1) {
            sink(1);
        }
        return min;
    }

    /**
     * Returns the lowest priority currently queued.
     *
     * @throws EmptyQueueException if the queue is empty.
     */
    public int minPriority() {
        if (isEmpty()) {
            throw new EmptyQueueException("Queue is empty");
        }
        return priorities[1];
    }

    public boolean isEmpty() {
        return size == 0;
    }

    /**
     * Drops every queued value, keeping the allocated capacity.
     */
    public void clear() {
        Arrays.fill(values, 1, size + 1, null);
        size = 0;
    }

    // --- Heap Helper Methods ---

    private void swim(int k) {
        while (k > 1 && priorities[k / 2] > priorities[k]) {
            swap(k, k / 2);
            k = k / 2;
        }
    }

    private void sink(int k) {
        while (2 * k <= size) {
            int j = 2 * k;
            if (j < size && priorities[j] > priorities[j + 1]) j++;
            if (priorities[k] <= priorities[j]) break;
            swap(k, j);
            k = j;
        }
    }

    private void swap(int i, int j) {
        Object v = values[i];
        values[i] = values[j];
        values[j] = v;

        int p = priorities[i];
        priorities[i] = priorities[j];
        priorities[j] = p;
    }

    private void grow() {
        int capacity = values.length * 2;
        values = Arrays.copyOf(values, capacity);
        priorities = Arrays.copyOf(priorities, capacity);
    }
}
