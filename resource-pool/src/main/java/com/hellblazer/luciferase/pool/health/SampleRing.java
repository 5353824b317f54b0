package com.hellblazer.luciferase.pool.health;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Fixed-capacity ring buffer; once full, each add evicts the oldest element.
 *
 * @param <T> element type
 */
public class SampleRing<T> {

    private final Object[] elements;
    private int head = 0;  // index of the next write
    private int size = 0;

    public SampleRing(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Capacity must be positive");
        }
        this.elements = new Object[capacity];
    }

    public synchronized void add(T element) {
        elements[head] = element;
        head = (head + 1) % elements.length;
        if (size < elements.length) {
            size++;
        }
    }

    /**
     * The most recent {@code k} elements, oldest first and most recent last. Fewer when fewer are held.
     */
    @SuppressWarnings("unchecked")
    public synchronized List<T> lastN(int k) {
        if (k < 0) {
            throw new IllegalArgumentException("k cannot be negative");
        }
        int n = Math.min(k, size);
        var result = new ArrayList<T>(n);
        int start = Math.floorMod(head - n, elements.length);
        for (int i = 0; i < n; i++) {
            result.add((T) elements[(start + i) % elements.length]);
        }
        return result;
    }

    @SuppressWarnings("unchecked")
    public synchronized Optional<T> last() {
        if (size == 0) {
            return Optional.empty();
        }
        return Optional.of((T) elements[Math.floorMod(head - 1, elements.length)]);
    }

    public synchronized List<T> toList() {
        return lastN(size);
    }

    public synchronized int size() {
        return size;
    }

    public int capacity() {
        return elements.length;
    }

    public synchronized void clear() {
        java.util.Arrays.fill(elements, null);
        head = 0;
        size = 0;
    }
}
