package com.conductor.core.util;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Bounded, thread-safe buffer of the most recent output lines. Oldest lines are
 * dropped once the capacity is reached.
 */
public class LogRingBuffer {

    private final int capacity;
    private final Deque<String> lines;

    public LogRingBuffer(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.lines = new ArrayDeque<>(Math.min(capacity, 1024));
    }

    public synchronized void add(String line) {
        if (lines.size() == capacity) {
            lines.removeFirst();
        }
        lines.addLast(line);
    }

    /**
     * Returns up to {@code n} of the most recent lines, oldest first.
     */
    public synchronized List<String> tail(int n) {
        int count = Math.max(0, Math.min(n, lines.size()));
        var result = new ArrayList<String>(count);
        int skip = lines.size() - count;
        for (String line : lines) {
            if (skip-- > 0) {
                continue;
            }
            result.add(line);
        }
        return result;
    }

    public synchronized int size() {
        return lines.size();
    }

    public int capacity() {
        return capacity;
    }
}
