package com.iotstuff.anomaly.model;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.List;

/**
 * Fixed-capacity FIFO of the most recent readings for one device.
 * Iteration order is arrival order; appending to a full window evicts the oldest reading.
 */
public final class RollingWindow {

    private final int capacity;
    private final Deque<Double> values;

    public RollingWindow(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Window capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.values = new ArrayDeque<>(capacity);
    }

    /**
     * Restores a window from persisted readings (oldest first). Readings beyond capacity
     * are dropped from the old end, as if they had been appended one by one.
     */
    public static RollingWindow of(int capacity, Collection<Double> readings) {
        RollingWindow window = new RollingWindow(capacity);
        if (readings != null) {
            readings.forEach(window::append);
        }
        return window;
    }

    public void append(double value) {
        if (values.size() == capacity) {
            values.removeFirst();
        }
        values.addLast(value);
    }

    public int size() {
        return values.size();
    }

    public int capacity() {
        return capacity;
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    /**
     * Snapshot of the readings, oldest first.
     */
    public List<Double> toList() {
        return new ArrayList<>(values);
    }

    public RollingWindow copy() {
        return of(capacity, values);
    }

    @Override
    public String toString() {
        return "RollingWindow{size=" + values.size() + ", capacity=" + capacity + "}";
    }
}
