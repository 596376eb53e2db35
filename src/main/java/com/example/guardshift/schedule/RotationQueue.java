package com.example.guardshift.schedule;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Per-post FIFO of guards. Guards are rotated, never removed: after a commit the guard moves
 * to the tail, so the queue always holds every guard of the roster exactly once.
 */
public class RotationQueue {

    private final List<String> order;

    public RotationQueue(List<String> guards) {
        if (guards == null || guards.isEmpty()) {
            throw new IllegalArgumentException("Rotation queue needs at least one guard");
        }
        if (guards.stream().distinct().count() != guards.size()) {
            throw new IllegalArgumentException("Rotation queue guards must be unique: " + guards);
        }
        this.order = new ArrayList<>(guards);
    }

    public int size() {
        return order.size();
    }

    /**
     * Guard at {@code offset} positions behind the head. Does not change the queue.
     */
    public String peekFrom(int offset) {
        if (offset < 0 || offset >= order.size()) {
            throw new IndexOutOfBoundsException("Rotation offset " + offset + " outside 0.." + (order.size() - 1));
        }
        return order.get(offset);
    }

    /**
     * Moves {@code guard} from its current position to the tail.
     */
    public void commit(String guard) {
        if (!order.remove(guard)) {
            throw new IllegalStateException("Guard not in rotation: " + guard);
        }
        order.add(guard);
    }

    public List<String> snapshot() {
        return Collections.unmodifiableList(new ArrayList<>(order));
    }

    @Override
    public String toString() {
        return order.toString();
    }
}
