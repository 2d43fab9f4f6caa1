package org.spinflip.runtime;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * Bounded FIFO of prior spin snapshots. Once {@code capacity} snapshots are held,
 * recording another one evicts the oldest. A capacity of zero records nothing.
 */
public final class StateHistory {

    private final int capacity;
    private final Deque<int[]> snapshots;

    /**
     * @param capacity The maximum number of snapshots to retain, at least 0.
     */
    public StateHistory(int capacity) {
        if (capacity < 0) {
            throw new IllegalArgumentException("History capacity must not be negative: " + capacity);
        }
        this.capacity = capacity;
        this.snapshots = new ArrayDeque<>(Math.min(capacity, 1024));
    }

    public int capacity() {
        return capacity;
    }

    public int size() {
        return snapshots.size();
    }

    public boolean isRecording() {
        return capacity > 0;
    }

    /**
     * Appends a snapshot. The array is stored as given; callers pass a private copy.
     */
    public void record(int[] snapshot) {
        if (capacity == 0) {
            return;
        }
        snapshots.addLast(snapshot);
        if (snapshots.size() > capacity) {
            snapshots.removeFirst();
        }
    }

    /**
     * Returns copies of the most recent snapshots.
     *
     * @param count The maximum number of snapshots to return.
     * @return Up to {@code count} snapshots, oldest first.
     */
    public List<int[]> recent(int count) {
        int n = Math.max(0, Math.min(count, snapshots.size()));
        List<int[]> result = new ArrayList<>(n);
        Iterator<int[]> newestFirst = snapshots.descendingIterator();
        for (int i = 0; i < n; i++) {
            result.add(newestFirst.next().clone());
        }
        Collections.reverse(result);
        return result;
    }

    public void clear() {
        snapshots.clear();
    }
}
