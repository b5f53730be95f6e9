package com.ordoAetheris.pipeline.work;

import java.util.ArrayList;
import java.util.List;

/**
 * Fixed-size, position-indexed output of a run. Every slot starts empty and is written once.
 *
 * Deliberately not synchronized: each position belongs to exactly one work item, so concurrent
 * writers never share a slot. Readers must come after the writers' threads have been joined.
 */
public final class ResultStore {

    private final long[] values;
    private final boolean[] written;

    public ResultStore(int size) {
        if (size < 0) throw new IllegalArgumentException("size must be >= 0, got " + size);
        this.values = new long[size];
        this.written = new boolean[size];
    }

    public int size() {
        return values.length;
    }

    public void set(int position, long value) {
        checkIndex(position);
        if (written[position]) {
            throw new IllegalStateException("slot " + position + " already written");
        }
        values[position] = value;
        written[position] = true;
    }

    public long get(int position) {
        checkIndex(position);
        if (!written[position]) throw new IllegalStateException("slot " + position + " is empty");
        return values[position];
    }

    public boolean isWritten(int position) {
        checkIndex(position);
        return written[position];
    }

    public List<Integer> missingPositions() {
        List<Integer> missing = new ArrayList<>();
        for (int i = 0; i < written.length; i++) {
            if (!written[i]) missing.add(i);
        }
        return missing;
    }

    /** Copy of the slot values; empty slots read as 0. */
    public long[] toArray() {
        return values.clone();
    }

    private void checkIndex(int position) {
        if (position < 0 || position >= values.length) {
            throw new IndexOutOfBoundsException("position " + position + " outside [0, " + values.length + ")");
        }
    }
}
