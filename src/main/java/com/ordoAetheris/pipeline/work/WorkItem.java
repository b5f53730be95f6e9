package com.ordoAetheris.pipeline.work;

/**
 * One unit of work: compute f(key) and store it at {@code position} of the result store.
 * Positions are unique within a run, so no two items ever write the same slot.
 */
public final class WorkItem {

    private final int position;
    private final int key;

    public WorkItem(int position, int key) {
        if (position < 0) throw new IllegalArgumentException("position must be >= 0, got " + position);
        this.position = position;
        this.key = key;
    }

    public int position() {
        return position;
    }

    public int key() {
        return key;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WorkItem)) return false;
        WorkItem other = (WorkItem) o;
        return position == other.position && key == other.key;
    }

    @Override
    public int hashCode() {
        return 31 * position + key;
    }

    @Override
    public String toString() {
        return "WorkItem{position=" + position + ", key=" + key + '}';
    }
}
