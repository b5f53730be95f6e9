package com.ordoAetheris.pipeline.queue;

/**
 * Thrown by {@link SharedQueue#put(Object)} once the queue has been closed.
 * A single well-behaved producer never sees it: it only closes after its last put.
 */
public class ClosedQueueException extends IllegalStateException {

    public ClosedQueueException() {
        super("queue is closed");
    }
}
