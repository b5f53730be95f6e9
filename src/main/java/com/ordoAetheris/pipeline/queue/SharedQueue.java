package com.ordoAetheris.pipeline.queue;

import java.util.ArrayDeque;
import java.util.Queue;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 Unbounded FIFO between one producer and a pool of consumers, with close/EOF.

 void put(T item)
 item == null → IllegalArgumentException
 closed → ClosedQueueException
 otherwise appends the item and wakes ONE waiting consumer

 T take() throws InterruptedException
 empty and NOT closed → waits
 empty and closed → returns null (EOF)
 otherwise removes and returns the head

 void close()
 marks the queue closed and wakes EVERY waiting consumer
 repeated close() is allowed (idempotent)

 Invariants:
 no lost item, no duplicate item
 nobody waits forever after close()
 items put before close() are still handed out before EOF

 One signal() per put is enough: a consumer that wakes up to an empty queue
 (a faster consumer took the item) goes back to await().
 */
public class SharedQueue<T> {

    private final Queue<T> queue = new ArrayDeque<>();
    private boolean closed = false;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();

    public void put(T item) {
        if (item == null) throw new IllegalArgumentException("item must not be null");
        lock.lock();
        try {
            if (closed) throw new ClosedQueueException();
            queue.offer(item);
            notEmpty.signal();
        } finally {
            lock.unlock();
        }
    }

    public T take() throws InterruptedException {
        lock.lock();
        try {
            while (!closed && queue.isEmpty()) notEmpty.await();
            // non-empty, or closed and empty: poll() gives the head or the EOF null
            return queue.poll();
        } finally {
            lock.unlock();
        }
    }

    public void close() {
        lock.lock();
        try {
            if (closed) return;
            closed = true;
            notEmpty.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }
}
