package com.ordoAetheris.pipeline.work;

import com.ordoAetheris.pipeline.queue.SharedQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Random;

/**
 * Pushes one item per permutation element, in permutation order, then closes the queue.
 *
 * Element p becomes {@code WorkItem(p, rangeStart + p)}. Before each push the producer may
 * sleep 1..maxSleepMs ms; the sleep is skipped one time in {@code skipOneIn}. maxSleepMs == 0
 * turns the jitter off.
 *
 * close() sits in a finally block: consumers block until it runs, so every exit path closes.
 */
public class Producer implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(Producer.class);

    private final SharedQueue<WorkItem> queue;
    private final int[] permutation;
    private final int rangeStart;
    private final int maxSleepMs;
    private final int skipOneIn;
    private final Random random;

    private int produced;

    public Producer(SharedQueue<WorkItem> queue, int[] permutation, int rangeStart,
                    int maxSleepMs, int skipOneIn, Random random) {
        if (maxSleepMs < 0) throw new IllegalArgumentException("maxSleepMs must be >= 0");
        if (skipOneIn < 1) throw new IllegalArgumentException("skipOneIn must be >= 1");
        this.queue = queue;
        this.permutation = permutation;
        this.rangeStart = rangeStart;
        this.maxSleepMs = maxSleepMs;
        this.skipOneIn = skipOneIn;
        this.random = random;
    }

    /** Producer without jitter. */
    public Producer(SharedQueue<WorkItem> queue, int[] permutation, int rangeStart) {
        this(queue, permutation, rangeStart, 0, 1, new Random(0));
    }

    @Override
    public void run() {
        try {
            for (int position : permutation) {
                jitter();
                queue.put(new WorkItem(position, rangeStart + position));
                produced++;
                log.debug("producer: New data: {}.", position);
            }
            log.info("producer: Everything is produced. Signalling the end of production.");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("producer: Interrupted after {} of {} items, closing early.", produced, permutation.length);
        } finally {
            queue.close();
        }
        log.info("producer: Ending.");
    }

    private void jitter() throws InterruptedException {
        if (maxSleepMs == 0) return;
        if (random.nextInt(skipOneIn) == 0) return;
        Thread.sleep(1 + random.nextInt(maxSleepMs));
    }

    public int producedCount() {
        return produced;
    }
}
