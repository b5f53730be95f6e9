package com.ordoAetheris.pipeline.work;

import com.ordoAetheris.pipeline.compute.ComputeFunction;
import com.ordoAetheris.pipeline.queue.SharedQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Consumer loop: take an item, compute f(key) outside the queue lock, store the result.
 * Exits on EOF (null from {@link SharedQueue#take()}).
 *
 * A compute failure is logged and the item skipped; its slot stays empty and the
 * post-run validation reports it. The worker itself keeps draining the queue.
 *
 * Counters are plain fields: they are read by the thread that joined this worker.
 */
public class Worker implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(Worker.class);

    private final SharedQueue<WorkItem> queue;
    private final ResultStore results;
    private final ComputeFunction function;

    private int processed;
    private int failed;

    public Worker(SharedQueue<WorkItem> queue, ResultStore results, ComputeFunction function) {
        this.queue = queue;
        this.results = results;
        this.function = function;
    }

    @Override
    public void run() {
        log.info("consumer: Starting.");
        try {
            while (true) {
                WorkItem item = queue.take();
                if (item == null) break;
                process(item);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("consumer: Interrupted while waiting for work, exiting. processed={}", processed);
            return;
        }
        log.info("consumer: Ending. processed={} failed={}", processed, failed);
    }

    private void process(WorkItem item) {
        log.debug("consumer: Acquired data to process: {}.", item.key());
        long result;
        try {
            result = function.apply(item.key());
        } catch (RuntimeException e) {
            failed++;
            log.error("consumer: Calculation failed for {}, slot left empty", item, e);
            return;
        }
        log.debug("consumer: Calculation result: {}({}) = {}.", function, item.key(), result);
        results.set(item.position(), result);
        processed++;
    }

    public int processedCount() {
        return processed;
    }

    public int failedCount() {
        return failed;
    }
}
