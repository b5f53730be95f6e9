package com.ordoAetheris.pipeline;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.ordoAetheris.pipeline.check.ResultCheck;
import com.ordoAetheris.pipeline.check.ResultValidator;
import com.ordoAetheris.pipeline.compute.ComputeFunction;
import com.ordoAetheris.pipeline.config.PipelineConfig;
import com.ordoAetheris.pipeline.queue.SharedQueue;
import com.ordoAetheris.pipeline.work.Permutations;
import com.ordoAetheris.pipeline.work.Producer;
import com.ordoAetheris.pipeline.work.ResultStore;
import com.ordoAetheris.pipeline.work.WorkItem;
import com.ordoAetheris.pipeline.work.Worker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ThreadFactory;

/**
 * One run: a single producer feeds a fresh queue, N consumers drain it into a result store,
 * the calling thread joins them all and validates the store.
 *
 * There is no timeout: if the producer never closed the queue the joins would never return.
 * {@link Producer} closes in a finally block, so that cannot happen short of a JVM-level failure.
 */
public class Pipeline {

    private static final Logger log = LoggerFactory.getLogger(Pipeline.class);

    private final PipelineConfig config;
    private final ComputeFunction function;
    private final ResultValidator validator;

    public Pipeline(PipelineConfig config, ComputeFunction function, ResultCheck check) {
        this.config = config;
        this.function = function;
        this.validator = new ResultValidator(check);
    }

    /**
     * @throws com.ordoAetheris.pipeline.check.ValidationException if a slot is empty or wrong
     * @throws IllegalStateException if a producer or consumer thread died with an exception
     */
    public PipelineReport run() throws InterruptedException {
        long started = System.nanoTime();
        Random random = new Random(config.seed());

        int[] permutation = Permutations.shuffled(config.itemCount(), random);
        ResultStore results = new ResultStore(config.itemCount());
        SharedQueue<WorkItem> queue = new SharedQueue<>();

        ConcurrentLinkedQueue<Throwable> crashes = new ConcurrentLinkedQueue<>();
        Thread.UncaughtExceptionHandler onCrash = (thread, e) -> {
            log.error("{} terminated abnormally", thread.getName(), e);
            crashes.add(e);
        };
        ThreadFactory consumerThreads = new ThreadFactoryBuilder()
                .setNameFormat("consumer-%d")
                .setUncaughtExceptionHandler(onCrash)
                .build();
        ThreadFactory producerThreads = new ThreadFactoryBuilder()
                .setNameFormat("producer")
                .setUncaughtExceptionHandler(onCrash)
                .build();

        log.info("Starting {} over {} items", config, config.itemCount());

        List<Worker> workers = new ArrayList<>(config.consumerCount());
        List<Thread> consumers = new ArrayList<>(config.consumerCount());
        for (int i = 0; i < config.consumerCount(); i++) {
            Worker worker = new Worker(queue, results, function);
            Thread thread = consumerThreads.newThread(worker);
            workers.add(worker);
            consumers.add(thread);
            thread.start();
        }

        Producer producer = new Producer(queue, permutation, config.rangeStart(),
                config.maxSleepMs(), config.skipOneIn(), random);
        Thread producerThread = producerThreads.newThread(producer);
        producerThread.start();

        // join is the only happens-before edge between the workers' slot writes and the reads below
        for (Thread consumer : consumers) consumer.join();
        producerThread.join();

        if (!crashes.isEmpty()) {
            IllegalStateException failure = new IllegalStateException(
                    crashes.size() + " pipeline thread(s) terminated abnormally", crashes.peek());
            crashes.stream().skip(1).forEach(failure::addSuppressed);
            throw failure;
        }

        log.info("Checking results.");
        validator.validate(results, config.rangeStart());

        int[] processed = new int[workers.size()];
        int failed = 0;
        for (int i = 0; i < workers.size(); i++) {
            processed[i] = workers.get(i).processedCount();
            failed += workers.get(i).failedCount();
        }
        return new PipelineReport(results, producer.producedCount(), processed, failed,
                Duration.ofNanos(System.nanoTime() - started));
    }
}
