package com.ordoAetheris.pipeline;

import com.ordoAetheris.pipeline.work.ResultStore;

import java.time.Duration;
import java.util.Arrays;

/** Outcome of a validated {@link Pipeline} run. */
public final class PipelineReport {

    private final ResultStore results;
    private final int produced;
    private final int[] processedPerWorker;
    private final int failed;
    private final Duration elapsed;

    PipelineReport(ResultStore results, int produced, int[] processedPerWorker, int failed, Duration elapsed) {
        this.results = results;
        this.produced = produced;
        this.processedPerWorker = processedPerWorker;
        this.failed = failed;
        this.elapsed = elapsed;
    }

    public ResultStore results() {
        return results;
    }

    public int produced() {
        return produced;
    }

    public int[] processedPerWorker() {
        return processedPerWorker.clone();
    }

    public int totalProcessed() {
        return Arrays.stream(processedPerWorker).sum();
    }

    public int failed() {
        return failed;
    }

    public Duration elapsed() {
        return elapsed;
    }

    @Override
    public String toString() {
        return String.format("produced=%d processed=%d perWorker=%s failed=%d elapsed=%dms",
                produced, totalProcessed(), Arrays.toString(processedPerWorker), failed, elapsed.toMillis());
    }
}
