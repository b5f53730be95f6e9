package com.ordoAetheris.pipeline;

import com.ordoAetheris.pipeline.check.FibonacciRecurrence;
import com.ordoAetheris.pipeline.check.ValidationException;
import com.ordoAetheris.pipeline.compute.Fibonacci;
import com.ordoAetheris.pipeline.config.ConfigurationException;
import com.ordoAetheris.pipeline.config.PipelineConfig;
import com.ordoAetheris.pipeline.config.PipelineConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point: fibonacci over the configured key range, checked by the Fibonacci recurrence.
 *
 * Exit status: 0 results OK, 1 validation failed or a pipeline thread crashed, 2 bad configuration.
 * Options: --consumers, --range.start, --range.end, --jitter.maxSleepMs, --jitter.skipOneIn, --seed.
 */
public class Main {

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) throws InterruptedException {
        System.exit(run(args));
    }

    /** Runs and returns the exit status; kept apart from main() so it can be tested without exiting. */
    public static int run(String... args) throws InterruptedException {
        PipelineConfig config;
        try {
            config = new PipelineConfigLoader().load(args);
            if (config.itemCount() < 2) {
                throw new ConfigurationException("the Fibonacci check needs at least 2 items, got " + config.itemCount());
            }
            if (config.rangeStart() < 1) {
                throw new ConfigurationException("fibonacci keys start at 1, got range.start=" + config.rangeStart());
            }
        } catch (ConfigurationException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            return 2;
        }

        log.info("Starting main thread.");
        try {
            PipelineReport report = new Pipeline(config, new Fibonacci(), new FibonacciRecurrence()).run();
            log.info("Results OK! {}", report);
        } catch (ValidationException | IllegalStateException e) {
            log.error("Results check failed", e);
            return 1;
        }
        log.info("Ending main thread.");
        return 0;
    }
}
