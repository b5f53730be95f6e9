package com.ordoAetheris.pipeline.config;

/**
 * Immutable tunables of one pipeline run.
 *
 * Keys are drawn from the half-open range [rangeStart, rangeEnd); the run has
 * rangeEnd - rangeStart items.
 */
public final class PipelineConfig {

    public static final int DEFAULT_CONSUMERS = 8;
    public static final int DEFAULT_RANGE_START = 30;
    public static final int DEFAULT_RANGE_END = 45;
    public static final int DEFAULT_MAX_SLEEP_MS = 10;
    public static final int DEFAULT_SKIP_ONE_IN = 4;
    public static final long DEFAULT_SEED = 123456L;

    private final int consumerCount;
    private final int rangeStart;
    private final int rangeEnd;
    private final int maxSleepMs;
    private final int skipOneIn;
    private final long seed;

    private PipelineConfig(Builder builder) throws ConfigurationException {
        this.consumerCount = builder.consumerCount;
        this.rangeStart = builder.rangeStart;
        this.rangeEnd = builder.rangeEnd;
        this.maxSleepMs = builder.maxSleepMs;
        this.skipOneIn = builder.skipOneIn;
        this.seed = builder.seed;
        validate();
    }

    private void validate() throws ConfigurationException {
        if (consumerCount < 1) {
            throw new ConfigurationException("consumers must be at least 1, got " + consumerCount);
        }
        if (rangeEnd < rangeStart) {
            throw new ConfigurationException("range.end (" + rangeEnd + ") must not be below range.start (" + rangeStart + ")");
        }
        if (maxSleepMs < 0) {
            throw new ConfigurationException("jitter.maxSleepMs must be >= 0, got " + maxSleepMs);
        }
        if (skipOneIn < 1) {
            throw new ConfigurationException("jitter.skipOneIn must be >= 1, got " + skipOneIn);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder seeded with this configuration's values. */
    public Builder toBuilder() {
        return new Builder()
                .consumerCount(consumerCount)
                .range(rangeStart, rangeEnd)
                .maxSleepMs(maxSleepMs)
                .skipOneIn(skipOneIn)
                .seed(seed);
    }

    public int consumerCount() {
        return consumerCount;
    }

    public int rangeStart() {
        return rangeStart;
    }

    public int rangeEnd() {
        return rangeEnd;
    }

    public int itemCount() {
        return rangeEnd - rangeStart;
    }

    public int maxSleepMs() {
        return maxSleepMs;
    }

    public int skipOneIn() {
        return skipOneIn;
    }

    public long seed() {
        return seed;
    }

    @Override
    public String toString() {
        return String.format("PipelineConfig{consumers=%d, range=[%d, %d), maxSleepMs=%d, skipOneIn=%d, seed=%d}",
                consumerCount, rangeStart, rangeEnd, maxSleepMs, skipOneIn, seed);
    }

    public static final class Builder {
        private int consumerCount = DEFAULT_CONSUMERS;
        private int rangeStart = DEFAULT_RANGE_START;
        private int rangeEnd = DEFAULT_RANGE_END;
        private int maxSleepMs = DEFAULT_MAX_SLEEP_MS;
        private int skipOneIn = DEFAULT_SKIP_ONE_IN;
        private long seed = DEFAULT_SEED;

        private Builder() {
        }

        public Builder consumerCount(int consumerCount) {
            this.consumerCount = consumerCount;
            return this;
        }

        public Builder rangeStart(int rangeStart) {
            this.rangeStart = rangeStart;
            return this;
        }

        public Builder rangeEnd(int rangeEnd) {
            this.rangeEnd = rangeEnd;
            return this;
        }

        public Builder range(int start, int end) {
            this.rangeStart = start;
            this.rangeEnd = end;
            return this;
        }

        public Builder maxSleepMs(int maxSleepMs) {
            this.maxSleepMs = maxSleepMs;
            return this;
        }

        public Builder skipOneIn(int skipOneIn) {
            this.skipOneIn = skipOneIn;
            return this;
        }

        /** No producer sleeps at all. */
        public Builder noJitter() {
            this.maxSleepMs = 0;
            return this;
        }

        public Builder seed(long seed) {
            this.seed = seed;
            return this;
        }

        public PipelineConfig build() throws ConfigurationException {
            return new PipelineConfig(this);
        }
    }
}
