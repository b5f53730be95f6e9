package com.ordoAetheris.pipeline.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Properties;
import java.util.Set;

/**
 * Builds a {@link PipelineConfig} from layered sources, later ones winning:
 * <ol>
 *   <li>classpath resource {@code pipeline.properties}</li>
 *   <li>JVM system properties with the same keys</li>
 *   <li>command line options {@code --consumers=4}, i.e. the key without its {@code pipeline.} prefix</li>
 * </ol>
 * Keys absent from every source keep the {@link PipelineConfig} defaults.
 */
public final class PipelineConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(PipelineConfigLoader.class);

    public static final String DEFAULT_RESOURCE = "pipeline.properties";
    static final String PREFIX = "pipeline.";

    public static final String CONSUMERS = PREFIX + "consumers";
    public static final String RANGE_START = PREFIX + "range.start";
    public static final String RANGE_END = PREFIX + "range.end";
    public static final String MAX_SLEEP_MS = PREFIX + "jitter.maxSleepMs";
    public static final String SKIP_ONE_IN = PREFIX + "jitter.skipOneIn";
    public static final String SEED = PREFIX + "seed";

    private static final Set<String> KEYS = Set.of(CONSUMERS, RANGE_START, RANGE_END, MAX_SLEEP_MS, SKIP_ONE_IN, SEED);

    private final String resource;
    private final Properties systemProperties;

    public PipelineConfigLoader() {
        this(DEFAULT_RESOURCE, System.getProperties());
    }

    public PipelineConfigLoader(String resource, Properties systemProperties) {
        this.resource = resource;
        this.systemProperties = systemProperties;
    }

    public PipelineConfig load(String... args) throws ConfigurationException {
        Properties merged = new Properties();
        loadResource(merged);
        for (String key : KEYS) {
            String value = systemProperties.getProperty(key);
            if (value != null) merged.setProperty(key, value);
        }
        merged.putAll(parseArgs(args));

        PipelineConfig.Builder builder = PipelineConfig.builder();
        Integer consumers = getInt(merged, CONSUMERS);
        if (consumers != null) builder.consumerCount(consumers);
        Integer start = getInt(merged, RANGE_START);
        if (start != null) builder.rangeStart(start);
        Integer end = getInt(merged, RANGE_END);
        if (end != null) builder.rangeEnd(end);
        Integer maxSleep = getInt(merged, MAX_SLEEP_MS);
        if (maxSleep != null) builder.maxSleepMs(maxSleep);
        Integer skip = getInt(merged, SKIP_ONE_IN);
        if (skip != null) builder.skipOneIn(skip);
        Long seed = getLong(merged, SEED);
        if (seed != null) builder.seed(seed);

        PipelineConfig config = builder.build();
        log.debug("Loaded {}", config);
        return config;
    }

    private void loadResource(Properties target) throws ConfigurationException {
        try (InputStream in = PipelineConfigLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                log.debug("No {} on the classpath, using defaults", resource);
                return;
            }
            target.load(in);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read " + resource, e);
        }
    }

    static Map<String, String> parseArgs(String... args) throws ConfigurationException {
        Map<String, String> parsed = new LinkedHashMap<>();
        for (String arg : args) {
            int eq = arg.indexOf('=');
            if (!arg.startsWith("--") || eq < 0) {
                throw new ConfigurationException("Expected --key=value, got '" + arg + "'");
            }
            String key = PREFIX + arg.substring(2, eq);
            if (!KEYS.contains(key)) {
                throw new ConfigurationException("Unknown option '" + arg.substring(0, eq) + "'");
            }
            parsed.put(key, arg.substring(eq + 1));
        }
        return parsed;
    }

    private static Integer getInt(Properties properties, String key) throws ConfigurationException {
        String value = properties.getProperty(key);
        if (value == null) return null;
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid integer value for " + key + ": " + value, e);
        }
    }

    private static Long getLong(Properties properties, String key) throws ConfigurationException {
        String value = properties.getProperty(key);
        if (value == null) return null;
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid long value for " + key + ": " + value, e);
        }
    }
}
