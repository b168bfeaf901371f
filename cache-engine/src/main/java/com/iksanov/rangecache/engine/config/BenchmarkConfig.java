package com.iksanov.rangecache.engine.config;

import com.iksanov.rangecache.common.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Workload configuration for the benchmark harness.
 * Immutable; values come from environment variables with typed defaults.
 */
public record BenchmarkConfig(
        int arraySize,
        int queryCount,
        int cacheCapacity,
        int maxValue,
        long seed,
        int fibMaxN,
        int fibStep,
        int fibRepeats
) {
    private static final Logger log = LoggerFactory.getLogger(BenchmarkConfig.class);

    public BenchmarkConfig {
        requirePositive("arraySize", arraySize);
        requireNonNegative("queryCount", queryCount);
        requirePositive("cacheCapacity", cacheCapacity);
        requirePositive("maxValue", maxValue);
        requireNonNegative("fibMaxN", fibMaxN);
        requirePositive("fibStep", fibStep);
        requirePositive("fibRepeats", fibRepeats);
    }

    public static BenchmarkConfig fromEnv() {
        return fromMap(System.getenv());
    }

    static BenchmarkConfig fromMap(Map<String, String> env) {
        BenchmarkConfig d = defaults();
        return new BenchmarkConfig(
                getInt(env, "RANGE_ARRAY_SIZE", d.arraySize()),
                getInt(env, "RANGE_QUERY_COUNT", d.queryCount()),
                getInt(env, "RANGE_CACHE_CAPACITY", d.cacheCapacity()),
                getInt(env, "RANGE_MAX_VALUE", d.maxValue()),
                getLong(env, "WORKLOAD_SEED", d.seed()),
                getInt(env, "FIB_MAX_N", d.fibMaxN()),
                getInt(env, "FIB_STEP", d.fibStep()),
                getInt(env, "FIB_REPEATS", d.fibRepeats())
        );
    }

    public static BenchmarkConfig defaults() {
        return new BenchmarkConfig(100_000, 50_000, 1000, 1000, 42L, 950, 50, 200);
    }

    private static int getInt(Map<String, String> env, String key, int defaultValue) {
        String value = env.get(key);
        if (value == null) return defaultValue;
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            log.warn("Ignoring non-numeric {}='{}', using default {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    private static long getLong(Map<String, String> env, String key, long defaultValue) {
        String value = env.get(key);
        if (value == null) return defaultValue;
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            log.warn("Ignoring non-numeric {}='{}', using default {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    private static void requirePositive(String name, long value) {
        if (value <= 0) throw new ConfigurationException(name + " must be > 0, got " + value);
    }

    private static void requireNonNegative(String name, long value) {
        if (value < 0) throw new ConfigurationException(name + " must be >= 0, got " + value);
    }
}
