package com.iksanov.rangecache.engine.app;

import com.iksanov.rangecache.engine.app.workload.Operation;
import com.iksanov.rangecache.engine.app.workload.RangeWorkloadBenchmark;
import com.iksanov.rangecache.engine.app.workload.RecurrenceBenchmark;
import com.iksanov.rangecache.engine.app.workload.WorkloadGenerator;
import com.iksanov.rangecache.engine.config.BenchmarkConfig;
import com.iksanov.rangecache.engine.metrics.CacheMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Command-line harness comparing cached and uncached evaluation for both caches.
 */
public class BenchmarkApplication {

    private static final Logger log = LoggerFactory.getLogger(BenchmarkApplication.class);
    private final BenchmarkConfig config;

    public BenchmarkApplication(BenchmarkConfig config) {
        this.config = config;
    }

    public static void main(String[] args) {
        BenchmarkConfig config = BenchmarkConfig.fromEnv();

        log.info("========================================");
        log.info("Starting range-cache benchmark");
        log.info("Array: {}, Queries: {}, Capacity: {}, Seed: {}",
                config.arraySize(), config.queryCount(), config.cacheCapacity(), config.seed());
        log.info("========================================");

        try {
            new BenchmarkApplication(config).run();
        } catch (Exception e) {
            log.error("Benchmark failed", e);
            System.exit(1);
        }
    }

    public void run() {
        runRangeWorkload();
        runRecurrence();
        log.info("[SUCCESS] Benchmark complete");
    }

    RangeWorkloadBenchmark.Result runRangeWorkload() {
        WorkloadGenerator generator = new WorkloadGenerator(config.seed());
        long[] array = generator.randomArray(config.arraySize(), config.maxValue());
        List<Operation> operations = generator.operations(config.queryCount(), config.arraySize(), config.maxValue());
        log.info("[OK] Generated {} operations over {} elements", operations.size(), array.length);

        CacheMetrics metrics = new CacheMetrics();
        RangeWorkloadBenchmark.Result result = new RangeWorkloadBenchmark(config.cacheCapacity(), metrics)
                .run(array, operations);

        log.info("Execution time without caching: {} seconds", String.format("%.3f", result.uncachedNanos() / 1e9));
        log.info("Execution time with LRU cache:  {} seconds", String.format("%.3f", result.cachedNanos() / 1e9));
        log.debug("Range cache metrics:\n{}", metrics.scrape());
        return result;
    }

    List<RecurrenceBenchmark.Sample> runRecurrence() {
        List<RecurrenceBenchmark.Sample> samples = new RecurrenceBenchmark()
                .run(config.fibMaxN(), config.fibStep(), config.fibRepeats());

        log.info(String.format("%-10s %-22s %-22s", "n", "Iterative (s)", "Splay Tree (s)"));
        log.info("------------------------------------------------------");
        for (RecurrenceBenchmark.Sample sample : samples) {
            log.info(String.format("%-10d %-22.8g %-22.8g",
                    sample.n(), sample.iterativeNanos() / 1e9, sample.splayNanos() / 1e9));
        }
        return samples;
    }
}
