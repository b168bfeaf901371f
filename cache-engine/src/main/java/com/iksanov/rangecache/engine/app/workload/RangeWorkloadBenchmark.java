package com.iksanov.rangecache.engine.app.workload;

import com.iksanov.rangecache.common.exception.CacheException;
import com.iksanov.rangecache.engine.core.ArrayStore;
import com.iksanov.rangecache.engine.core.RangeAggregateCache;
import com.iksanov.rangecache.engine.core.RangeQueryService;
import com.iksanov.rangecache.engine.metrics.CacheMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Replays one workload twice: against a plain array with direct summation, and against
 * {@link ArrayStore} + {@link RangeAggregateCache}. Both runs must end with identical arrays
 * and produce the same checksum of range results.
 */
public class RangeWorkloadBenchmark {

    private static final Logger log = LoggerFactory.getLogger(RangeWorkloadBenchmark.class);
    private final int cacheCapacity;
    private final CacheMetrics metrics;

    public RangeWorkloadBenchmark(int cacheCapacity, CacheMetrics metrics) {
        this.cacheCapacity = cacheCapacity;
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    public record Result(long uncachedNanos, long cachedNanos, long checksum) {}

    public Result run(long[] initial, List<Operation> operations) {
        Objects.requireNonNull(initial, "initial");
        Objects.requireNonNull(operations, "operations");

        long[] plain = initial.clone();
        long start = System.nanoTime();
        long uncachedChecksum = 0;
        for (Operation op : operations) {
            if (op instanceof Operation.RangeQuery query) {
                long sum = 0;
                for (int i = query.left(); i <= query.right(); i++) sum = Math.addExact(sum, plain[i]);
                uncachedChecksum += sum;
            } else if (op instanceof Operation.PointUpdate update) {
                plain[update.index()] = update.value();
            }
        }
        long uncachedNanos = System.nanoTime() - start;

        RangeQueryService service = new RangeQueryService(
                new ArrayStore(initial), new RangeAggregateCache(cacheCapacity, metrics));
        start = System.nanoTime();
        long cachedChecksum = 0;
        for (Operation op : operations) {
            if (op instanceof Operation.RangeQuery query) {
                cachedChecksum += service.rangeAggregate(query.left(), query.right());
            } else if (op instanceof Operation.PointUpdate update) {
                service.pointUpdate(update.index(), update.value());
            }
        }
        long cachedNanos = System.nanoTime() - start;

        if (cachedChecksum != uncachedChecksum || !Arrays.equals(plain, service.store().snapshot())) {
            throw new CacheException("Cached and uncached runs diverged: checksum "
                    + cachedChecksum + " vs " + uncachedChecksum);
        }
        log.debug("Range workload: {} operations, hits={}, misses={}, evictions={}, invalidations={}",
                operations.size(), metrics.hits(), metrics.misses(), metrics.evictions(), metrics.invalidations());
        return new Result(uncachedNanos, cachedNanos, cachedChecksum);
    }
}
