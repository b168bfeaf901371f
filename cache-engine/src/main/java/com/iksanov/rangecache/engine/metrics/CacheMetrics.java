package com.iksanov.rangecache.engine.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics collector for the range aggregate cache using Micrometer.
 * Exposes hit/miss/eviction/invalidation statistics in Prometheus format.
 */
public class CacheMetrics {

    private final PrometheusMeterRegistry registry;
    private final Counter cacheHits;
    private final Counter cacheMisses;
    private final Counter cacheEvictions;
    private final Counter cacheInvalidations;
    private final Timer getLatency;
    private final Timer putLatency;
    private final AtomicLong cacheSize = new AtomicLong(0);

    public CacheMetrics() {
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        this.cacheHits = Counter.builder("range.cache.hits")
                .description("Number of range cache hits")
                .register(registry);

        this.cacheMisses = Counter.builder("range.cache.misses")
                .description("Number of range cache misses")
                .register(registry);

        this.cacheEvictions = Counter.builder("range.cache.evictions")
                .description("Number of LRU evictions")
                .register(registry);

        this.cacheInvalidations = Counter.builder("range.cache.invalidations")
                .description("Number of entries dropped because a covered index changed")
                .register(registry);

        this.getLatency = Timer.builder("range.cache.get.duration")
                .description("GET operation duration")
                .register(registry);

        this.putLatency = Timer.builder("range.cache.put.duration")
                .description("PUT operation duration")
                .register(registry);

        Gauge.builder("range.cache.size", cacheSize, AtomicLong::get)
                .description("Current cache size")
                .register(registry);

        Gauge.builder("range.cache.hit.rate", this, CacheMetrics::calculateHitRate)
                .description("Cache hit rate percentage")
                .register(registry);
    }

    public void recordHit() {
        cacheHits.increment();
    }

    public void recordMiss() {
        cacheMisses.increment();
    }

    public void recordEviction() {
        cacheEvictions.increment();
    }

    public void recordInvalidations(int count) {
        if (count > 0) cacheInvalidations.increment(count);
    }

    public void updateSize(int size) {
        cacheSize.set(size);
    }

    public Timer.Sample startGetTimer() {
        return Timer.start(registry);
    }

    public void stopGetTimer(Timer.Sample sample) {
        sample.stop(getLatency);
    }

    public Timer.Sample startPutTimer() {
        return Timer.start(registry);
    }

    public void stopPutTimer(Timer.Sample sample) {
        sample.stop(putLatency);
    }

    public double hits() {
        return cacheHits.count();
    }

    public double misses() {
        return cacheMisses.count();
    }

    public double evictions() {
        return cacheEvictions.count();
    }

    public double invalidations() {
        return cacheInvalidations.count();
    }

    public long size() {
        return cacheSize.get();
    }

    private double calculateHitRate() {
        double hits = cacheHits.count();
        double misses = cacheMisses.count();
        double total = hits + misses;
        return total == 0 ? 0.0 : (hits / total) * 100.0;
    }

    public String scrape() {
        return registry.scrape();
    }

    public MeterRegistry getRegistry() {
        return registry;
    }
}
