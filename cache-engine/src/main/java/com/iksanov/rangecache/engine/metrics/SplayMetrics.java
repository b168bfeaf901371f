package com.iksanov.rangecache.engine.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics for the splay tree memoization cache.
 */
public class SplayMetrics {

    private final PrometheusMeterRegistry registry;
    private final Counter hits;
    private final Counter misses;
    private final Counter inserts;
    private final Counter rotations;
    private final AtomicLong treeSize = new AtomicLong(0);

    public SplayMetrics() {
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        this.hits = Counter.builder("splay.cache.hits")
                .description("Searches that found the key at the root after splaying")
                .register(registry);

        this.misses = Counter.builder("splay.cache.misses")
                .description("Searches for absent keys")
                .register(registry);

        this.inserts = Counter.builder("splay.cache.inserts")
                .description("Nodes created by insert")
                .register(registry);

        this.rotations = Counter.builder("splay.cache.rotations")
                .description("Single left/right rotations performed while splaying")
                .register(registry);

        Gauge.builder("splay.cache.size", treeSize, AtomicLong::get)
                .description("Number of nodes in the tree")
                .register(registry);
    }

    public void recordHit() {
        hits.increment();
    }

    public void recordMiss() {
        misses.increment();
    }

    public void recordInsert() {
        inserts.increment();
    }

    public void recordRotations(int count) {
        if (count > 0) rotations.increment(count);
    }

    public void updateSize(int size) {
        treeSize.set(size);
    }

    public double hits() {
        return hits.count();
    }

    public double misses() {
        return misses.count();
    }

    public double inserts() {
        return inserts.count();
    }

    public double rotations() {
        return rotations.count();
    }

    public String scrape() {
        return registry.scrape();
    }

    public MeterRegistry getRegistry() {
        return registry;
    }
}
