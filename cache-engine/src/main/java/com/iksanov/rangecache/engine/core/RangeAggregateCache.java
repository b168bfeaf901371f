package com.iksanov.rangecache.engine.core;

import com.iksanov.rangecache.common.dto.RangeKey;
import com.iksanov.rangecache.common.exception.CacheException;
import com.iksanov.rangecache.engine.metrics.CacheMetrics;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.function.Predicate;

/**
 * Bounded LRU map from an index range to its precomputed sum.
 * <p>
 * Backed by an access-ordered {@link LinkedHashMap}: both {@code get} and {@code put}
 * move the key to the most-recently-used end, and an overflowing {@code put} evicts
 * exactly one entry from the least-recently-used end.
 * <p>
 * Not thread-safe. Callers sharing an instance must serialize access externally.
 */
public class RangeAggregateCache implements AggregateCache {

    private static final Logger log = LoggerFactory.getLogger(RangeAggregateCache.class);
    private final LinkedHashMap<RangeKey, Long> entries;
    private final int capacity;
    private final CacheMetrics metrics;

    public RangeAggregateCache(int capacity) {
        this(capacity, new CacheMetrics());
    }

    public RangeAggregateCache(int capacity, CacheMetrics metrics) {
        if (capacity <= 0) throw new CacheException("capacity must be > 0");
        this.capacity = capacity;
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.entries = new LinkedHashMap<>(16, 0.75f, true);
        log.info("RangeAggregateCache initialized: capacity={}, eviction=LRU", capacity);
    }

    @Override
    public OptionalLong get(RangeKey key) {
        Objects.requireNonNull(key, "key");
        Timer.Sample sample = metrics.startGetTimer();
        try {
            Long value = entries.get(key);
            if (value == null) {
                metrics.recordMiss();
                return OptionalLong.empty();
            }
            metrics.recordHit();
            return OptionalLong.of(value);
        } finally {
            metrics.stopGetTimer(sample);
        }
    }

    @Override
    public void put(RangeKey key, long aggregate) {
        Objects.requireNonNull(key, "key");
        Timer.Sample sample = metrics.startPutTimer();
        try {
            entries.put(key, aggregate);
            if (entries.size() > capacity) evictEldest();
        } finally {
            metrics.stopPutTimer(sample);
            metrics.updateSize(entries.size());
        }
    }

    @Override
    public int invalidate(Predicate<RangeKey> predicate) {
        Objects.requireNonNull(predicate, "predicate");
        // Removal starts only after the predicate has seen every key.
        List<RangeKey> stale = new ArrayList<>();
        for (RangeKey key : entries.keySet()) {
            if (predicate.test(key)) stale.add(key);
        }
        for (RangeKey key : stale) {
            entries.remove(key);
        }
        if (!stale.isEmpty()) {
            metrics.recordInvalidations(stale.size());
            metrics.updateSize(entries.size());
            log.debug("Invalidated {} entries, size now {}/{}", stale.size(), entries.size(), capacity);
        }
        return stale.size();
    }

    /**
     * Whether {@code key} is cached. Unlike {@link #get} this does not touch recency.
     */
    public boolean contains(RangeKey key) {
        return entries.containsKey(Objects.requireNonNull(key, "key"));
    }

    /**
     * Keys from least to most recently used.
     */
    public List<RangeKey> keysInRecencyOrder() {
        return List.copyOf(entries.keySet());
    }

    @Override
    public int size() {
        return entries.size();
    }

    @Override
    public int capacity() {
        return capacity;
    }

    @Override
    public void clear() {
        entries.clear();
        metrics.updateSize(0);
        log.info("Cache cleared");
    }

    private void evictEldest() {
        Iterator<Map.Entry<RangeKey, Long>> iterator = entries.entrySet().iterator();
        Map.Entry<RangeKey, Long> eldest = iterator.next();
        iterator.remove();
        metrics.recordEviction();
        log.debug("Evicted least recently used range {}", eldest.getKey());
    }
}
