package com.iksanov.rangecache.engine.core;

import com.google.common.base.Preconditions;
import com.iksanov.rangecache.common.dto.RangeKey;

import java.util.Objects;
import java.util.OptionalLong;

/**
 * Answers range-sum queries over an {@link ArrayStore} through an {@link AggregateCache}.
 * <p>
 * Reads consult the cache first and populate it on a miss. Writes go to the store and
 * then drop every cached range covering the written index, so no stale sum can be served.
 */
public class RangeQueryService {

    private final ArrayStore store;
    private final AggregateCache cache;

    public RangeQueryService(ArrayStore store, AggregateCache cache) {
        this.store = Objects.requireNonNull(store, "store");
        this.cache = Objects.requireNonNull(cache, "cache");
    }

    public long rangeAggregate(int left, int right) {
        RangeKey key = RangeKey.of(left, right);
        // Fail before the cache sees the key, so rejected queries never count as misses.
        Preconditions.checkPositionIndexes(left, right + 1, store.length());
        OptionalLong cached = cache.get(key);
        if (cached.isPresent()) return cached.getAsLong();

        long sum = store.sum(left, right);
        cache.put(key, sum);
        return sum;
    }

    public void pointUpdate(int index, long value) {
        store.set(index, value);
        cache.invalidate(key -> key.contains(index));
    }

    public ArrayStore store() {
        return store;
    }

    public AggregateCache cache() {
        return cache;
    }
}
