package com.iksanov.rangecache.engine.core;

import com.iksanov.rangecache.common.dto.RangeKey;

import java.util.OptionalLong;
import java.util.function.Predicate;

public interface AggregateCache {
    OptionalLong get(RangeKey key);
    void put(RangeKey key, long aggregate);

    /**
     * Removes every entry whose key matches {@code predicate}.
     *
     * @return number of removed entries
     */
    int invalidate(Predicate<RangeKey> predicate);

    int size();
    int capacity();
    void clear();
}
