package com.iksanov.rangecache.common.dto;

import com.iksanov.rangecache.common.exception.InvalidCacheRequestException;

/**
 * Inclusive index interval {@code [left, right]} used as a cache key.
 */
public record RangeKey(int left, int right) {
    public RangeKey {
        if (left < 0) throw new InvalidCacheRequestException("left must be >= 0, got " + left);
        if (left > right) throw new InvalidCacheRequestException("left must be <= right, got [" + left + ", " + right + "]");
    }

    public static RangeKey of(int left, int right) {
        return new RangeKey(left, right);
    }

    public boolean contains(int index) {
        return left <= index && index <= right;
    }

    public int length() {
        return right - left + 1;
    }

    @Override
    public String toString() {
        return "[" + left + ", " + right + "]";
    }
}
