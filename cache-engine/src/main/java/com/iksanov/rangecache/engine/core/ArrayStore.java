package com.iksanov.rangecache.engine.core;

import java.util.Arrays;
import java.util.Objects;

import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkPositionIndexes;

/**
 * Mutable fixed-length sequence of values backing the range queries.
 * Every index is checked; out-of-range access raises {@link IndexOutOfBoundsException}.
 */
public class ArrayStore {

    private final long[] values;

    public ArrayStore(long[] initial) {
        this.values = Objects.requireNonNull(initial, "initial").clone();
    }

    public static ArrayStore of(long... values) {
        return new ArrayStore(values);
    }

    public long get(int index) {
        checkElementIndex(index, values.length);
        return values[index];
    }

    public void set(int index, long value) {
        checkElementIndex(index, values.length);
        values[index] = value;
    }

    /**
     * Sum of elements {@code [left, right]}, both inclusive.
     *
     * @throws ArithmeticException if the sum does not fit in a {@code long}
     */
    public long sum(int left, int right) {
        checkPositionIndexes(left, right + 1, values.length);
        long total = 0;
        for (int i = left; i <= right; i++) {
            total = Math.addExact(total, values[i]);
        }
        return total;
    }

    public int length() {
        return values.length;
    }

    public long[] snapshot() {
        return values.clone();
    }

    @Override
    public String toString() {
        return values.length <= 16
                ? "ArrayStore" + Arrays.toString(values)
                : "ArrayStore[length=" + values.length + "]";
    }
}
