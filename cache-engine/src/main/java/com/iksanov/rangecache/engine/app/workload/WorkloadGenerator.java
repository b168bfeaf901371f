package com.iksanov.rangecache.engine.app.workload;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Seeded generator for random arrays and mixed range/update workloads.
 * Ranges pick {@code left} uniformly in {@code [0, n)} and {@code right} uniformly in {@code [left, n)}.
 */
public class WorkloadGenerator {

    private final Random random;

    public WorkloadGenerator(long seed) {
        this.random = new Random(seed);
    }

    public long[] randomArray(int length, int maxValue) {
        checkArgument(length > 0, "length must be > 0");
        checkArgument(maxValue > 0, "maxValue must be > 0");
        long[] values = new long[length];
        for (int i = 0; i < length; i++) {
            values[i] = 1 + random.nextInt(maxValue);
        }
        return values;
    }

    public List<Operation> operations(int count, int arrayLength, int maxValue) {
        checkArgument(count >= 0, "count must be >= 0");
        checkArgument(arrayLength > 0, "arrayLength must be > 0");
        checkArgument(maxValue > 0, "maxValue must be > 0");
        List<Operation> operations = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            if (random.nextBoolean()) {
                int left = random.nextInt(arrayLength);
                int right = left + random.nextInt(arrayLength - left);
                operations.add(Operation.range(left, right));
            } else {
                operations.add(Operation.update(random.nextInt(arrayLength), 1 + random.nextInt(maxValue)));
            }
        }
        return operations;
    }
}
