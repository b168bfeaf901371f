package com.iksanov.rangecache.engine.app.workload;

import com.iksanov.rangecache.common.exception.CacheException;
import com.iksanov.rangecache.engine.recurrence.MemoizedRecurrence;
import com.iksanov.rangecache.engine.splay.SplayCache;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Average time per call of the splay-memoized recurrence against the iterative reference,
 * for {@code n = 0, step, 2*step, ... <= maxN}. Each series starts from an empty tree that
 * stays warm across its repeats.
 */
public class RecurrenceBenchmark {

    public record Sample(int n, double iterativeNanos, double splayNanos) {}

    public List<Sample> run(int maxN, int step, int repeats) {
        checkArgument(maxN >= 0, "maxN must be >= 0");
        checkArgument(step > 0, "step must be > 0");
        checkArgument(repeats > 0, "repeats must be > 0");

        List<Sample> samples = new ArrayList<>();
        for (int n : samplePoints(maxN, step)) {
            BigInteger expected = null;
            long start = System.nanoTime();
            for (int i = 0; i < repeats; i++) {
                expected = MemoizedRecurrence.iterative(n);
            }
            double iterative = (System.nanoTime() - start) / (double) repeats;

            MemoizedRecurrence recurrence = new MemoizedRecurrence(new SplayCache<>());
            BigInteger actual = null;
            start = System.nanoTime();
            for (int i = 0; i < repeats; i++) {
                actual = recurrence.evaluate(n);
            }
            double splay = (System.nanoTime() - start) / (double) repeats;

            if (!expected.equals(actual)) {
                throw new CacheException("Memoized result for n=" + n + " differs from the iterative one");
            }
            samples.add(new Sample(n, iterative, splay));
        }
        return samples;
    }

    /**
     * {@code 0, step, 2*step, ...} up to and including {@code maxN}, without overflowing near {@code Integer.MAX_VALUE}.
     */
    static List<Integer> samplePoints(int maxN, int step) {
        checkArgument(maxN >= 0, "maxN must be >= 0");
        checkArgument(step > 0, "step must be > 0");
        List<Integer> points = new ArrayList<>();
        for (int n = 0; ; n += step) {
            points.add(n);
            if (n > maxN - step) break;
        }
        return points;
    }
}
