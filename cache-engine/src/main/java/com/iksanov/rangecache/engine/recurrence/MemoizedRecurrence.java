package com.iksanov.rangecache.engine.recurrence;

import com.iksanov.rangecache.engine.splay.SplayCache;

import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Fibonacci recurrence {@code F(n) = F(n-1) + F(n-2)}, {@code F(0) = 0}, {@code F(1) = 1},
 * memoized in a {@link SplayCache}.
 * <p>
 * Evaluation consults the cache before expanding a subproblem and inserts every result it
 * computes, in the same order as the naive recursive definition would. Pending subproblems
 * are kept on an explicit work-list so the evaluation depth is not bounded by the thread stack.
 */
public class MemoizedRecurrence {

    private final SplayCache<BigInteger> cache;

    public MemoizedRecurrence(SplayCache<BigInteger> cache) {
        this.cache = Objects.requireNonNull(cache, "cache");
    }

    private static final class Frame {
        final long n;
        int stage;
        BigInteger first;

        Frame(long n) {
            this.n = n;
        }
    }

    public BigInteger evaluate(long n) {
        checkArgument(n >= 0, "n must be >= 0, got %s", n);

        Deque<Frame> pending = new ArrayDeque<>();
        pending.push(new Frame(n));
        BigInteger last = BigInteger.ZERO;

        while (!pending.isEmpty()) {
            Frame frame = pending.peek();
            switch (frame.stage) {
                case 0 -> {
                    Optional<BigInteger> cached = cache.search(frame.n);
                    if (cached.isPresent()) {
                        last = cached.get();
                        pending.pop();
                    } else if (frame.n < 2) {
                        last = BigInteger.valueOf(frame.n);
                        cache.insert(frame.n, last);
                        pending.pop();
                    } else {
                        frame.stage = 1;
                        pending.push(new Frame(frame.n - 1));
                    }
                }
                case 1 -> {
                    frame.first = last;
                    frame.stage = 2;
                    pending.push(new Frame(frame.n - 2));
                }
                default -> {
                    last = frame.first.add(last);
                    cache.insert(frame.n, last);
                    pending.pop();
                }
            }
        }
        return last;
    }

    public SplayCache<BigInteger> cache() {
        return cache;
    }

    /**
     * Uncached reference evaluation in O(n) additions.
     */
    public static BigInteger iterative(long n) {
        checkArgument(n >= 0, "n must be >= 0, got %s", n);
        if (n < 2) return BigInteger.valueOf(n);
        BigInteger a = BigInteger.ZERO;
        BigInteger b = BigInteger.ONE;
        for (long i = 2; i <= n; i++) {
            BigInteger next = a.add(b);
            a = b;
            b = next;
        }
        return b;
    }
}
