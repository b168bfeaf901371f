package com.iksanov.rangecache.engine.core;

import com.iksanov.rangecache.common.dto.RangeKey;
import com.iksanov.rangecache.common.exception.CacheException;
import com.iksanov.rangecache.engine.metrics.CacheMetrics;
import org.junit.jupiter.api.*;

import java.util.Random;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link RangeAggregateCache}: capacity bound, strict LRU order,
 * recency promotion and predicate invalidation.
 */
@DisplayName("RangeAggregateCache - LRU with range invalidation")
class RangeAggregateCacheTest {

    private RangeAggregateCache cache;
    private CacheMetrics metrics;

    @BeforeEach
    void setUp() {
        metrics = new CacheMetrics();
        cache = new RangeAggregateCache(3, metrics);
    }

    @Test
    @DisplayName("put() and get() should store and retrieve aggregates")
    void shouldStoreAndRetrieve() {
        cache.put(RangeKey.of(0, 2), 6);
        cache.put(RangeKey.of(1, 4), 14);

        assertThat(cache.size()).isEqualTo(2);
        assertThat(cache.get(RangeKey.of(0, 2))).hasValue(6);
        assertThat(cache.get(RangeKey.of(1, 4))).hasValue(14);
    }

    @Test
    @DisplayName("get() on a missing key should be empty and leave contents alone")
    void missShouldBeEmpty() {
        cache.put(RangeKey.of(0, 0), 1);

        assertThat(cache.get(RangeKey.of(5, 9))).isEmpty();
        assertThat(cache.size()).isEqualTo(1);
        assertThat(metrics.misses()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("put() on an existing key should overwrite without growing")
    void shouldOverwriteExistingKey() {
        cache.put(RangeKey.of(2, 3), 10);
        cache.put(RangeKey.of(2, 3), 20);

        assertThat(cache.get(RangeKey.of(2, 3))).hasValue(20);
        assertThat(cache.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("C+1 distinct puts should evict only the first-inserted key")
    void shouldEvictFirstInsertedKey() {
        cache.put(RangeKey.of(0, 1), 1);
        cache.put(RangeKey.of(0, 2), 2);
        cache.put(RangeKey.of(0, 3), 3);
        cache.put(RangeKey.of(0, 4), 4);

        assertThat(cache.size()).isEqualTo(3);
        assertThat(cache.contains(RangeKey.of(0, 1))).isFalse();
        assertThat(cache.contains(RangeKey.of(0, 2))).isTrue();
        assertThat(cache.contains(RangeKey.of(0, 3))).isTrue();
        assertThat(cache.contains(RangeKey.of(0, 4))).isTrue();
        assertThat(metrics.evictions()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("get() should promote a key so the next overflow evicts another one")
    void getShouldPromoteRecency() {
        RangeKey k1 = RangeKey.of(1, 1);
        RangeKey k2 = RangeKey.of(2, 2);
        RangeKey k3 = RangeKey.of(3, 3);
        cache.put(k1, 1);
        cache.put(k2, 2);
        cache.put(k3, 3);

        cache.get(k1);
        cache.put(RangeKey.of(4, 4), 4);

        assertThat(cache.contains(k1)).isTrue();
        assertThat(cache.contains(k2)).as("k2 was touched least recently").isFalse();
        assertThat(cache.keysInRecencyOrder()).containsExactly(k3, k1, RangeKey.of(4, 4));
    }

    @Test
    @DisplayName("put() on an existing key should also promote it")
    void putShouldPromoteRecency() {
        RangeKey k1 = RangeKey.of(1, 1);
        cache.put(k1, 1);
        cache.put(RangeKey.of(2, 2), 2);
        cache.put(RangeKey.of(3, 3), 3);

        cache.put(k1, 11);
        cache.put(RangeKey.of(4, 4), 4);

        assertThat(cache.get(k1)).hasValue(11);
        assertThat(cache.contains(RangeKey.of(2, 2))).isFalse();
    }

    @Test
    @DisplayName("Size should never exceed capacity across a random put sequence")
    void shouldRespectCapacity() {
        Random random = new Random(7);
        for (int i = 0; i < 500; i++) {
            int left = random.nextInt(20);
            cache.put(RangeKey.of(left, left + random.nextInt(5)), i);
            assertThat(cache.size()).isLessThanOrEqualTo(cache.capacity());
        }
    }

    @Test
    @DisplayName("invalidate() should drop every matching key and keep the rest untouched")
    void invalidateShouldRemoveMatchingKeys() {
        Fixture.fill(cache);

        int removed = cache.invalidate(key -> key.contains(5));

        assertThat(removed).isEqualTo(2);
        assertThat(cache.contains(RangeKey.of(0, 5))).isFalse();
        assertThat(cache.contains(RangeKey.of(5, 9))).isFalse();
        assertThat(cache.get(RangeKey.of(0, 4))).hasValue(10);
        assertThat(metrics.invalidations()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("invalidate() with a non-matching predicate should be a no-op")
    void invalidateNoMatch() {
        Fixture.fill(cache);

        assertThat(cache.invalidate(key -> false)).isZero();
        assertThat(cache.size()).isEqualTo(3);
    }

    @Test
    @DisplayName("A throwing predicate should leave the cache unchanged")
    void invalidateIsAllOrNothing() {
        Fixture.fill(cache);

        assertThatThrownBy(() -> cache.invalidate(key -> {
            if (key.left() == 5) throw new IllegalStateException("boom");
            return true;
        })).isInstanceOf(IllegalStateException.class);

        assertThat(cache.size()).isEqualTo(3);
    }

    @Test
    @DisplayName("Repeated get() without mutation should return the same value")
    void getIsIdempotent() {
        cache.put(RangeKey.of(3, 7), 42);

        assertThat(cache.get(RangeKey.of(3, 7))).isEqualTo(cache.get(RangeKey.of(3, 7)));
    }

    @Test
    @DisplayName("clear() should remove all entries")
    void shouldClear() {
        Fixture.fill(cache);

        cache.clear();

        assertThat(cache.size()).isZero();
        assertThat(metrics.size()).isZero();
    }

    @Test
    @DisplayName("Non-positive capacity and null arguments should be rejected")
    void shouldRejectInvalidInput() {
        assertThatThrownBy(() -> new RangeAggregateCache(0)).isInstanceOf(CacheException.class);
        assertThatThrownBy(() -> cache.get(null)).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> cache.put(null, 1)).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> cache.invalidate(null)).isInstanceOf(NullPointerException.class);
    }

    private static final class Fixture {
        static void fill(RangeAggregateCache cache) {
            cache.put(RangeKey.of(0, 4), 10);
            cache.put(RangeKey.of(0, 5), 15);
            cache.put(RangeKey.of(5, 9), 35);
        }
    }
}
