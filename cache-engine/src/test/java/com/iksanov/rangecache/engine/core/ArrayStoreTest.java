package com.iksanov.rangecache.engine.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class ArrayStoreTest {

    @Test
    @DisplayName("sum() should include both bounds")
    void sumIsInclusive() {
        ArrayStore store = ArrayStore.of(1, 2, 3, 4, 5);

        assertThat(store.sum(1, 3)).isEqualTo(9);
        assertThat(store.sum(0, 4)).isEqualTo(15);
        assertThat(store.sum(2, 2)).isEqualTo(3);
    }

    @Test
    @DisplayName("set() should be visible to later reads")
    void setUpdatesValue() {
        ArrayStore store = ArrayStore.of(1, 2, 3);

        store.set(1, 50);

        assertThat(store.get(1)).isEqualTo(50);
        assertThat(store.sum(0, 2)).isEqualTo(54);
    }

    @Test
    @DisplayName("Store should own a private copy of the initial array")
    void copiesInitialArray() {
        long[] initial = {1, 2, 3};
        ArrayStore store = new ArrayStore(initial);

        initial[0] = 100;
        store.snapshot()[1] = 100;

        assertThat(store.snapshot()).containsExactly(1, 2, 3);
    }

    @Test
    @DisplayName("Out-of-range indices should raise IndexOutOfBoundsException")
    void rejectsOutOfRange() {
        ArrayStore store = ArrayStore.of(1, 2, 3);

        assertThatThrownBy(() -> store.get(3)).isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(() -> store.set(-1, 0)).isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(() -> store.sum(1, 3)).isInstanceOf(IndexOutOfBoundsException.class);
    }

    @Test
    @DisplayName("sum() should fail loudly instead of wrapping on long overflow")
    void sumOverflowThrows() {
        ArrayStore store = ArrayStore.of(Long.MAX_VALUE, 1, 2);

        assertThatThrownBy(() -> store.sum(0, 1)).isInstanceOf(ArithmeticException.class);
        assertThat(store.sum(1, 2)).isEqualTo(3);
    }
}
