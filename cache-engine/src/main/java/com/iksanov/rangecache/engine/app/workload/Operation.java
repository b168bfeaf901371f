package com.iksanov.rangecache.engine.app.workload;

/**
 * One step of a range workload: either a range query or a point update.
 */
public sealed interface Operation permits Operation.RangeQuery, Operation.PointUpdate {

    record RangeQuery(int left, int right) implements Operation {}

    record PointUpdate(int index, long value) implements Operation {}

    static Operation range(int left, int right) {
        return new RangeQuery(left, right);
    }

    static Operation update(int index, long value) {
        return new PointUpdate(index, value);
    }
}
