package com.trading.brownian.store;

import com.trading.brownian.api.NeighborPair;
import com.trading.brownian.api.Observation;

import java.util.List;

/**
 * Ordered mapping from a real-valued key (time or x-coordinate) to an observed
 * value.
 *
 * <p>
 * Keys are unique and iterate in strictly increasing order. Re-inserting an
 * existing key replaces its value. There is no removal: a store only grows.
 *
 * <p>
 * Implementations must answer {@link #floor(double)} and
 * {@link #ceiling(double)} in O(log n) under streaming insertion.
 *
 * <p>
 * Thread Safety:
 * None. A store shared between several processes or interpolators must be
 * accessed from a single writer thread, or guarded by the caller.
 */
public interface ObservationStore {

    /**
     * Adds or replaces the observation at {@code key}.
     *
     * @throws IllegalArgumentException if key or value is NaN or infinite.
     */
    void insert(double key, double value);

    /**
     * @return The observation with the largest key &lt;= {@code key}, or null.
     */
    Observation floor(double key);

    /**
     * @return The observation with the smallest key &gt;= {@code key}, or null.
     */
    Observation ceiling(double key);

    /**
     * @return The observation stored exactly at {@code key}, or null.
     */
    Observation get(double key);

    boolean isEmpty();

    int size();

    /**
     * @throws EmptyStoreException if the store holds no observations.
     */
    double minKey();

    /**
     * @throws EmptyStoreException if the store holds no observations.
     */
    double maxKey();

    /**
     * Returns a read-only snapshot of all observations in ascending key order.
     */
    List<Observation> observations();

    /**
     * Floor and ceiling of {@code key} in one call.
     */
    default NeighborPair neighbors(double key) {
        return new NeighborPair(floor(key), ceiling(key));
    }
}
