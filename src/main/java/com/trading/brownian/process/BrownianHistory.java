package com.trading.brownian.process;

import com.trading.brownian.api.NeighborPair;
import com.trading.brownian.api.Observation;
import com.trading.brownian.store.ObservationStore;
import com.trading.brownian.store.TreeObservationStore;

import java.util.List;

/**
 * The set of known (time, value) pairs of one Brownian variable.
 *
 * <p>
 * Owns an {@link ObservationStore} keyed by time. The owning
 * {@link BrownianProcess} seeds it with its start point, so a history used by a
 * process is never empty.
 */
public final class BrownianHistory {
    private final ObservationStore store;

    public BrownianHistory() {
        this(new TreeObservationStore());
    }

    /**
     * Wraps an existing store. The store is shared, not copied.
     */
    public BrownianHistory(ObservationStore store) {
        if (store == null)
            throw new IllegalArgumentException("store must not be null");
        this.store = store;
    }

    /**
     * Records the value observed at time {@code t}, replacing any previous value
     * at exactly that time.
     */
    public void insertData(double t, double val) {
        store.insert(t, val);
    }

    /**
     * Returns the observations that condition the process value at {@code t}:
     * the latest at or before {@code t} and the earliest at or after it.
     *
     * <p>
     * Example, with history {(3.0, 0.07), (3.5, 0.21)}:
     * <ul>
     * <li>{@code getMartingaleRelevantPoints(3.1)} gives ((3.0, 0.07), (3.5, 0.21))</li>
     * <li>{@code getMartingaleRelevantPoints(3.6)} gives ((3.5, 0.21), null)</li>
     * <li>{@code getMartingaleRelevantPoints(3.5)} gives ((3.5, 0.21), (3.5, 0.21))</li>
     * </ul>
     */
    public NeighborPair getMartingaleRelevantPoints(double t) {
        return store.neighbors(t);
    }

    /** The observation at exactly {@code t}, or null. */
    public Observation get(double t) {
        return store.get(t);
    }

    public boolean isEmpty() {
        return store.isEmpty();
    }

    public int size() {
        return store.size();
    }

    /** All observations in ascending time order. */
    public List<Observation> observations() {
        return store.observations();
    }

    public ObservationStore getStore() {
        return store;
    }
}
