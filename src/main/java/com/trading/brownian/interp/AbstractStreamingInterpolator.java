package com.trading.brownian.interp;

import com.trading.brownian.api.NeighborPair;
import com.trading.brownian.api.Observation;
import com.trading.brownian.store.ObservationStore;
import com.trading.brownian.store.TreeObservationStore;

import lombok.extern.log4j.Log4j2;

/**
 * Base class for streaming interpolators. Handles the shared edge cases.
 * <p>
 * <ul>
 * <li>Empty store: {@code NaN}.</li>
 * <li>Exact match: the stored value.</li>
 * <li>One neighbor only: that neighbor's value (no extrapolation).</li>
 * </ul>
 * Subclasses only decide the case with a neighbor on each side.
 */
@Log4j2
public abstract class AbstractStreamingInterpolator implements StreamingInterpolator {
    private final ObservationStore store;

    protected AbstractStreamingInterpolator() {
        this(new TreeObservationStore());
    }

    /**
     * Uses the given store. Sharing a store between interpolators is allowed;
     * each one then sees every point inserted through any of them.
     */
    protected AbstractStreamingInterpolator(ObservationStore store) {
        if (store == null)
            throw new IllegalArgumentException("store must not be null");
        this.store = store;
        log.debug("Created {} over {}", getClass().getSimpleName(), store);
    }

    @Override
    public final void insert(double x, double val) {
        store.insert(x, val);
    }

    @Override
    public final double getInterpolatedVal(double x) {
        if (store.isEmpty()) {
            return Double.NaN;
        }

        NeighborPair points = store.neighbors(x);
        Observation exact = points.exactMatch(x);
        if (exact != null) {
            return exact.value();
        }

        // check if on edge
        if (!points.hasLeft()) {
            return points.right().value();
        }
        if (!points.hasRight()) {
            return points.left().value();
        }
        return interpolate(x, points.left(), points.right());
    }

    public ObservationStore getStore() {
        return store;
    }

    /**
     * Subclasses implement the two-neighbor case here.
     * {@code left.key() < x < right.key()} holds on entry.
     */
    protected abstract double interpolate(double x, Observation left, Observation right);

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{points=" + store.size() + "}";
    }
}
