package com.trading.brownian.interp;

import com.trading.brownian.api.Observation;
import com.trading.brownian.store.ObservationStore;

/**
 * Nearest-neighbor streaming interpolator.
 *
 * Returns the value of the closer enclosing point. The left point wins only
 * when it is strictly closer; equidistant queries resolve to the right point.
 */
public class NearestNeighborStreamingInterpolator extends AbstractStreamingInterpolator {

    public NearestNeighborStreamingInterpolator() {
        super();
    }

    public NearestNeighborStreamingInterpolator(ObservationStore store) {
        super(store);
    }

    @Override
    protected double interpolate(double x, Observation left, Observation right) {
        if (Math.abs(x - left.key()) < Math.abs(x - right.key())) {
            return left.value();
        }
        return right.value();
    }

    @Override
    public InterpolatorType type() {
        return InterpolatorType.NEAREST_NEIGHBOR;
    }
}
