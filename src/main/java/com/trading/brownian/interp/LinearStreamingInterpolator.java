package com.trading.brownian.interp;

import com.trading.brownian.api.Observation;
import com.trading.brownian.store.ObservationStore;

/**
 * Linear streaming interpolator.
 *
 * Formula (inverse-distance weighting of the enclosing points):
 * y = (|x - x_R| * y_L + |x - x_L| * y_R) / (|x - x_R| + |x - x_L|)
 */
public class LinearStreamingInterpolator extends AbstractStreamingInterpolator {

    public LinearStreamingInterpolator() {
        super();
    }

    public LinearStreamingInterpolator(ObservationStore store) {
        super(store);
    }

    @Override
    protected double interpolate(double x, Observation left, Observation right) {
        double distLeft = x - left.key();
        double distRight = right.key() - x;
        if (Double.isInfinite(distLeft + distRight)) {
            // keys near the limits of the double range
            distLeft = x * 0.5 - left.key() * 0.5;
            distRight = right.key() * 0.5 - x * 0.5;
        }
        double weightLeft = distRight / (distLeft + distRight);
        return weightLeft * left.value() + (1.0 - weightLeft) * right.value();
    }

    @Override
    public InterpolatorType type() {
        return InterpolatorType.LINEAR;
    }
}
