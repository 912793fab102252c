package com.trading.brownian.interp;

/**
 * Interpolates streamed (x, value) pairs in one dimension.
 *
 * <p>
 * Points may arrive in any order. Queries are answered from the nearest stored
 * points on either side of the query x in O(log n).
 */
public interface StreamingInterpolator {

    /**
     * Registers a data point, replacing any previous value at {@code x}.
     */
    void insert(double x, double val);

    /**
     * Returns the interpolated value at {@code x}, or {@link Double#NaN} if no
     * point has been registered yet.
     */
    double getInterpolatedVal(double x);

    /** The variant tag of this interpolator. */
    InterpolatorType type();
}
