package com.trading.brownian.sampler;

/**
 * Source of normally distributed random numbers.
 *
 * <p>
 * Implementations must return {@code mean} exactly when {@code stddev} is 0, so
 * that sampling a point-mass distribution is deterministic.
 */
@FunctionalInterface
public interface GaussianSampler {

    /**
     * Draws one value from N(mean, stddev^2).
     *
     * @param mean   Distribution mean.
     * @param stddev Standard deviation, &gt;= 0.
     * @return The sample.
     */
    double draw(double mean, double stddev);
}
