package com.trading.brownian.sampler;

import java.util.Random;

/**
 * {@link GaussianSampler} over {@link Random#nextGaussian()}.
 *
 * <p>
 * Seed it for reproducible simulations. Not thread-safe beyond what
 * {@link Random} itself guarantees.
 */
public final class RandomGaussianSampler implements GaussianSampler {
    private final Random rng;

    public RandomGaussianSampler() {
        this(new Random());
    }

    public RandomGaussianSampler(long seed) {
        this(new Random(seed));
    }

    public RandomGaussianSampler(Random rng) {
        this.rng = rng;
    }

    @Override
    public double draw(double mean, double stddev) {
        if (Double.isNaN(stddev) || stddev < 0) {
            throw new IllegalArgumentException("Standard deviation must be >= 0, got: " + stddev);
        }
        if (stddev == 0.0) {
            return mean;
        }
        return mean + stddev * rng.nextGaussian();
    }
}
