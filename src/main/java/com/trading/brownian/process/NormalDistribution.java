package com.trading.brownian.process;

import com.trading.brownian.sampler.GaussianSampler;

/**
 * Normal distribution descriptor, N(mean, stdDev^2).
 *
 * <p>
 * A standard deviation of 0 describes a point mass at {@code mean}.
 *
 * @param mean   Distribution mean.
 * @param stdDev Standard deviation, &gt;= 0.
 */
public record NormalDistribution(double mean, double stdDev) {

    public NormalDistribution {
        if (Double.isNaN(mean)) {
            throw new IllegalArgumentException("Mean must not be NaN");
        }
        if (Double.isNaN(stdDev) || stdDev < 0) {
            throw new IllegalArgumentException("Standard deviation must be >= 0, got: " + stdDev);
        }
    }

    /** Degenerate distribution with all its mass at {@code value}. */
    public static NormalDistribution pointMass(double value) {
        return new NormalDistribution(value, 0.0);
    }

    public double variance() {
        return stdDev * stdDev;
    }

    /**
     * Inverse variance. Infinite for a point mass.
     */
    public double precision() {
        return 1.0 / variance();
    }

    public boolean isPointMass() {
        return stdDev == 0.0;
    }

    /** Draws one value from this distribution. */
    public double sample(GaussianSampler sampler) {
        return sampler.draw(mean, stdDev);
    }

    /**
     * Combines two independent Gaussian estimates of the same quantity.
     *
     * <p>
     * Formula (precision-weighted average):
     * <pre>
     * p_a = 1 / var_a,  p_b = 1 / var_b
     * mean = (p_a * mean_a + p_b * mean_b) / (p_a + p_b)
     * var  = 1 / (p_a + p_b)
     * </pre>
     * The product of two normal densities, renormalized, is this normal density.
     * A point mass absorbs the other estimate.
     *
     * <p>
     * Evaluated in the equivalent ratio form
     * <pre>
     * w_a    = 1 / (1 + (sd_a / sd_b)^2)
     * mean   = w_a * mean_a + (1 - w_a) * mean_b
     * stdDev = sd_a * sd_b / hypot(sd_a, sd_b)
     * </pre>
     * so that standard deviations whose squares overflow or underflow still give
     * a finite result.
     *
     * @throws IllegalArgumentException if both estimates are point masses.
     */
    public static NormalDistribution fuse(NormalDistribution a, NormalDistribution b) {
        if (a.isPointMass() && b.isPointMass()) {
            throw new IllegalArgumentException("Cannot fuse two point masses: " + a + ", " + b);
        }
        if (a.isPointMass())
            return a;
        if (b.isPointMass())
            return b;

        double ratio = a.stdDev / b.stdDev;
        double weightA = 1.0 / (1.0 + ratio * ratio);
        double mean = weightA * a.mean + (1.0 - weightA) * b.mean;
        double stdDev = a.stdDev * (b.stdDev / Math.hypot(a.stdDev, b.stdDev));
        return new NormalDistribution(mean, stdDev);
    }
}
