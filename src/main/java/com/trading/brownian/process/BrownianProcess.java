package com.trading.brownian.process;

import com.trading.brownian.api.NeighborPair;
import com.trading.brownian.api.Observation;
import com.trading.brownian.sampler.GaussianSampler;
import com.trading.brownian.sampler.RandomGaussianSampler;

import java.util.Arrays;
import java.util.Comparator;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.extern.log4j.Log4j2;

/**
 * Brownian motion with drift, observed at discrete and irregular times.
 *
 * <p>
 * Model: increments over an interval of length {@code dt} are normally
 * distributed with mean {@code drift * dt} and standard deviation
 * {@code sigma * sqrt(dt)}.
 *
 * <p>
 * The value at a query time {@code t} is inferred from the nearest known
 * observations on either side (see
 * {@link BrownianHistory#getMartingaleRelevantPoints(double)}):
 * <ul>
 * <li>Exact match: point mass at the observed value.</li>
 * <li>Left only: forward projection from the left observation.</li>
 * <li>Right only: backward projection from the right observation.</li>
 * <li>Both: the two one-sided projections fused by precision weighting, which
 * is the Brownian bridge.</li>
 * </ul>
 *
 * <p>
 * Sampling with {@link #getValue(double)} writes the sample back into the
 * history. Later queries see it as a bracketing point, so the order of queries
 * changes the results.
 *
 * <p>
 * Thread Safety:
 * None. All operations run to completion on the calling thread.
 */
@Log4j2
@Getter
public class BrownianProcess {
    private final double sigma;
    private final double drift;
    private final double startTime;
    private final double startVal;
    private final BrownianHistory history;
    @Getter(AccessLevel.NONE)
    private final GaussianSampler sampler;

    /**
     * Driftless process starting at (0, 0) with an unseeded sampler.
     */
    public BrownianProcess(double sigma) {
        this(sigma, 0.0, 0.0, 0.0);
    }

    public BrownianProcess(double sigma, double startTime, double startVal, double drift) {
        this(sigma, startTime, startVal, drift, new BrownianHistory(), new RandomGaussianSampler());
    }

    /**
     * Full constructor.
     *
     * <p>
     * The seed point (startTime, startVal) is written into {@code history}
     * unless the history already holds an observation at {@code startTime}; an
     * existing observation wins.
     *
     * @param sigma     Diffusion coefficient, &gt;= 0.
     * @param startTime Time of the seed observation.
     * @param startVal  Value of the seed observation.
     * @param drift     Drift rate per unit time.
     * @param history   History to read and extend. May be shared.
     * @param sampler   Gaussian source used by {@link #getValue(double)}.
     * @throws InvalidParameterException if sigma is negative or any parameter is
     *                                   not finite.
     */
    public BrownianProcess(double sigma, double startTime, double startVal, double drift,
            BrownianHistory history, GaussianSampler sampler) {
        requireFinite("sigma", sigma);
        if (sigma < 0) {
            throw new InvalidParameterException("sigma must be >= 0, got: " + sigma);
        }
        requireFinite("startTime", startTime);
        requireFinite("startVal", startVal);
        requireFinite("drift", drift);
        if (history == null) {
            throw new InvalidParameterException("history must not be null");
        }
        if (sampler == null) {
            throw new InvalidParameterException("sampler must not be null");
        }

        this.sigma = sigma;
        this.drift = drift;
        this.startTime = startTime;
        this.startVal = startVal;
        this.history = history;
        this.sampler = sampler;

        Observation existing = history.get(startTime);
        if (existing == null) {
            history.insertData(startTime, startVal);
        } else if (existing.value() != startVal) {
            log.warn("History already holds {} at start time {}; ignoring start value {}",
                    existing.value(), startTime, startVal);
        }
        log.debug("Created BrownianProcess sigma={} drift={} seed=({}, {}) historySize={}",
                sigma, drift, startTime, startVal, history.size());
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the distribution of the process value at time {@code t} given the
     * current history. Does not modify the history.
     *
     * @throws HistoryCorruptionException if the history holds no observation.
     */
    public NormalDistribution getPossibleValueDistr(double t) {
        requireFinite("t", t);
        NeighborPair points = history.getMartingaleRelevantPoints(t);

        if (points.isEmpty()) {
            log.error("No observation brackets t={}; history size={}", t, history.size());
            throw new HistoryCorruptionException(
                    "History has no observations around t=" + t + "; the seed point is missing");
        }

        Observation exact = points.exactMatch(t);
        if (exact != null) {
            return NormalDistribution.pointMass(exact.value());
        }

        Observation left = points.left();
        Observation right = points.right();
        if (right == null) {
            return project(left, t);
        }
        if (left == null) {
            return project(right, t);
        }
        return bridge(left, right, t);
    }

    /**
     * Samples the process at {@code t} and records the sample in history.
     */
    public double getValue(double t) {
        return getValue(t, true);
    }

    /**
     * Samples the process at {@code t}.
     *
     * @param storeInHistory If true the sample is inserted into history, so later
     *                       queries are conditioned on it.
     * @return The sampled value.
     */
    public double getValue(double t, boolean storeInHistory) {
        double value = getPossibleValueDistr(t).sample(sampler);
        if (storeInHistory) {
            history.insertData(t, value);
            log.trace("Stored sample t={} value={}", t, value);
        }
        return value;
    }

    /**
     * Samples the process at every time in {@code times} and records all samples.
     *
     * <p>
     * Times are evaluated in ascending order regardless of input order, so each
     * sample is conditioned on the lower-time samples of the same batch. The
     * returned array is aligned with the input: {@code result[i]} is the value at
     * {@code times[i]}. A time repeated in the batch yields the same value.
     *
     * @throws IllegalArgumentException if any time is NaN or infinite. Nothing
     *                                  is sampled in that case.
     */
    public double[] getValues(double... times) {
        for (double t : times) {
            requireFinite("t", t);
        }

        Integer[] order = new Integer[times.length];
        for (int i = 0; i < order.length; i++) {
            order[i] = i;
        }
        Arrays.sort(order, Comparator.comparingDouble(i -> times[i]));

        double[] values = new double[times.length];
        for (int i : order) {
            values[i] = getValue(times[i], true);
        }
        return values;
    }

    /**
     * Records an externally observed value. Equivalent to
     * {@code getHistory().insertData(t, val)}.
     */
    public void observe(double t, double val) {
        history.insertData(t, val);
    }

    /**
     * One-sided projection from a known observation to time {@code t}, forward
     * or backward.
     *
     * <p>
     * Formula:
     * <pre>
     * mean   = ref.value + drift * (t - ref.time)
     * stdDev = sigma * sqrt(|t - ref.time|)
     * </pre>
     */
    public NormalDistribution project(Observation reference, double t) {
        double dt = t - reference.key();
        return new NormalDistribution(reference.value() + drift * dt, sigma * Math.sqrt(Math.abs(dt)));
    }

    private NormalDistribution bridge(Observation left, Observation right, double t) {
        NormalDistribution fromLeft = project(left, t);
        NormalDistribution fromRight = project(right, t);

        if (fromLeft.isPointMass() && fromRight.isPointMass()) {
            // sigma == 0: the limit of the precision weights is the ratio of the
            // time distances, which gives linear interpolation of the two means.
            double dtLeft = t - left.key();
            double dtRight = right.key() - t;
            double mean = (dtRight * fromLeft.mean() + dtLeft * fromRight.mean()) / (dtLeft + dtRight);
            return NormalDistribution.pointMass(mean);
        }
        return NormalDistribution.fuse(fromLeft, fromRight);
    }

    private static void requireFinite(String name, double value) {
        if (!Double.isFinite(value)) {
            throw new InvalidParameterException(name + " must be finite, got: " + value);
        }
    }

    /**
     * Fluent construction with the defaults startTime = 0, startVal = 0,
     * drift = 0, a fresh history and an unseeded sampler.
     */
    public static final class Builder {
        private double sigma;
        private double startTime;
        private double startVal;
        private double drift;
        private BrownianHistory history;
        private GaussianSampler sampler;

        private Builder() {
        }

        public Builder sigma(double sigma) {
            this.sigma = sigma;
            return this;
        }

        public Builder startTime(double startTime) {
            this.startTime = startTime;
            return this;
        }

        public Builder startVal(double startVal) {
            this.startVal = startVal;
            return this;
        }

        public Builder drift(double drift) {
            this.drift = drift;
            return this;
        }

        public Builder history(BrownianHistory history) {
            this.history = history;
            return this;
        }

        public Builder sampler(GaussianSampler sampler) {
            this.sampler = sampler;
            return this;
        }

        /** Shorthand for a {@link RandomGaussianSampler} with a fixed seed. */
        public Builder seed(long seed) {
            this.sampler = new RandomGaussianSampler(seed);
            return this;
        }

        public BrownianProcess build() {
            return new BrownianProcess(sigma, startTime, startVal, drift,
                    history != null ? history : new BrownianHistory(),
                    sampler != null ? sampler : new RandomGaussianSampler());
        }
    }
}
