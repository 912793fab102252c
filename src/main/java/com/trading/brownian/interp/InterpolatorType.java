package com.trading.brownian.interp;

import java.util.Locale;
import java.util.function.Function;
import java.util.function.Supplier;

import com.trading.brownian.store.ObservationStore;

/**
 * Tags the streaming interpolator variants and builds instances of them.
 */
public enum InterpolatorType {
    LINEAR(LinearStreamingInterpolator::new, LinearStreamingInterpolator::new),
    NEAREST_NEIGHBOR(NearestNeighborStreamingInterpolator::new, NearestNeighborStreamingInterpolator::new);

    private final Supplier<StreamingInterpolator> factory;
    private final Function<ObservationStore, StreamingInterpolator> storeFactory;

    InterpolatorType(Supplier<StreamingInterpolator> factory,
            Function<ObservationStore, StreamingInterpolator> storeFactory) {
        this.factory = factory;
        this.storeFactory = storeFactory;
    }

    /** New interpolator of this type over its own empty store. */
    public StreamingInterpolator create() {
        return factory.get();
    }

    /** New interpolator of this type over the given store. */
    public StreamingInterpolator create(ObservationStore store) {
        return storeFactory.apply(store);
    }

    /**
     * Case-insensitive lookup. Accepts {@code "linear"}, {@code "NEAREST_NEIGHBOR"},
     * {@code "nearest-neighbor"} and {@code "nearest"}.
     *
     * @throws IllegalArgumentException for unknown names.
     */
    public static InterpolatorType fromString(String name) {
        if (name == null)
            throw new IllegalArgumentException("Interpolator type must not be null");
        String n = name.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        if (n.equals("NEAREST"))
            return NEAREST_NEIGHBOR;
        try {
            return valueOf(n);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown interpolator type: " + name, e);
        }
    }
}
