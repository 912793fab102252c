package com.trading.brownian.store;

import com.trading.brownian.api.Observation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * {@link ObservationStore} backed by a red-black tree ({@link TreeMap}).
 *
 * <p>
 * Insert, floor, ceiling, min and max are all O(log n). Keys are normalized so
 * that {@code -0.0} and {@code 0.0} address the same observation;
 * {@link Double#compareTo} would otherwise order them as distinct keys.
 */
public final class TreeObservationStore implements ObservationStore {
    private final TreeMap<Double, Double> tree = new TreeMap<>();

    public TreeObservationStore() {
    }

    /**
     * Creates a store holding a single seed observation.
     */
    public TreeObservationStore(double seedKey, double seedValue) {
        insert(seedKey, seedValue);
    }

    @Override
    public void insert(double key, double value) {
        if (!Double.isFinite(key)) {
            throw new IllegalArgumentException("Invalid key: " + key);
        }
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("Invalid value: " + value + " at key: " + key);
        }
        tree.put(normalize(key), value);
    }

    @Override
    public Observation floor(double key) {
        return toObservation(tree.floorEntry(normalize(key)));
    }

    @Override
    public Observation ceiling(double key) {
        return toObservation(tree.ceilingEntry(normalize(key)));
    }

    @Override
    public Observation get(double key) {
        double k = normalize(key);
        Double value = tree.get(k);
        return value == null ? null : new Observation(k, value);
    }

    @Override
    public boolean isEmpty() {
        return tree.isEmpty();
    }

    @Override
    public int size() {
        return tree.size();
    }

    @Override
    public double minKey() {
        if (tree.isEmpty())
            throw new EmptyStoreException("minKey() called on an empty store");
        return tree.firstKey();
    }

    @Override
    public double maxKey() {
        if (tree.isEmpty())
            throw new EmptyStoreException("maxKey() called on an empty store");
        return tree.lastKey();
    }

    @Override
    public List<Observation> observations() {
        List<Observation> out = new ArrayList<>(tree.size());
        for (Map.Entry<Double, Double> e : tree.entrySet()) {
            out.add(new Observation(e.getKey(), e.getValue()));
        }
        return Collections.unmodifiableList(out);
    }

    @Override
    public String toString() {
        return "TreeObservationStore{size=" + tree.size() + "}";
    }

    private static double normalize(double key) {
        if (Double.isNaN(key))
            throw new IllegalArgumentException("Key must not be NaN");
        // -0.0 + 0.0 == +0.0
        return key + 0.0;
    }

    private static Observation toObservation(Map.Entry<Double, Double> entry) {
        return entry == null ? null : new Observation(entry.getKey(), entry.getValue());
    }
}
