package com.trading.brownian.api;

/**
 * The nearest observations bracketing a query key.
 *
 * <p>
 * Transient value returned by neighbor queries. Either side may be
 * {@code null} when no observation exists in that direction. When the query
 * key is stored exactly, {@code left} and {@code right} are the same
 * observation.
 *
 * @param left  Observation with the largest key at or below the query, or null.
 * @param right Observation with the smallest key at or above the query, or null.
 */
public record NeighborPair(Observation left, Observation right) {

    public boolean hasLeft() {
        return left != null;
    }

    public boolean hasRight() {
        return right != null;
    }

    public boolean isEmpty() {
        return left == null && right == null;
    }

    /**
     * Returns the observation stored exactly at {@code key}, or null.
     */
    public Observation exactMatch(double key) {
        if (left != null && left.key() == key)
            return left;
        if (right != null && right.key() == key)
            return right;
        return null;
    }
}
