package com.trading.brownian.api;

/**
 * A single observed point: a key (time or x-coordinate) and the value seen
 * there.
 *
 * @param key   The time or x-coordinate.
 * @param value The observed value.
 */
public record Observation(double key, double value) {
}
