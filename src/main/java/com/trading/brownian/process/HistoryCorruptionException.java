package com.trading.brownian.process;

/**
 * Thrown when a Brownian process finds no observation at all around a query
 * time. A process history always holds its seed point, so this signals a broken
 * construction invariant. Not recoverable.
 */
public class HistoryCorruptionException extends IllegalStateException {
    private static final long serialVersionUID = 1L;

    public HistoryCorruptionException(String message) {
        super(message);
    }
}
