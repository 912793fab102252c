package com.trading.brownian.store;

import java.util.NoSuchElementException;

/**
 * Thrown by order-statistics queries ({@code minKey}, {@code maxKey}) on a
 * store that holds no observations.
 */
public class EmptyStoreException extends NoSuchElementException {
    private static final long serialVersionUID = 1L;

    public EmptyStoreException(String message) {
        super(message);
    }
}
