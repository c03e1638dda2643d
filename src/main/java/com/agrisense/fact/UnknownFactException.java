package com.agrisense.fact;

/**
 * Thrown when retracting a fact id that is not live.
 */
public class UnknownFactException extends RuntimeException {

    public UnknownFactException(long factId) {
        super("no live fact with id: " + factId);
    }
}
