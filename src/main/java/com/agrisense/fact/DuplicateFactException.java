package com.agrisense.fact;

import java.util.Map;

/**
 * Thrown when a fact identical in kind and attributes to a live fact is asserted.
 */
public class DuplicateFactException extends RuntimeException {

    private final long existingFactId;

    public DuplicateFactException(String kind, Map<String, Object> attributes, long existingFactId) {
        super("fact already holds: " + kind + attributes + " (f-" + existingFactId + ")");
        this.existingFactId = existingFactId;
    }

    public long getExistingFactId() {
        return existingFactId;
    }
}
