package com.agrisense.rule;

/**
 * Raised while loading a rule library that is unreadable, malformed or
 * contradictory. No partially loaded library is ever exposed.
 */
public class RuleLibraryException extends RuntimeException {

    public RuleLibraryException(String message) {
        super(message);
    }

    public RuleLibraryException(String message, Throwable cause) {
        super(message, cause);
    }
}
