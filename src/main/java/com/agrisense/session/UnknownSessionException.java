package com.agrisense.session;

/**
 * Thrown when a session id was never issued or the session has ended.
 */
public class UnknownSessionException extends RuntimeException {

    public UnknownSessionException(String sessionId) {
        super("no active session: " + sessionId);
    }
}
