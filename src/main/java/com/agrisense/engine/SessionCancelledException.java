package com.agrisense.engine;

public class SessionCancelledException extends RuntimeException {

    public SessionCancelledException(String sessionId) {
        super("session was cancelled: " + sessionId);
    }
}
