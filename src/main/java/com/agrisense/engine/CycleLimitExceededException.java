package com.agrisense.engine;

import java.util.List;

/**
 * Thrown when a session keeps producing activations past the configured cycle
 * ceiling, which usually means rules retract and re-assert each other's facts.
 */
public class CycleLimitExceededException extends RuntimeException {

    private final String sessionId;
    private final int maxCycles;
    private final List<FiringRecord> recentFirings;

    public CycleLimitExceededException(String sessionId, int maxCycles, List<FiringRecord> recentFirings) {
        super("session " + sessionId + " exceeded " + maxCycles + " cycles; last rules fired: "
            + recentFirings.stream().map(FiringRecord::rule).toList());
        this.sessionId = sessionId;
        this.maxCycles = maxCycles;
        this.recentFirings = List.copyOf(recentFirings);
    }

    public String getSessionId() {
        return sessionId;
    }

    public int getMaxCycles() {
        return maxCycles;
    }

    public List<FiringRecord> getRecentFirings() {
        return recentFirings;
    }
}
