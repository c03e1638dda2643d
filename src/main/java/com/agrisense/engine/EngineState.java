package com.agrisense.engine;

public enum EngineState {
    IDLE,
    MATCHING,
    FIRING,
    QUIESCENT,
    CYCLE_LIMIT_EXCEEDED,
    CANCELLED;

    public boolean isTerminalFailure() {
        return this == CYCLE_LIMIT_EXCEEDED || this == CANCELLED;
    }
}
