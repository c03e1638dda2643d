package com.agrisense.engine;

import com.agrisense.fact.FactStore;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Working state of one advisory session: its fact store, its matcher cache, the
 * activations that already fired and the firing log.
 *
 * A session is confined to one thread at a time; callers that share it must
 * serialize access. Only {@link #cancel()} may be called concurrently.
 */
public class Session {

    private final String id;
    private final FactStore store;
    private final Matcher matcher;
    private final Set<Activation.Key> fired = new HashSet<>();
    private final List<FiringRecord> firingLog = new ArrayList<>();
    private volatile EngineState state = EngineState.IDLE;
    private volatile boolean cancelled;

    Session(String id, FactStore store, Matcher matcher) {
        this.id = id;
        this.store = store;
        this.matcher = matcher;
    }

    public String id() {
        return id;
    }

    public FactStore store() {
        return store;
    }

    public EngineState state() {
        return state;
    }

    /**
     * Asserts an initial observation. Allowed before a run and between runs.
     */
    public long assertObservation(String kind, Map<String, ?> attributes) {
        requireUsable();
        long factId = store.assertFact(kind, attributes);
        state = EngineState.IDLE;
        return factId;
    }

    /** Requests cancellation; honoured before the next match cycle. */
    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public List<FiringRecord> firingLog() {
        return List.copyOf(firingLog);
    }

    void requireUsable() {
        if (state.isTerminalFailure()) {
            throw new IllegalStateException("session " + id + " has terminated with " + state);
        }
        if (state == EngineState.MATCHING || state == EngineState.FIRING) {
            throw new IllegalStateException("session " + id + " is running");
        }
    }

    Matcher matcher() {
        return matcher;
    }

    void transition(EngineState next) {
        state = next;
    }

    boolean hasFired(Activation activation) {
        return fired.contains(activation.key());
    }

    void markFired(Activation activation) {
        fired.add(activation.key());
    }

    void record(FiringRecord record) {
        firingLog.add(record);
    }
}
