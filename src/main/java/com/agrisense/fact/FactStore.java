package com.agrisense.fact;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * Working memory of a single session.
 */
public interface FactStore {

    /**
     * Asserts a new fact.
     *
     * @return the id assigned to the fact
     * @throws DuplicateFactException if an identical (kind, attributes) fact is live
     */
    long assertFact(String kind, Map<String, ?> attributes);

    /**
     * Removes a live fact.
     *
     * @throws UnknownFactException if no live fact has the id
     */
    Fact retract(long factId);

    /**
     * Live facts of a kind matching the predicate, in assertion order. The stream
     * iterates a snapshot taken at call time and may be requested again.
     */
    Stream<Fact> query(String kind, Predicate<Fact> predicate);

    default Stream<Fact> query(String kind) {
        return query(kind, f -> true);
    }

    Optional<Fact> get(long factId);

    /** All live facts in assertion order. */
    List<Fact> facts();

    int size();

    /**
     * Counter bumped on every assert or retract of the given kind. Used by the
     * matcher to detect which cached join results are stale.
     */
    long kindVersion(String kind);
}
