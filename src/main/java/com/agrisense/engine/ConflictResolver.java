package com.agrisense.engine;

import java.util.Collection;
import java.util.Optional;

/**
 * Selects exactly one activation out of the eligible set.
 */
public class ConflictResolver {

    private final ResolutionStrategy strategy;

    public ConflictResolver(ResolutionStrategy strategy) {
        this.strategy = strategy;
    }

    public Optional<Activation> select(Collection<Activation> candidates) {
        return candidates.stream().min(strategy.order());
    }
}
