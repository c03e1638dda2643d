package com.agrisense.engine;

import java.util.Comparator;
import java.util.List;

/**
 * Orderings used to pick the next activation to fire. Both put higher priority
 * first and fall back to rule name, then to matched fact ids, so the order is
 * total.
 */
public enum ResolutionStrategy {

    /** Among equal priorities, prefer the activation whose newest fact is oldest. */
    EARLIEST_FACT(Comparator.comparingLong(Activation::newestFactId)),

    /** Among equal priorities, prefer the activation whose newest fact is newest. */
    DEPTH(Comparator.comparingLong(Activation::newestFactId).reversed());

    private final Comparator<Activation> order;

    ResolutionStrategy(Comparator<Activation> recency) {
        this.order = Comparator.comparingInt((Activation a) -> a.rule().priority()).reversed()
            .thenComparing(recency)
            .thenComparing(a -> a.rule().name())
            .thenComparing(Activation::factIds, FactIdOrder.ELEMENT_WISE);
    }

    public Comparator<Activation> order() {
        return order;
    }

    private static final class FactIdOrder {

        static final Comparator<List<Long>> ELEMENT_WISE = (left, right) -> {
            for (int i = 0; i < Math.min(left.size(), right.size()); i++) {
                int cmp = Long.compare(left.get(i), right.get(i));
                if (cmp != 0) {
                    return cmp;
                }
            }
            return Integer.compare(left.size(), right.size());
        };
    }
}
