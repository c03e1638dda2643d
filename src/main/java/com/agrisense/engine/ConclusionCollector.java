package com.agrisense.engine;

import com.agrisense.fact.FactStore;
import com.agrisense.rule.RuleLibrary;

import java.util.List;

/**
 * Extracts the live output-kind facts of a store, in assertion order.
 * Duplicates cannot occur since the store rejects them on assertion.
 */
public class ConclusionCollector {

    private final RuleLibrary library;

    public ConclusionCollector(RuleLibrary library) {
        this.library = library;
    }

    public List<Conclusion> collect(FactStore store) {
        return store.facts().stream()
            .filter(fact -> library.isOutputKind(fact.kind()))
            .map(Conclusion::of)
            .toList();
    }
}
