package com.agrisense.rule;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An operation applied to the fact store when a rule fires.
 */
public sealed interface Action {

    record AssertFact(String kind, Map<String, Term> attributes) implements Action {
        public AssertFact {
            attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        }

        public Map<String, Object> resolve(Map<String, Object> bindings) {
            Map<String, Object> values = new LinkedHashMap<>();
            attributes.forEach((name, term) -> values.put(name, term.resolve(bindings)));
            return values;
        }
    }

    /** Retracts the fact matched by the positive condition carrying {@code alias}. */
    record RetractFact(String alias) implements Action {}
}
