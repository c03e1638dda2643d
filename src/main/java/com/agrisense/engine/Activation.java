package com.agrisense.engine;

import com.agrisense.fact.Fact;
import com.agrisense.rule.Rule;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A rule together with one variable binding that satisfies all of its
 * conditions. {@code facts} holds the facts matched by the positive conditions,
 * in condition order.
 */
public record Activation(
    Rule rule,
    Map<String, Object> bindings,
    List<Fact> facts,
    Map<String, Fact> aliasedFacts
) {

    public Activation {
        bindings = Collections.unmodifiableMap(new LinkedHashMap<>(bindings));
        facts = List.copyOf(facts);
        aliasedFacts = Collections.unmodifiableMap(new LinkedHashMap<>(aliasedFacts));
    }

    public List<Long> factIds() {
        return facts.stream().map(Fact::id).toList();
    }

    /** Id of the most recently asserted matched fact, or 0 if none was matched. */
    public long newestFactId() {
        return facts.stream().mapToLong(Fact::id).max().orElse(0L);
    }

    public Key key() {
        return new Key(rule.name(), factIds());
    }

    /**
     * Refraction identity: a rule fires at most once for a given combination
     * of matched fact ids.
     */
    public record Key(String ruleName, List<Long> factIds) {}
}
