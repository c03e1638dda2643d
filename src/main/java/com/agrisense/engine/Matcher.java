package com.agrisense.engine;

import com.agrisense.fact.Fact;
import com.agrisense.fact.FactStore;
import com.agrisense.rule.Condition;
import com.agrisense.rule.Constraint;
import com.agrisense.rule.Operator;
import com.agrisense.rule.Rule;
import com.agrisense.rule.RuleLibrary;
import com.agrisense.rule.Term;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Finds every activation of every rule against a fact store.
 *
 * Each rule's conditions are joined left to right by backtracking: a positive
 * condition is tried against every live fact of its kind, extending the
 * bindings accumulated so far; a negated condition only checks that no fact
 * unifies under those bindings.
 *
 * With incremental matching enabled, a rule's activations are cached together
 * with the versions of the fact kinds it reads, and recomputed only once one
 * of those kinds has changed. One matcher belongs to one session.
 */
public class Matcher {

    private final RuleLibrary library;
    private final boolean incremental;
    private final Map<String, CachedMatch> cache = new HashMap<>();

    public Matcher(RuleLibrary library, boolean incremental) {
        this.library = library;
        this.incremental = incremental;
    }

    public List<Activation> match(FactStore store) {
        List<Activation> activations = new ArrayList<>();
        for (Rule rule : library.rules()) {
            activations.addAll(match(rule, store));
        }
        return activations;
    }

    List<Activation> match(Rule rule, FactStore store) {
        if (!incremental) {
            return compute(rule, store);
        }
        long[] versions = kindVersions(rule, store);
        CachedMatch cached = cache.get(rule.name());
        if (cached != null && Arrays.equals(cached.versions(), versions)) {
            return cached.activations();
        }
        List<Activation> activations = compute(rule, store);
        cache.put(rule.name(), new CachedMatch(versions, activations));
        return activations;
    }

    private long[] kindVersions(Rule rule, FactStore store) {
        Set<String> kinds = rule.kinds();
        long[] versions = new long[kinds.size()];
        int i = 0;
        for (String kind : kinds) {
            versions[i++] = store.kindVersion(kind);
        }
        return versions;
    }

    private List<Activation> compute(Rule rule, FactStore store) {
        List<Activation> out = new ArrayList<>();
        extend(rule, 0, Map.of(), List.of(), Map.of(), store, out);
        return List.copyOf(out);
    }

    private void extend(Rule rule, int index, Map<String, Object> bindings, List<Fact> facts,
                        Map<String, Fact> aliased, FactStore store, List<Activation> out) {
        if (index == rule.conditions().size()) {
            out.add(new Activation(rule, bindings, facts, aliased));
            return;
        }

        Condition condition = rule.conditions().get(index);
        if (condition.negated()) {
            boolean blocked = store.query(condition.kind())
                .anyMatch(fact -> unify(condition, fact, bindings) != null);
            if (!blocked) {
                extend(rule, index + 1, bindings, facts, aliased, store, out);
            }
            return;
        }

        for (Fact fact : store.query(condition.kind()).toList()) {
            Map<String, Object> next = unify(condition, fact, bindings);
            if (next == null) {
                continue;
            }
            List<Fact> nextFacts = new ArrayList<>(facts);
            nextFacts.add(fact);
            Map<String, Fact> nextAliased = aliased;
            if (condition.alias() != null) {
                nextAliased = new LinkedHashMap<>(aliased);
                nextAliased.put(condition.alias(), fact);
            }
            extend(rule, index + 1, next, nextFacts, nextAliased, store, out);
        }
    }

    /**
     * Unifies a condition with a fact.
     *
     * @return the extended bindings, or {@code null} if the fact does not match
     */
    static Map<String, Object> unify(Condition condition, Fact fact, Map<String, Object> bindings) {
        if (!condition.kind().equals(fact.kind())) {
            return null;
        }
        Map<String, Object> result = bindings;
        boolean copied = false;
        for (Constraint constraint : condition.constraints()) {
            if (!fact.hasAttribute(constraint.attribute())) {
                return null;
            }
            Object actual = fact.attribute(constraint.attribute());
            if (constraint.term() instanceof Term.Variable variable
                    && constraint.operator() == Operator.EQ
                    && !result.containsKey(variable.name())) {
                if (!copied) {
                    result = new HashMap<>(result);
                    copied = true;
                }
                result.put(variable.name(), actual);
                continue;
            }
            if (!constraint.operator().test(actual, constraint.term().resolve(result))) {
                return null;
            }
        }
        return result;
    }

    private record CachedMatch(long[] versions, List<Activation> activations) {}
}
