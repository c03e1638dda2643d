package com.agrisense.rule;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable, ordered collection of compiled rules plus the set of fact kinds
 * that count as conclusions. Safe to share between concurrent sessions.
 */
public final class RuleLibrary {

    private final List<Rule> rules;
    private final Map<String, Rule> rulesByName;
    private final Set<String> outputKinds;

    RuleLibrary(List<Rule> rules, Set<String> outputKinds) {
        this.rules = List.copyOf(rules);
        Map<String, Rule> byName = new LinkedHashMap<>();
        for (Rule rule : rules) {
            byName.put(rule.name(), rule);
        }
        this.rulesByName = Collections.unmodifiableMap(byName);
        this.outputKinds = Collections.unmodifiableSet(new LinkedHashSet<>(outputKinds));
    }

    /**
     * Compiles and validates a library document.
     *
     * @throws RuleLibraryException if any definition is malformed
     */
    public static RuleLibrary of(RuleLibraryDocument document) {
        return new RuleCompiler().compile(document);
    }

    public List<Rule> rules() {
        return rules;
    }

    public Optional<Rule> rule(String name) {
        return Optional.ofNullable(rulesByName.get(name));
    }

    public Set<String> outputKinds() {
        return outputKinds;
    }

    public boolean isOutputKind(String kind) {
        return outputKinds.contains(kind);
    }

    public int size() {
        return rules.size();
    }
}
