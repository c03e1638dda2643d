package com.agrisense.rule;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * An immutable compiled rule. Higher priority fires first.
 */
public record Rule(
    String name,
    int priority,
    String description,
    List<Condition> conditions,
    List<Action> actions
) {

    public Rule {
        conditions = List.copyOf(conditions);
        actions = List.copyOf(actions);
    }

    /** Fact kinds this rule's conditions read, in condition order. */
    public Set<String> kinds() {
        Set<String> kinds = new LinkedHashSet<>();
        for (Condition condition : conditions) {
            kinds.add(condition.kind());
        }
        return kinds;
    }
}
