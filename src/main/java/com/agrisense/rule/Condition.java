package com.agrisense.rule;

import java.util.List;

/**
 * A pattern over facts of one kind. A negated condition holds when no live fact
 * satisfies it; its alias is always {@code null}.
 */
public record Condition(String kind, String alias, boolean negated, List<Constraint> constraints) {

    public Condition {
        constraints = List.copyOf(constraints);
    }

    @Override
    public String toString() {
        return (negated ? "not " : "") + kind + constraints + (alias != null ? " as " + alias : "");
    }
}
