package com.agrisense.rule;

/**
 * A single attribute test within a condition, e.g. {@code ph lt 6.0} or
 * {@code crop eq ?crop}.
 */
public record Constraint(String attribute, Operator operator, Term term) {

    @Override
    public String toString() {
        return attribute + " " + operator.getValue() + " " + term;
    }
}
