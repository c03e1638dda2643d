package com.agrisense.rule;

import com.agrisense.fact.FactValues;

import java.util.Map;

/**
 * Right-hand side of a constraint or an asserted attribute value: either a
 * literal or a {@code ?variable} reference.
 */
public sealed interface Term {

    String VARIABLE_PREFIX = "?";

    /**
     * Resolves the term against a binding set. Variables must be bound.
     */
    Object resolve(Map<String, Object> bindings);

    record Literal(Object value) implements Term {
        @Override
        public Object resolve(Map<String, Object> bindings) {
            return value;
        }

        @Override
        public String toString() {
            return String.valueOf(value);
        }
    }

    record Variable(String name) implements Term {
        @Override
        public Object resolve(Map<String, Object> bindings) {
            Object value = bindings.get(name);
            if (value == null) {
                throw new IllegalStateException("variable ?" + name + " is not bound");
            }
            return value;
        }

        @Override
        public String toString() {
            return VARIABLE_PREFIX + name;
        }
    }

    static Term parse(String attribute, Object raw) {
        if (raw instanceof String text && text.startsWith(VARIABLE_PREFIX)) {
            return new Variable(text.substring(VARIABLE_PREFIX.length()));
        }
        return new Literal(FactValues.normalizeLiteral(attribute, raw));
    }
}
