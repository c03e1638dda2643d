package com.agrisense.rule;

import com.agrisense.fact.FactValues;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.List;

public enum Operator {
    EQ("eq"),
    NE("ne"),
    LT("lt"),
    LE("le"),
    GT("gt"),
    GE("ge"),
    IN("in");

    private final String value;

    Operator(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isOrdering() {
        return this == LT || this == LE || this == GT || this == GE;
    }

    /**
     * Evaluates {@code actual <op> expected}. Ordering operators hold only between
     * numbers; {@code in} expects a list on the right-hand side.
     */
    public boolean test(Object actual, Object expected) {
        return switch (this) {
            case EQ -> FactValues.equal(actual, expected);
            case NE -> !FactValues.equal(actual, expected);
            case IN -> expected instanceof List<?> options
                && options.stream().anyMatch(option -> FactValues.equal(actual, option));
            case LT, LE, GT, GE -> {
                if (!(actual instanceof Number a) || !(expected instanceof Number e)) {
                    yield false;
                }
                int cmp = FactValues.compareNumbers(a, e);
                yield switch (this) {
                    case LT -> cmp < 0;
                    case LE -> cmp <= 0;
                    case GT -> cmp > 0;
                    default -> cmp >= 0;
                };
            }
        };
    }

    @JsonCreator
    public static Operator fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown operator: " + raw));
    }
}
