package com.agrisense.fact;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Normalization and comparison of scalar attribute values.
 *
 * Integral numbers are stored as {@code Long} and every other number as
 * {@code Double}, so {@code 5}, {@code 5L} and {@code 5.0} denote the same value.
 */
public final class FactValues {

    private FactValues() {
    }

    public static Map<String, Object> normalize(Map<String, ?> attributes) {
        if (attributes == null) {
            return Map.of();
        }
        Map<String, Object> normalized = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : attributes.entrySet()) {
            if (entry.getKey() == null || entry.getKey().isBlank()) {
                throw new IllegalArgumentException("attribute name must not be blank");
            }
            normalized.put(entry.getKey(), normalize(entry.getKey(), entry.getValue()));
        }
        return normalized;
    }

    public static Object normalize(String attribute, Object value) {
        if (value instanceof String || value instanceof Boolean) {
            return value;
        }
        if (value instanceof Number number) {
            return normalizeNumber(number);
        }
        throw new IllegalArgumentException("attribute '" + attribute
            + "' must be a string, boolean or number, got: "
            + (value == null ? "null" : value.getClass().getSimpleName()));
    }

    /**
     * Normalizes a literal that may also be a list of scalars (for {@code in} tests).
     */
    public static Object normalizeLiteral(String attribute, Object value) {
        if (value instanceof List<?> list) {
            return list.stream().map(v -> normalize(attribute, v)).toList();
        }
        return normalize(attribute, value);
    }

    private static Object normalizeNumber(Number number) {
        if (number instanceof Long) {
            return number;
        }
        if (number instanceof Integer || number instanceof Short || number instanceof Byte) {
            return number.longValue();
        }
        double d = number.doubleValue();
        if (Double.isNaN(d) || Double.isInfinite(d)) {
            throw new IllegalArgumentException("numeric attribute values must be finite");
        }
        if (d == Math.rint(d) && Math.abs(d) < 9.0E15) {
            return (long) d;
        }
        return d;
    }

    public static boolean equal(Object left, Object right) {
        if (left instanceof Number l && right instanceof Number r) {
            return compareNumbers(l, r) == 0;
        }
        return left != null && left.equals(right);
    }

    public static int compareNumbers(Number left, Number right) {
        return toBigDecimal(left).compareTo(toBigDecimal(right));
    }

    private static BigDecimal toBigDecimal(Number number) {
        if (number instanceof Long || number instanceof Integer) {
            return BigDecimal.valueOf(number.longValue());
        }
        return BigDecimal.valueOf(number.doubleValue());
    }
}
