package org.split;

import java.util.Map;
import java.util.Objects;

/**
 * Ready-made test generators for the common raw value shapes.
 */
public final class AttributeTests {

    private AttributeTests() {
    }

    /**
     * Truthiness of the raw value: Boolean.TRUE, a non-zero number or a non-empty string.
     * A missing attribute tests false.
     */
    public static <A> TestGenerator<A> truthy() {
        return attribute -> {
            Objects.requireNonNull(attribute, "attribute must not be null");
            return example -> example.get(attribute).map(AttributeTests::isTruthy).orElse(false);
        };
    }

    /**
     * Numeric threshold per attribute: the test is {@code value >= threshold}.
     *
     * @param thresholds threshold for every attribute that may be asked for
     */
    public static <A> TestGenerator<A> atLeast(Map<A, Double> thresholds) {
        Objects.requireNonNull(thresholds, "thresholds must not be null");
        Map<A, Double> copy = Map.copyOf(thresholds);

        return attribute -> {
            Double threshold = copy.get(attribute);
            if (threshold == null) {
                throw new IllegalArgumentException("No threshold configured for attribute: " + attribute);
            }
            return example -> {
                Object raw = example.require(attribute);
                if (!(raw instanceof Number n)) {
                    throw new IllegalArgumentException(
                            "Attribute '" + attribute + "' is not numeric: " + raw
                    );
                }
                return n.doubleValue() >= threshold;
            };
        };
    }

    static boolean isTruthy(Object raw) {
        if (raw instanceof Boolean b) return b;
        if (raw instanceof Number n) return n.doubleValue() != 0.0;
        if (raw instanceof CharSequence s) return s.length() > 0;
        return true;
    }
}
