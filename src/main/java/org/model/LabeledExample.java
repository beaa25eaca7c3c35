package org.model;

import java.util.Map;
import java.util.Objects;

/**
 * One training pair: an example together with its label.
 */
public record LabeledExample<A, L>(Example<A> example, L label) {

    public LabeledExample {
        Objects.requireNonNull(example, "example must not be null");
        Objects.requireNonNull(label, "label must not be null");
    }

    public static <A, L> LabeledExample<A, L> of(Map<A, ?> values, L label) {
        return new LabeledExample<>(Example.of(values), label);
    }

    public boolean hasLabel(L truthLabel) {
        return label.equals(truthLabel);
    }
}
