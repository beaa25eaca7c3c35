package org.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * An immutable example: attribute id -> raw attribute value.
 * The insertion order of the source map is preserved (useful for printing).
 */
public final class Example<A> {

    private final Map<A, Object> values;

    /**
     * @param values raw attribute values (non-null, no null keys or values)
     */
    public Example(Map<A, ?> values) {
        Objects.requireNonNull(values, "values must not be null");

        Map<A, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<A, ?> e : values.entrySet()) {
            if (e.getKey() == null) {
                throw new IllegalArgumentException("attribute id must not be null");
            }
            if (e.getValue() == null) {
                throw new IllegalArgumentException("value of attribute '" + e.getKey() + "' must not be null");
            }
            copy.put(e.getKey(), e.getValue());
        }
        this.values = Collections.unmodifiableMap(copy);
    }

    public static <A> Example<A> of(Map<A, ?> values) {
        return new Example<>(values);
    }

    /** Attribute ids present in this example, in source order. */
    public Set<A> attributes() {
        return values.keySet();
    }

    public boolean has(A attribute) {
        Objects.requireNonNull(attribute, "attribute must not be null");
        return values.containsKey(attribute);
    }

    /**
     * Returns the raw value if present.
     */
    public Optional<Object> get(A attribute) {
        Objects.requireNonNull(attribute, "attribute must not be null");
        return Optional.ofNullable(values.get(attribute));
    }

    /**
     * Returns the raw value or throws if missing.
     */
    public Object require(A attribute) {
        return get(attribute).orElseThrow(() ->
                new IllegalArgumentException("Missing attribute: " + attribute)
        );
    }

    /** Unmodifiable view, for printing and serialization. */
    public Map<A, Object> asMap() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Example<?> other)) return false;
        return values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
