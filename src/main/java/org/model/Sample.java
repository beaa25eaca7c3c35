package org.model;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * An immutable, ordered sequence of labeled examples.
 *
 * An empty sample is allowed only as one side of a partition; the algorithms
 * reject it before doing any arithmetic.
 */
public final class Sample<A, L> implements Iterable<LabeledExample<A, L>> {

    private final List<LabeledExample<A, L>> examples;

    public Sample(List<LabeledExample<A, L>> examples) {
        Objects.requireNonNull(examples, "examples must not be null");
        // List.copyOf rejects null elements and is already unmodifiable
        this.examples = List.copyOf(examples);
    }

    public static <A, L> Sample<A, L> of(List<LabeledExample<A, L>> examples) {
        return new Sample<>(examples);
    }

    @SafeVarargs
    public static <A, L> Sample<A, L> of(LabeledExample<A, L>... examples) {
        return new Sample<>(List.of(examples));
    }

    public static <A, L> Sample<A, L> empty() {
        return new Sample<>(List.of());
    }

    public int size() {
        return examples.size();
    }

    public boolean isEmpty() {
        return examples.isEmpty();
    }

    public LabeledExample<A, L> get(int index) {
        if (index < 0 || index >= examples.size()) {
            throw new IndexOutOfBoundsException("index=" + index + ", size=" + examples.size());
        }
        return examples.get(index);
    }

    /**
     * @throws IllegalStateException if the sample is empty
     */
    public LabeledExample<A, L> first() {
        if (examples.isEmpty()) {
            throw new IllegalStateException("Sample is empty");
        }
        return examples.get(0);
    }

    public List<LabeledExample<A, L>> examples() {
        return examples;
    }

    public Stream<LabeledExample<A, L>> stream() {
        return examples.stream();
    }

    @Override
    public Iterator<LabeledExample<A, L>> iterator() {
        return examples.iterator();
    }

    /**
     * Builder used by the partitioner to accumulate a subset in encounter order.
     */
    public static final class Builder<A, L> {
        private final List<LabeledExample<A, L>> examples = new ArrayList<>();

        public Builder<A, L> add(LabeledExample<A, L> example) {
            examples.add(Objects.requireNonNull(example, "example must not be null"));
            return this;
        }

        public Sample<A, L> build() {
            return new Sample<>(examples);
        }
    }

    public static <A, L> Builder<A, L> builder() {
        return new Builder<>();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Sample<?, ?> other)) return false;
        return examples.equals(other.examples);
    }

    @Override
    public int hashCode() {
        return examples.hashCode();
    }

    @Override
    public String toString() {
        return "Sample(size=" + examples.size() + ")";
    }
}
