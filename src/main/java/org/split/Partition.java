package org.split;

import org.model.Sample;

import java.util.Objects;

/**
 * The two sides of a split: examples whose test was true, and the rest.
 */
public record Partition<A, L>(Sample<A, L> trueSubset, Sample<A, L> falseSubset) {

    public Partition {
        Objects.requireNonNull(trueSubset, "trueSubset must not be null");
        Objects.requireNonNull(falseSubset, "falseSubset must not be null");
    }

    public int size() {
        return trueSubset.size() + falseSubset.size();
    }

    /** @return true if one side received every example */
    public boolean isDegenerate() {
        return trueSubset.isEmpty() || falseSubset.isEmpty();
    }
}
