package org.split;

import org.model.LabeledExample;
import org.model.Sample;

import java.util.Objects;

/**
 * Splits a sample in two according to an attribute test.
 */
public final class AttributePartitioner {

    private AttributePartitioner() {
    }

    /**
     * Stable partition: relative order is kept on both sides and every pair lands on exactly one side.
     * The test is evaluated once per example.
     */
    public static <A, L> Partition<A, L> partition(Sample<A, L> sample, AttributeTest<A> test) {
        Objects.requireNonNull(sample, "sample must not be null");
        Objects.requireNonNull(test, "test must not be null");

        Sample.Builder<A, L> trueSide = Sample.builder();
        Sample.Builder<A, L> falseSide = Sample.builder();

        for (LabeledExample<A, L> pair : sample) {
            if (test.test(pair.example())) {
                trueSide.add(pair);
            } else {
                falseSide.add(pair);
            }
        }

        return new Partition<>(trueSide.build(), falseSide.build());
    }
}
