package org.metrics;

import org.model.EmptySampleException;
import org.model.Sample;
import org.split.AttributePartitioner;
import org.split.AttributeTest;
import org.split.Partition;

import java.util.Objects;

/**
 * Shannon entropy and information gain for binary-labelled samples, in bits.
 */
public final class InformationMetrics {

    private static final double LN_2 = Math.log(2.0);

    private InformationMetrics() {
    }

    /**
     * Binary entropy of a two-class distribution.
     * Returns exactly 0 when either count is 0.
     *
     * @param positive number of examples labelled with the truth label
     * @param negative number of the other examples
     * @throws IllegalArgumentException if a count is negative
     */
    public static double info(int positive, int negative) {
        if (positive < 0 || negative < 0) {
            throw new IllegalArgumentException(
                    "counts must be non-negative: positive=" + positive + ", negative=" + negative
            );
        }
        if (positive == 0 || negative == 0) {
            return 0.0;
        }
        double total = (double) positive + negative;
        double p = positive / total;
        double n = negative / total;
        return -p * log2(p) - n * log2(n);
    }

    public static double info(LabelCount count) {
        Objects.requireNonNull(count, "count must not be null");
        return info(count.positive(), count.negative());
    }

    /**
     * Size-weighted entropy of the two sides produced by {@code test}.
     *
     * @throws EmptySampleException if the sample is empty
     */
    public static <A, L> double entropy(Sample<A, L> sample, AttributeTest<A> test, L truthLabel) {
        EmptySampleException.requireNonEmpty(sample, "entropy");
        Objects.requireNonNull(test, "test must not be null");
        Objects.requireNonNull(truthLabel, "truthLabel must not be null");

        Partition<A, L> split = AttributePartitioner.partition(sample, test);
        LabelCount onTrue = LabelCounter.countByLabel(split.trueSubset(), truthLabel);
        LabelCount onFalse = LabelCounter.countByLabel(split.falseSubset(), truthLabel);

        double total = sample.size();
        double trueRatio = onTrue.total() / total;
        double falseRatio = onFalse.total() / total;
        return trueRatio * info(onTrue) + falseRatio * info(onFalse);
    }

    /**
     * Reduction in entropy achieved by splitting with {@code test}.
     * Never meaningfully negative; rounding may leave a tiny negative residue.
     *
     * @throws EmptySampleException if the sample is empty
     */
    public static <A, L> double gain(Sample<A, L> sample, AttributeTest<A> test, L truthLabel) {
        EmptySampleException.requireNonEmpty(sample, "gain");
        Objects.requireNonNull(truthLabel, "truthLabel must not be null");

        LabelCount before = LabelCounter.countByLabel(sample, truthLabel);
        return info(before) - entropy(sample, test, truthLabel);
    }

    private static double log2(double x) {
        return Math.log(x) / LN_2;
    }
}
