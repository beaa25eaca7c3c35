package org.metrics;

import org.model.LabeledExample;
import org.model.Sample;

import java.util.Objects;

/**
 * Counts a sample's examples against the truth label.
 *
 * Only two label values are modelled: anything that is not the truth label is
 * counted as negative, so a third label value is silently folded into the negative class.
 */
public final class LabelCounter {

    private LabelCounter() {
    }

    public static <A, L> LabelCount countByLabel(Sample<A, L> sample, L truthLabel) {
        Objects.requireNonNull(sample, "sample must not be null");
        Objects.requireNonNull(truthLabel, "truthLabel must not be null");

        int positive = 0;
        for (LabeledExample<A, L> pair : sample) {
            if (pair.hasLabel(truthLabel)) {
                positive++;
            }
        }
        return new LabelCount(positive, sample.size() - positive);
    }
}
