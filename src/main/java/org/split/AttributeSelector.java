package org.split;

import org.metrics.InformationMetrics;
import org.model.EmptySampleException;
import org.model.Sample;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Picks the attribute whose test yields the highest information gain.
 *
 * Candidates are a caller-ordered list, not a set: when several attributes reach the
 * same maximal gain the first one in that order wins, so a stable order gives reproducible trees.
 */
public final class AttributeSelector {

    private AttributeSelector() {
    }

    /**
     * Gain of every candidate, in the order given.
     *
     * @throws EmptySampleException if the sample is empty
     */
    public static <A, L> List<AttributeGain<A>> rankAttributes(Sample<A, L> sample,
                                                               List<A> attributes,
                                                               TestGenerator<A> generator,
                                                               L truthLabel) {
        EmptySampleException.requireNonEmpty(sample, "rankAttributes");
        Objects.requireNonNull(attributes, "attributes must not be null");
        Objects.requireNonNull(generator, "generator must not be null");
        Objects.requireNonNull(truthLabel, "truthLabel must not be null");

        List<AttributeGain<A>> out = new ArrayList<>(attributes.size());
        for (A attribute : attributes) {
            Objects.requireNonNull(attribute, "attributes must not contain null");
            AttributeTest<A> test = Objects.requireNonNull(
                    generator.forAttribute(attribute),
                    "generator returned null test for attribute: " + attribute
            );
            out.add(new AttributeGain<>(attribute, InformationMetrics.gain(sample, test, truthLabel)));
        }
        return out;
    }

    /**
     * @return the attribute with maximal gain, the earliest one on ties
     * @throws NoAttributesException if {@code attributes} is empty
     * @throws EmptySampleException if the sample is empty
     */
    public static <A, L> A pickBestAttribute(Sample<A, L> sample,
                                             List<A> attributes,
                                             TestGenerator<A> generator,
                                             L truthLabel) {
        return pickBest(sample, attributes, generator, truthLabel).attribute();
    }

    /**
     * Same as {@link #pickBestAttribute} but also reports the winning gain.
     */
    public static <A, L> AttributeGain<A> pickBest(Sample<A, L> sample,
                                                   List<A> attributes,
                                                   TestGenerator<A> generator,
                                                   L truthLabel) {
        Objects.requireNonNull(attributes, "attributes must not be null");
        if (attributes.isEmpty()) {
            throw new NoAttributesException();
        }

        AttributeGain<A> best = null;
        for (AttributeGain<A> candidate : rankAttributes(sample, attributes, generator, truthLabel)) {
            // strictly greater: an equal gain later in the list never replaces the current best
            if (best == null || candidate.gain() > best.gain()) {
                best = candidate;
            }
        }
        return best;
    }
}
