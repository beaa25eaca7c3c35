package org.tree;

import org.metrics.InformationMetrics;
import org.metrics.LabelCount;
import org.metrics.LabelCounter;
import org.model.EmptySampleException;
import org.model.Sample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.split.AttributeGain;
import org.split.AttributePartitioner;
import org.split.AttributeSelector;
import org.split.AttributeTest;
import org.split.NoAttributesException;
import org.split.Partition;
import org.split.TestGenerator;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Greedy top-down (ID3) induction of a binary decision tree.
 *
 * At every node the attribute with the highest information gain is chosen, the sample
 * is split by its test, and each side either becomes a leaf (zero entropy) or is split again.
 * There is no backtracking and no pruning.
 */
public final class DecisionTreeBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(DecisionTreeBuilder.class);

    private final InductionConfig config;

    public DecisionTreeBuilder() {
        this(InductionConfig.defaults());
    }

    public DecisionTreeBuilder(InductionConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    public InductionConfig config() {
        return config;
    }

    /**
     * Builds a tree with the default configuration.
     */
    public static <A, L> Node<A> buildTree(Sample<A, L> sample,
                                           List<A> attributes,
                                           TestGenerator<A> generator,
                                           L truthLabel) {
        return new DecisionTreeBuilder().build(sample, attributes, generator, truthLabel);
    }

    /**
     * Builds a tree whose leaves classify every training example by whether it carries {@code truthLabel}.
     *
     * @param sample     training pairs (non-empty)
     * @param attributes candidate attributes; order decides ties
     * @param generator  turns an attribute into its binary test
     * @param truthLabel the positive label
     * @throws EmptySampleException        if the sample is empty
     * @throws NoAttributesException       if there are no candidate attributes
     * @throws TreeDidNotConvergeException if some partition can never be made pure
     */
    public <A, L> Node<A> build(Sample<A, L> sample,
                                List<A> attributes,
                                TestGenerator<A> generator,
                                L truthLabel) {
        EmptySampleException.requireNonEmpty(sample, "buildTree");
        Objects.requireNonNull(attributes, "attributes must not be null");
        Objects.requireNonNull(generator, "generator must not be null");
        Objects.requireNonNull(truthLabel, "truthLabel must not be null");
        if (attributes.isEmpty()) {
            throw new NoAttributesException();
        }

        Node<A> root = grow(sample, List.copyOf(attributes), generator, truthLabel, 1);
        LOG.debug("Built tree: depth={}, leaves={}, trainingExamples={}",
                root.depth(), root.leafCount(), sample.size());
        return root;
    }

    private <A, L> Node<A> grow(Sample<A, L> sample,
                                List<A> attributes,
                                TestGenerator<A> generator,
                                L truthLabel,
                                int depth) {
        if (depth > config.maxDepth()) {
            throw new TreeDidNotConvergeException(
                    "maximum depth " + config.maxDepth() + " exceeded", depth, sample.size()
            );
        }

        AttributeGain<A> best = AttributeSelector.pickBest(sample, attributes, generator, truthLabel);
        AttributeTest<A> test = generator.forAttribute(best.attribute());
        Partition<A, L> split = AttributePartitioner.partition(sample, test);

        LOG.debug("Depth {}: split {} examples on '{}' (gain={}) -> {} true / {} false",
                depth, sample.size(), best.attribute(), best.gain(),
                split.trueSubset().size(), split.falseSubset().size());

        List<A> remaining = config.reuseAttributes() ? attributes : without(attributes, best.attribute());

        Child<A> trueChild = side(split.trueSubset(), sample, test, remaining, generator, truthLabel, depth);
        Child<A> falseChild = side(split.falseSubset(), sample, test, remaining, generator, truthLabel, depth);

        return new Node<>(best.attribute(), test, trueChild, falseChild);
    }

    private <A, L> Child<A> side(Sample<A, L> subset,
                                 Sample<A, L> parent,
                                 AttributeTest<A> test,
                                 List<A> remaining,
                                 TestGenerator<A> generator,
                                 L truthLabel,
                                 int depth) {
        if (subset.isEmpty()) {
            // nothing reaches this side during training; fall back to the parent's majority
            return Child.leaf(plurality(parent, truthLabel));
        }

        if (InformationMetrics.entropy(subset, test, truthLabel) == 0.0) {
            // pure: every example agrees, so the first one speaks for all
            return Child.leaf(subset.first().hasLabel(truthLabel));
        }

        if (config.reuseAttributes() && subset.size() == parent.size()) {
            throw new TreeDidNotConvergeException(
                    "no candidate attribute separates the remaining examples", depth, subset.size()
            );
        }
        if (remaining.isEmpty()) {
            throw new TreeDidNotConvergeException(
                    "candidate attributes exhausted on an impure partition", depth, subset.size()
            );
        }

        return Child.branch(grow(subset, remaining, generator, truthLabel, depth + 1));
    }

    private static <A, L> boolean plurality(Sample<A, L> sample, L truthLabel) {
        LabelCount count = LabelCounter.countByLabel(sample, truthLabel);
        return count.positive() > count.negative();
    }

    private static <A> List<A> without(List<A> attributes, A used) {
        List<A> out = new ArrayList<>(attributes);
        out.remove(used);
        return List.copyOf(out);
    }
}
