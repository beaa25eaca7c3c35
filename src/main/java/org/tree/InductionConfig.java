package org.tree;

/**
 * Settings for {@link DecisionTreeBuilder}.
 *
 * @param maxDepth        deepest node level the builder may create (root is level 1)
 * @param reuseAttributes whether a descendant may split again on an attribute already used above it
 */
public record InductionConfig(int maxDepth, boolean reuseAttributes) {

    public static final int DEFAULT_MAX_DEPTH = 256;

    public InductionConfig {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be >= 1");
        }
    }

    /** Re-use allowed, depth capped at {@value #DEFAULT_MAX_DEPTH}. */
    public static InductionConfig defaults() {
        return new InductionConfig(DEFAULT_MAX_DEPTH, true);
    }

    public InductionConfig withMaxDepth(int maxDepth) {
        return new InductionConfig(maxDepth, reuseAttributes);
    }

    public InductionConfig withReuseAttributes(boolean reuseAttributes) {
        return new InductionConfig(maxDepth, reuseAttributes);
    }
}
