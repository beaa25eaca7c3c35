package org.tree;

import org.model.DecisionTreeException;

/**
 * Thrown when induction cannot reach pure partitions: the depth limit was hit,
 * a split made no progress, or the candidate attributes ran out.
 */
public final class TreeDidNotConvergeException extends DecisionTreeException {

    private final int depth;
    private final int sampleSize;

    public TreeDidNotConvergeException(String reason, int depth, int sampleSize) {
        super("Tree did not converge at depth " + depth + " (" + sampleSize + " examples): " + reason);
        this.depth = depth;
        this.sampleSize = sampleSize;
    }

    public int depth() {
        return depth;
    }

    public int sampleSize() {
        return sampleSize;
    }
}
