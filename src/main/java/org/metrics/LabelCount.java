package org.metrics;

/**
 * Counts of examples matching (positive) and not matching (negative) the truth label.
 */
public record LabelCount(int positive, int negative) {

    public LabelCount {
        if (positive < 0 || negative < 0) {
            throw new IllegalArgumentException(
                    "counts must be non-negative: positive=" + positive + ", negative=" + negative
            );
        }
    }

    public int total() {
        return positive + negative;
    }

    /** @return true if every counted example falls in the same class */
    public boolean isPure() {
        return positive == 0 || negative == 0;
    }
}
