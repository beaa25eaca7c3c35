package org.model;

/**
 * Thrown when a metric, selector or builder receives a sample with no examples.
 */
public final class EmptySampleException extends DecisionTreeException {

    public EmptySampleException(String operation) {
        super(operation + " requires a non-empty sample");
    }

    /**
     * Fails fast if the sample is empty.
     */
    public static <A, L> Sample<A, L> requireNonEmpty(Sample<A, L> sample, String operation) {
        if (sample == null) {
            throw new IllegalArgumentException("sample must not be null");
        }
        if (sample.isEmpty()) {
            throw new EmptySampleException(operation);
        }
        return sample;
    }
}
