package org.model;

/**
 * Base type for every failure raised by the induction pipeline.
 * All of them are precondition violations reported to the caller; none is retried.
 */
public abstract class DecisionTreeException extends RuntimeException {

    protected DecisionTreeException(String message) {
        super(message);
    }
}
