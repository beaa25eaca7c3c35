package org.split;

import org.model.DecisionTreeException;

/**
 * Thrown when a best attribute is requested from an empty candidate list.
 */
public final class NoAttributesException extends DecisionTreeException {

    public NoAttributesException() {
        super("At least one candidate attribute is required");
    }
}
