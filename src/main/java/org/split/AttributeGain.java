package org.split;

/**
 * Information gain obtained by splitting on one attribute.
 */
public record AttributeGain<A>(A attribute, double gain) {
}
