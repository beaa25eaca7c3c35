package org.split;

/**
 * Strategy that turns an attribute id into the binary test used to split on it.
 */
@FunctionalInterface
public interface TestGenerator<A> {

    /**
     * @param attribute candidate attribute id (non-null)
     * @return the test for this attribute (never null)
     */
    AttributeTest<A> forAttribute(A attribute);
}
