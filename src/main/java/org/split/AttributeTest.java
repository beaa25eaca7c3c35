package org.split;

import org.model.Example;

/**
 * A boolean test over an example. The algorithms treat it as an opaque predicate;
 * how raw values become true/false is up to the {@link TestGenerator} that made it.
 */
@FunctionalInterface
public interface AttributeTest<A> {

    boolean test(Example<A> example);

    default AttributeTest<A> negate() {
        return example -> !test(example);
    }
}
