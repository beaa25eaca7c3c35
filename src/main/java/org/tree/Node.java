package org.tree;

import org.model.Example;
import org.split.AttributeTest;

import java.util.Objects;

/**
 * An immutable internal node of a binary decision tree.
 *
 * Examples for which {@link #test()} is true continue into {@link #trueChild()},
 * all others into {@link #falseChild()}.
 */
public final class Node<A> {

    private final A attribute;
    private final AttributeTest<A> test;
    private final Child<A> trueChild;
    private final Child<A> falseChild;

    public Node(A attribute, AttributeTest<A> test, Child<A> trueChild, Child<A> falseChild) {
        this.attribute = Objects.requireNonNull(attribute, "attribute must not be null");
        this.test = Objects.requireNonNull(test, "test must not be null");
        this.trueChild = Objects.requireNonNull(trueChild, "trueChild must not be null");
        this.falseChild = Objects.requireNonNull(falseChild, "falseChild must not be null");
    }

    /** The attribute this node splits on (introspection only). */
    public A attribute() {
        return attribute;
    }

    public AttributeTest<A> test() {
        return test;
    }

    public Child<A> trueChild() {
        return trueChild;
    }

    public Child<A> falseChild() {
        return falseChild;
    }

    /**
     * Walks from this node down to a leaf and returns its verdict.
     * The walk is a loop, so deep trees do not grow the call stack.
     */
    public boolean predict(Example<A> example) {
        Objects.requireNonNull(example, "example must not be null");

        Node<A> current = this;
        while (true) {
            Child<A> next = current.test.test(example) ? current.trueChild : current.falseChild;
            if (next instanceof Child.Leaf<A> leaf) {
                return leaf.verdict();
            }
            current = ((Child.Branch<A>) next).node();
        }
    }

    /**
     * @return number of node levels on the longest path (a single node has depth 1)
     */
    public int depth() {
        return 1 + Math.max(depthOf(trueChild), depthOf(falseChild));
    }

    public int leafCount() {
        return leafCountOf(trueChild) + leafCountOf(falseChild);
    }

    private static <A> int depthOf(Child<A> child) {
        return (child instanceof Child.Branch<A> b) ? b.node().depth() : 0;
    }

    private static <A> int leafCountOf(Child<A> child) {
        return (child instanceof Child.Branch<A> b) ? b.node().leafCount() : 1;
    }

    @Override
    public String toString() {
        return "Node(attribute=" + attribute + ", depth=" + depth() + ")";
    }
}
