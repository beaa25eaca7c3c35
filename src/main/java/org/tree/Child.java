package org.tree;

import java.util.Objects;

/**
 * What hangs off one side of a {@link Node}: either a final verdict or another node.
 */
public sealed interface Child<A> permits Child.Leaf, Child.Branch {

    static <A> Child<A> leaf(boolean verdict) {
        return new Leaf<>(verdict);
    }

    static <A> Child<A> branch(Node<A> node) {
        return new Branch<>(node);
    }

    /**
     * Terminal verdict: true if the examples that reached it carry the truth label.
     */
    record Leaf<A>(boolean verdict) implements Child<A> {
    }

    /**
     * A subtree owned exclusively by its parent.
     */
    record Branch<A>(Node<A> node) implements Child<A> {
        public Branch {
            Objects.requireNonNull(node, "node must not be null");
        }
    }
}
