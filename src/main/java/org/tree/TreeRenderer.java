package org.tree;

import java.util.Objects;

/**
 * Renders a tree as indented text, one line per node or leaf:
 * <pre>
 * [a]
 *   true -> true
 *   false -> [b]
 *     true -> false
 *     false -> true
 * </pre>
 */
public final class TreeRenderer {

    private static final String INDENT = "  ";

    private TreeRenderer() {
    }

    public static <A> String render(Node<A> root) {
        Objects.requireNonNull(root, "root must not be null");
        StringBuilder sb = new StringBuilder();
        sb.append(label(root)).append(System.lineSeparator());
        appendChildren(sb, root, 1);
        return sb.toString();
    }

    private static <A> void appendChildren(StringBuilder sb, Node<A> node, int level) {
        appendChild(sb, "true", node.trueChild(), level);
        appendChild(sb, "false", node.falseChild(), level);
    }

    private static <A> void appendChild(StringBuilder sb, String side, Child<A> child, int level) {
        sb.append(INDENT.repeat(level)).append(side).append(" -> ");
        if (child instanceof Child.Leaf<A> leaf) {
            sb.append(leaf.verdict()).append(System.lineSeparator());
        } else {
            Node<A> next = ((Child.Branch<A>) child).node();
            sb.append(label(next)).append(System.lineSeparator());
            appendChildren(sb, next, level + 1);
        }
    }

    private static String label(Node<?> node) {
        return "[" + node.attribute() + "]";
    }
}
