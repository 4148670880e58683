package com.prettydoc.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Plain concatenation of nodes, with no wrap decision of its own.
 *
 * @param children the concatenated nodes
 */
public record Nodes(List<Node> children) implements Node {

    public Nodes {
        Objects.requireNonNull(children, "children must not be null");
        children = List.copyOf(children);
    }

    /**
     * Creates a concatenation of the given nodes.
     *
     * @param children nodes in render order
     * @return the concatenation
     */
    public static Nodes of(Node... children) {
        return new Nodes(List.of(children));
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitNodes(this);
    }
}
