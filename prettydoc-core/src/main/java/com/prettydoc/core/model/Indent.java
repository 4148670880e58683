package com.prettydoc.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Content indented one level deeper when wrapped. Flat content is never indented.
 *
 * @param children the indented content
 */
public record Indent(List<Node> children) implements Node {

    public Indent {
        Objects.requireNonNull(children, "children must not be null");
        children = List.copyOf(children);
    }

    /**
     * Creates an indented block from the given nodes.
     *
     * @param children nodes in render order
     * @return the indented block
     */
    public static Indent of(Node... children) {
        return new Indent(List.of(children));
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitIndent(this);
    }
}
