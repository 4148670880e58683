package com.prettydoc.core.model;

/**
 * Nothing when flat, a line break when wrapped.
 */
public record Line() implements Node {

    public static final Line INSTANCE = new Line();

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitLine(this);
    }
}
