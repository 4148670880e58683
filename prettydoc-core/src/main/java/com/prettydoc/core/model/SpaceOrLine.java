package com.prettydoc.core.model;

/**
 * A single space when flat, a line break when wrapped.
 */
public record SpaceOrLine() implements Node {

    public static final SpaceOrLine INSTANCE = new SpaceOrLine();

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitSpaceOrLine(this);
    }
}
