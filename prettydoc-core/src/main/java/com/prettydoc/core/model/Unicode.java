package com.prettydoc.core.model;

import com.prettydoc.core.util.Graphemes;

import java.util.Objects;

/**
 * Literal content whose display width is the number of user-perceived characters.
 *
 * <p>Counting graphemes is linear in the length of the text, so the width is computed once
 * by {@link #of(String)} and carried with the node from then on.
 *
 * @param value the literal text
 * @param width cached display width
 */
public record Unicode(String value, int width) implements Node {

    public Unicode {
        Objects.requireNonNull(value, "value must not be null");
        if (width < 0) {
            throw new IllegalArgumentException("width must not be negative: " + width);
        }
    }

    /**
     * Creates a node for the given text, counting its graphemes.
     *
     * @param value the literal text
     * @return a node with its width cached
     */
    public static Unicode of(String value) {
        Objects.requireNonNull(value, "value must not be null");
        return new Unicode(value, Graphemes.count(value));
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitUnicode(this);
    }
}
