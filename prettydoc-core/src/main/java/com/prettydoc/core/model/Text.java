package com.prettydoc.core.model;

import java.util.Objects;

/**
 * Literal ASCII content. Its width is its length.
 *
 * @param value the literal text, expected to contain no line breaks
 */
public record Text(String value) implements Node {

    public Text {
        Objects.requireNonNull(value, "value must not be null");
    }

    /**
     * Returns the number of columns this text occupies.
     *
     * @return the text length
     */
    public int width() {
        return value.length();
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitText(this);
    }
}
