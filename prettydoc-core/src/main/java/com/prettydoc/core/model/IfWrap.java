package com.prettydoc.core.model;

import java.util.Objects;

/**
 * Content that depends on whether another group was wrapped.
 *
 * <p>The referenced group must be reached before this node in render order. A reference to a
 * group that was never reached behaves as "not wrapped" and selects {@code flat}.
 *
 * @param groupId id of the group whose decision selects the branch
 * @param wrapped rendered when the group wrapped
 * @param flat rendered otherwise
 */
public record IfWrap(int groupId, Node wrapped, Node flat) implements Node {

    public IfWrap {
        Objects.requireNonNull(wrapped, "wrapped must not be null");
        Objects.requireNonNull(flat, "flat must not be null");
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitIfWrap(this);
    }
}
