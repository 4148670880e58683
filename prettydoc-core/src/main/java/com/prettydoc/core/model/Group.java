package com.prettydoc.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Content that should fit on one line if possible.
 *
 * <p>The wrap decision for a group is made once per render, the first time the group is
 * reached, and is keyed by {@code id}. Ids are assigned by the producer of the tree and must
 * be unique within one document.
 *
 * @param id unique, non-negative group identifier
 * @param children the grouped content
 */
public record Group(int id, List<Node> children) implements Node {

    /**
     * Compact constructor with validation.
     */
    public Group {
        if (id < 0) {
            throw new IllegalArgumentException("Group id must not be negative: " + id);
        }
        Objects.requireNonNull(children, "children must not be null");
        children = List.copyOf(children);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitGroup(this);
    }
}
