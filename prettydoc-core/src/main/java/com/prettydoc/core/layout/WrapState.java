package com.prettydoc.core.layout;

import java.util.BitSet;
import java.util.List;

/**
 * Records which groups have been decided to need wrapping during one render.
 *
 * <p>Ids are only ever added. Once a group is marked wrapped it stays wrapped for the rest of
 * the render, so lookups made later in the pass always agree with lookups made earlier.
 *
 * <p>Group ids are allocated densely from zero, which makes a {@link BitSet} a compact
 * backing store. This class is not thread-safe; an instance belongs to a single render.
 */
public final class WrapState {

    private final BitSet wrapped = new BitSet();

    /**
     * Marks a group as wrapped. Marking an already wrapped group has no effect.
     *
     * @param groupId non-negative group id
     * @throws IllegalArgumentException if {@code groupId} is negative
     */
    public void markWrapped(int groupId) {
        if (groupId < 0) {
            throw new IllegalArgumentException("Group id must not be negative: " + groupId);
        }
        wrapped.set(groupId);
    }

    /**
     * Returns whether a group has been marked wrapped.
     *
     * <p>Ids that were never marked, including negative ids and ids of groups that do not
     * exist in the document, report {@code false}.
     *
     * @param groupId group id
     * @return true if the group is wrapped
     */
    public boolean isWrapped(int groupId) {
        return groupId >= 0 && wrapped.get(groupId);
    }

    /**
     * Returns the number of wrapped groups.
     *
     * @return wrapped group count
     */
    public int size() {
        return wrapped.cardinality();
    }

    /**
     * Returns whether no group has been wrapped yet.
     *
     * @return true if empty
     */
    public boolean isEmpty() {
        return wrapped.isEmpty();
    }

    /**
     * Returns a snapshot of the wrapped group ids in ascending order.
     *
     * @return unmodifiable list of ids
     */
    public List<Integer> wrappedIds() {
        return wrapped.stream().boxed().toList();
    }

    @Override
    public String toString() {
        return "WrapState" + wrapped;
    }
}
