package com.prettydoc.core.model;

/**
 * A node in a formattable document tree.
 *
 * <p>The variant set is closed: a tree consists only of {@link Group}, {@link Nodes},
 * {@link IfWrap}, {@link Text}, {@link Unicode}, {@link SpaceOrLine}, {@link Line} and
 * {@link Indent}. Code that needs to treat each variant differently goes through
 * {@link NodeVisitor}, so adding a variant breaks every dispatch site at compile time.
 *
 * <p>Trees are immutable once built. Renderers and measurement code only read them.
 *
 * @see NodeVisitor
 */
public sealed interface Node
    permits Group, Nodes, IfWrap, Text, Unicode, SpaceOrLine, Line, Indent {

    /**
     * Dispatches to the visitor method for this variant.
     *
     * @param visitor the visitor
     * @param <R> result type
     * @return the visitor's result
     */
    <R> R accept(NodeVisitor<R> visitor);
}
