package com.prettydoc.core.model;

/**
 * Visitor over the closed set of {@link Node} variants.
 *
 * @param <R> result type of each visit
 */
public interface NodeVisitor<R> {

    R visitGroup(Group group);

    R visitNodes(Nodes nodes);

    R visitIfWrap(IfWrap ifWrap);

    R visitText(Text text);

    R visitUnicode(Unicode unicode);

    R visitSpaceOrLine(SpaceOrLine spaceOrLine);

    R visitLine(Line line);

    R visitIndent(Indent indent);
}
