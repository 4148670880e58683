package com.prettydoc.core.layout;

import com.prettydoc.core.model.Group;
import com.prettydoc.core.model.IfWrap;
import com.prettydoc.core.model.Indent;
import com.prettydoc.core.model.Line;
import com.prettydoc.core.model.Node;
import com.prettydoc.core.model.NodeVisitor;
import com.prettydoc.core.model.Nodes;
import com.prettydoc.core.model.SpaceOrLine;
import com.prettydoc.core.model.Text;
import com.prettydoc.core.model.Unicode;

import java.util.List;
import java.util.Objects;

/**
 * Measures how many columns a subtree occupies when rendered on a single line.
 *
 * <p>Measurement follows the flat interpretation of every node, except that {@link IfWrap}
 * picks its branch from the wrap decisions already recorded in the given {@link WrapState}.
 * Groups that have not been decided yet are measured as if they stay flat, even if they will
 * later turn out to need wrapping.
 *
 * <p>Widths of composite nodes are not cached: the same subtree can measure differently
 * depending on which groups have wrapped by the time it is measured.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * WrapState state = new WrapState();
 * int width = Widths.of(group.children(), state);
 * }</pre>
 */
public final class Widths {

    private Widths() {
        // Utility class
    }

    /**
     * Returns the flat width of a node.
     *
     * @param node node to measure
     * @param wrapState wrap decisions made so far
     * @return width in columns
     */
    public static int of(Node node, WrapState wrapState) {
        Objects.requireNonNull(node, "node must not be null");
        Objects.requireNonNull(wrapState, "wrapState must not be null");
        return node.accept(new FlatWidth(wrapState));
    }

    /**
     * Returns the combined flat width of a sequence of nodes.
     *
     * @param nodes nodes to measure
     * @param wrapState wrap decisions made so far
     * @return width in columns
     */
    public static int of(List<Node> nodes, WrapState wrapState) {
        Objects.requireNonNull(nodes, "nodes must not be null");
        Objects.requireNonNull(wrapState, "wrapState must not be null");
        return new FlatWidth(wrapState).sum(nodes);
    }

    private static final class FlatWidth implements NodeVisitor<Integer> {

        private final WrapState wrapState;

        FlatWidth(WrapState wrapState) {
            this.wrapState = wrapState;
        }

        int sum(List<Node> nodes) {
            int total = 0;
            for (Node node : nodes) {
                total += node.accept(this);
            }
            return total;
        }

        @Override
        public Integer visitGroup(Group group) {
            return sum(group.children());
        }

        @Override
        public Integer visitNodes(Nodes nodes) {
            return sum(nodes.children());
        }

        @Override
        public Integer visitIfWrap(IfWrap ifWrap) {
            Node branch = wrapState.isWrapped(ifWrap.groupId()) ? ifWrap.wrapped() : ifWrap.flat();
            return branch.accept(this);
        }

        @Override
        public Integer visitText(Text text) {
            return text.width();
        }

        @Override
        public Integer visitUnicode(Unicode unicode) {
            return unicode.width();
        }

        @Override
        public Integer visitSpaceOrLine(SpaceOrLine spaceOrLine) {
            return 1;
        }

        @Override
        public Integer visitLine(Line line) {
            return 0;
        }

        // Indentation only appears after a line break, which never happens when flat.
        @Override
        public Integer visitIndent(Indent indent) {
            return sum(indent.children());
        }
    }
}
