package com.prettydoc.core.renderer;

import com.prettydoc.core.layout.WrapState;
import com.prettydoc.core.layout.Widths;
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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Renders a document tree to text in a single top-down pass.
 *
 * <p>Each {@link Group} is measured when it is first reached. If the current column plus its
 * flat width exceeds the budget, the group is recorded as wrapped and its children render
 * with line breaks enabled; otherwise its children render in detect mode, where nested
 * groups are measured again on their own. A decision is never revisited.
 *
 * <p>Because decisions are made top-down, a group's measurement treats nested groups that
 * have not been reached yet as flat. In rare nestings this lets a line run past the budget.
 *
 * <p>An instance holds the output buffer, indentation depth, current column and the
 * {@link WrapState} of one render and can be used only once. Use the static
 * {@link #render(Node, RenderOptions)} to get a fresh instance per call.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * DocumentBuilder builder = new DocumentBuilder();
 * Node doc = builder.call("foo", builder.number(1), builder.string("a"));
 *
 * String text = DocumentRenderer.render(doc, RenderOptions.ofWidth(40));
 * }</pre>
 *
 * <p>This class is not thread-safe.
 */
public class DocumentRenderer {

    private static final Logger log = LoggerFactory.getLogger(DocumentRenderer.class);

    private final RenderOptions options;
    private final WrapState wrapState = new WrapState();
    private final StringBuilder buffer = new StringBuilder();
    private final NodeVisitor<Void> enabled = new ModeVisitor(WrapMode.ENABLE);
    private final NodeVisitor<Void> detecting = new ModeVisitor(WrapMode.DETECT);

    private int indentDepth;
    private int column;
    private boolean used;

    /**
     * Creates a renderer for one render.
     *
     * @param options width and indentation settings
     */
    public DocumentRenderer(RenderOptions options) {
        this.options = Objects.requireNonNull(options, "options must not be null");
    }

    /**
     * Renders a document with the given options.
     *
     * @param root document root
     * @param options width and indentation settings
     * @return rendered text, lines separated by {@code \n}
     */
    public static String render(Node root, RenderOptions options) {
        return new DocumentRenderer(options).render(root);
    }

    /**
     * Renders a document with the given column budget and the default indentation.
     *
     * @param root document root
     * @param maxWidth column budget
     * @return rendered text, lines separated by {@code \n}
     */
    public static String render(Node root, int maxWidth) {
        return render(root, RenderOptions.ofWidth(maxWidth));
    }

    /**
     * Renders the document. Can be called once per instance.
     *
     * @param root document root
     * @return rendered text
     * @throws IllegalStateException if this instance has already rendered a document
     */
    public String render(Node root) {
        Objects.requireNonNull(root, "root must not be null");
        if (used) {
            throw new IllegalStateException("DocumentRenderer instances render a single document");
        }
        used = true;

        log.debug("Rendering document (maxWidth: {}, indentUnit: '{}')",
            options.maxWidth(), options.indentUnit());

        render(root, WrapMode.DETECT);

        log.debug("Rendered {} characters, {} group(s) wrapped", buffer.length(), wrapState.size());
        return buffer.toString();
    }

    /**
     * Returns the wrap decisions recorded so far.
     *
     * <p>The returned tracker is live. Callers should only inspect it.
     *
     * @return the wrap state of this render
     */
    public WrapState wrapState() {
        return wrapState;
    }

    private void render(Node node, WrapMode mode) {
        node.accept(mode == WrapMode.ENABLE ? enabled : detecting);
    }

    private void renderAll(List<Node> nodes, WrapMode mode) {
        for (Node node : nodes) {
            render(node, mode);
        }
    }

    private void text(String value, int width) {
        buffer.append(value);
        column += width;
    }

    private void newLine() {
        String unit = options.indentUnit();
        column = unit.length() * indentDepth;
        buffer.append('\n');
        buffer.append(unit.repeat(indentDepth));
    }

    /**
     * Per-mode dispatch. The two instances share the enclosing renderer's state.
     */
    private final class ModeVisitor implements NodeVisitor<Void> {

        private final WrapMode mode;

        ModeVisitor(WrapMode mode) {
            this.mode = mode;
        }

        @Override
        public Void visitGroup(Group group) {
            int width = Widths.of(group.children(), wrapState);
            boolean wrap = column + width > options.maxWidth();

            if (log.isTraceEnabled()) {
                log.trace("Group {} at column {} measures {} -> {}",
                    group.id(), column, width, wrap ? "wrap" : "flat");
            }

            if (wrap) {
                wrapState.markWrapped(group.id());
                renderAll(group.children(), WrapMode.ENABLE);
            } else {
                renderAll(group.children(), WrapMode.DETECT);
            }
            return null;
        }

        @Override
        public Void visitNodes(Nodes nodes) {
            renderAll(nodes.children(), mode);
            return null;
        }

        // Content shown because its group wrapped must itself wrap, even in a flat context.
        @Override
        public Void visitIfWrap(IfWrap ifWrap) {
            if (wrapState.isWrapped(ifWrap.groupId())) {
                render(ifWrap.wrapped(), WrapMode.ENABLE);
            } else {
                render(ifWrap.flat(), mode);
            }
            return null;
        }

        @Override
        public Void visitText(Text text) {
            text(text.value(), text.width());
            return null;
        }

        @Override
        public Void visitUnicode(Unicode unicode) {
            text(unicode.value(), unicode.width());
            return null;
        }

        @Override
        public Void visitSpaceOrLine(SpaceOrLine spaceOrLine) {
            if (mode == WrapMode.ENABLE) {
                newLine();
            } else {
                text(" ", 1);
            }
            return null;
        }

        @Override
        public Void visitLine(Line line) {
            if (mode == WrapMode.ENABLE) {
                newLine();
            }
            return null;
        }

        @Override
        public Void visitIndent(Indent indent) {
            if (mode == WrapMode.ENABLE) {
                column += options.indentUnit().length();
                indentDepth++;
                renderAll(indent.children(), WrapMode.ENABLE);
                indentDepth--;
            } else {
                renderAll(indent.children(), WrapMode.DETECT);
            }
            return null;
        }
    }
}
