package com.prettydoc.core.builder;

import com.prettydoc.core.model.Group;
import com.prettydoc.core.model.IfWrap;
import com.prettydoc.core.model.Indent;
import com.prettydoc.core.model.Line;
import com.prettydoc.core.model.Node;
import com.prettydoc.core.model.Nodes;
import com.prettydoc.core.model.SpaceOrLine;
import com.prettydoc.core.model.Text;
import com.prettydoc.core.model.Unicode;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Assembles document trees for call-like syntax.
 *
 * <p>Group ids are allocated from zero in the order groups are created, so ids are unique
 * within every document built by one builder. A builder is meant to be used by a single
 * producer; it is not thread-safe.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * DocumentBuilder b = new DocumentBuilder();
 * Node doc = b.call("foo",
 *     b.number(10000000000L),
 *     b.call("bar", b.string("s"), b.call("without_arguments")));
 * }</pre>
 */
public class DocumentBuilder {

    private int nextGroupId;

    /**
     * Allocates the next group id.
     *
     * @return a fresh id
     */
    public int newGroupId() {
        return nextGroupId++;
    }

    /**
     * Returns the number of group ids allocated so far.
     *
     * @return allocated id count
     */
    public int groupCount() {
        return nextGroupId;
    }

    public Node text(String value) {
        return new Text(value);
    }

    public Node unicode(String value) {
        return Unicode.of(value);
    }

    public Node number(long value) {
        return new Text(Long.toString(value));
    }

    /**
     * Creates a numeric literal from its source text, e.g. {@code "10_000"} or {@code "0x1F"}.
     *
     * @param literal literal source text
     * @return text node
     */
    public Node number(String literal) {
        return new Text(literal);
    }

    /**
     * Creates a double-quoted string literal. The value is not escaped.
     *
     * @param value literal contents
     * @return node measuring the quoted literal in graphemes
     */
    public Node string(String value) {
        Objects.requireNonNull(value, "value must not be null");
        return Unicode.of("\"" + value + "\"");
    }

    /**
     * Creates a call expression.
     *
     * @param name callee name
     * @param arguments argument nodes
     * @return call node
     * @see #call(String, List)
     */
    public Node call(String name, Node... arguments) {
        return call(name, List.of(arguments));
    }

    /**
     * Creates a call expression.
     *
     * <p>Without arguments the call is just {@code name()} and takes no wrap decision. With
     * arguments, the argument list is a group: flat it renders as {@code name(a, b)}; wrapped
     * it puts each argument on its own line, one level deeper, with a trailing comma after the
     * last one and the closing parenthesis back at the call's indentation.
     *
     * @param name callee name
     * @param arguments argument nodes
     * @return call node
     */
    public Node call(String name, List<Node> arguments) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(arguments, "arguments must not be null");

        if (arguments.isEmpty()) {
            return Nodes.of(new Text(name), new Text("()"));
        }

        int id = newGroupId();
        List<Node> list = new ArrayList<>();
        list.add(Line.INSTANCE);

        int last = arguments.size() - 1;
        for (int i = 0; i < arguments.size(); i++) {
            list.add(arguments.get(i));
            if (i < last) {
                list.add(new Text(","));
                list.add(SpaceOrLine.INSTANCE);
            } else {
                list.add(new IfWrap(id, new Text(","), new Text("")));
            }
        }

        Group group = new Group(id, List.of(
            new Text("("),
            new Indent(list),
            Line.INSTANCE,
            new Text(")")
        ));
        return Nodes.of(new Text(name), group);
    }
}
