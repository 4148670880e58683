package com.prettydoc.core.builder;

import com.prettydoc.core.model.Group;
import com.prettydoc.core.model.IfWrap;
import com.prettydoc.core.model.Indent;
import com.prettydoc.core.model.Node;
import com.prettydoc.core.model.Nodes;
import com.prettydoc.core.model.Text;
import com.prettydoc.core.model.Unicode;
import com.prettydoc.core.renderer.DocumentRenderer;
import com.prettydoc.core.renderer.RenderOptions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link DocumentBuilder}, including rendering of the call documents it builds.
 */
class DocumentBuilderTest {

    private DocumentBuilder builder;

    @BeforeEach
    void setUp() {
        builder = new DocumentBuilder();
    }

    /**
     * {@code foo(10000000000000, bar(20000000000000, "s", without_arguments()))}, 66 columns flat.
     */
    private Node nestedCall() {
        return builder.call("foo",
            builder.number(10_000_000_000_000L),
            builder.call("bar",
                builder.number(20_000_000_000_000L),
                builder.string("s"),
                builder.call("without_arguments")));
    }

    @Test
    void newGroupId_startsAtZeroAndIncreases() {
        assertThat(builder.newGroupId()).isZero();
        assertThat(builder.newGroupId()).isEqualTo(1);
        assertThat(builder.groupCount()).isEqualTo(2);
    }

    @Test
    void call_withoutArguments_hasNoGroup() {
        Node call = builder.call("without_arguments");

        assertThat(call).isEqualTo(Nodes.of(new Text("without_arguments"), new Text("()")));
        assertThat(builder.groupCount()).isZero();
    }

    @Test
    void call_withArguments_wrapsArgumentListInGroup() {
        Node call = builder.call("f", builder.number(1), builder.number(2));

        assertThat(call).isInstanceOf(Nodes.class);
        List<Node> parts = ((Nodes) call).children();
        assertThat(parts.get(0)).isEqualTo(new Text("f"));
        assertThat(parts.get(1)).isInstanceOf(Group.class);

        Group group = (Group) parts.get(1);
        assertThat(group.id()).isZero();
        assertThat(group.children().get(0)).isEqualTo(new Text("("));
        assertThat(group.children().get(1)).isInstanceOf(Indent.class);

        Indent indent = (Indent) group.children().get(1);
        Node last = indent.children().get(indent.children().size() - 1);
        assertThat(last).isEqualTo(new IfWrap(0, new Text(","), new Text("")));
    }

    @Test
    void call_allocatesInnerGroupsFirst() {
        nestedCall();

        assertThat(builder.groupCount()).isEqualTo(2);
    }

    @Test
    void string_quotesValueAndMeasuresGraphemes() {
        Node literal = builder.string("na\u0308");

        assertThat(literal).isInstanceOf(Unicode.class);
        assertThat(((Unicode) literal).value()).isEqualTo("\"na\u0308\"");
        assertThat(((Unicode) literal).width()).isEqualTo(4);
    }

    @Test
    void unicode_keepsValueUnquoted() {
        Node literal = builder.unicode("a\u0301b");

        assertThat(literal).isEqualTo(new Unicode("a\u0301b", 2));
    }

    @Test
    void render_callWithUnicodeArgument_measuresGraphemes() {
        // Six chars but three columns: "f(" + 3 + ")" fits in exactly 6 columns
        Node call = builder.call("f", builder.unicode("e\u0301".repeat(3)));

        assertThat(DocumentRenderer.render(call, 6)).isEqualTo("f(" + "e\u0301".repeat(3) + ")");
        assertThat(DocumentRenderer.render(call, 5)).isEqualTo("f(\n  " + "e\u0301".repeat(3) + ",\n)");
    }

    @Test
    @DisplayName("Nested call fits on one line at 80 columns")
    void render_nestedCallAt80_rendersSingleLine() {
        String out = DocumentRenderer.render(nestedCall(), 80);

        assertThat(out).isEqualTo("foo(10000000000000, bar(20000000000000, \"s\", without_arguments()))");
    }

    @Test
    @DisplayName("Nested call wraps both argument lists at 40 columns")
    void render_nestedCallAt40_wrapsBothArgumentLists() {
        String out = DocumentRenderer.render(nestedCall(), 40);

        assertThat(out).isEqualTo("""
            foo(
              10000000000000,
              bar(
                20000000000000,
                "s",
                without_arguments(),
              ),
            )""");
    }

    @Test
    void render_nestedCallAtExactFlatWidth_staysFlat() {
        String out = DocumentRenderer.render(nestedCall(), 66);

        assertThat(out).doesNotContain("\n").hasSize(66);
    }

    @Test
    void render_nestedCallOneColumnShort_wrapsOnlyOuterList() {
        DocumentRenderer renderer = new DocumentRenderer(RenderOptions.ofWidth(65));

        String out = renderer.render(nestedCall());

        assertThat(out).isEqualTo("""
            foo(
              10000000000000,
              bar(20000000000000, "s", without_arguments()),
            )""");
        assertThat(renderer.wrapState().wrappedIds()).containsExactly(1);
    }

    @Test
    void render_nestedCallWithFourSpaceIndent_indentsByFour() {
        String out = DocumentRenderer.render(nestedCall(), new RenderOptions(40, "    "));

        assertThat(out).isEqualTo("""
            foo(
                10000000000000,
                bar(
                    20000000000000,
                    "s",
                    without_arguments(),
                ),
            )""");
    }

    @Test
    void render_callWithoutArguments_neverWraps() {
        assertThat(DocumentRenderer.render(builder.call("without_arguments"), 0))
            .isEqualTo("without_arguments()");
    }

    @Test
    void render_singleArgumentCall_addsTrailingCommaOnlyWhenWrapped() {
        Node call = builder.call("f", builder.text("argument"));

        assertThat(DocumentRenderer.render(call, 80)).isEqualTo("f(argument)");
        assertThat(DocumentRenderer.render(call, 5)).isEqualTo("f(\n  argument,\n)");
    }
}
