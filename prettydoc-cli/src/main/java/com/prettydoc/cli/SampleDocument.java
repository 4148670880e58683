package com.prettydoc.cli;

import com.prettydoc.core.builder.DocumentBuilder;
import com.prettydoc.core.model.Node;

/**
 * The document rendered by {@link RenderCommand}: a nested call with long numeric
 * arguments, a string literal and a call without arguments.
 *
 * <pre>{@code
 * foo(10000000000000, bar(20000000000000, "hello", without_arguments()))
 * }</pre>
 */
public final class SampleDocument {

    private SampleDocument() {
        // Utility class
    }

    /**
     * Builds the sample document.
     *
     * @param builder builder allocating group ids
     * @return document root
     */
    public static Node create(DocumentBuilder builder) {
        return builder.call("foo",
            builder.number(10_000_000_000_000L),
            builder.call("bar",
                builder.number(20_000_000_000_000L),
                builder.string("hello"),
                builder.call("without_arguments")));
    }
}
