package com.prettydoc.cli;

import com.prettydoc.core.util.Graphemes;

import java.util.List;
import java.util.Objects;

/**
 * Formats rendered text for the console with the column budget made visible.
 *
 * <p>Every line is padded with spaces up to the budget. The character in the first column
 * past the budget is marked: with colors it gets a red background, without colors it is
 * replaced by the marker when it is padding, or surrounded by the marker when the line
 * overflows. Columns are counted in grapheme clusters, the unit in which
 * {@link com.prettydoc.core.model.Unicode} nodes are measured.
 *
 * <p><b>Example</b> (width 10, no colors, marker {@code |}):
 * <pre>{@code
 * foo(      |
 *   1,      |
 * )         |
 * }</pre>
 */
public class BoundaryView {

    /** Widest budget whose boundary is drawn; every line is padded up to it */
    public static final int MAX_MARKED_WIDTH = 1000;

    // ANSI color codes
    private static final String ANSI_RESET = "\u001B[0m";
    private static final String ANSI_RED_BACKGROUND = "\u001B[41m";

    private final int width;
    private final boolean useColors;
    private final String marker;

    /**
     * Creates a view for the given budget.
     *
     * @param width column budget the text was rendered with
     * @param useColors whether to mark the boundary with ANSI colors
     * @param marker boundary marker used without colors
     */
    public BoundaryView(int width, boolean useColors, String marker) {
        if (width < 0) {
            throw new IllegalArgumentException("width must not be negative: " + width);
        }
        if (width > MAX_MARKED_WIDTH) {
            throw new IllegalArgumentException(
                "width must not exceed " + MAX_MARKED_WIDTH + " to be displayed: " + width);
        }
        this.width = width;
        this.useColors = useColors;
        this.marker = Objects.requireNonNull(marker, "marker must not be null");
    }

    /**
     * Formats every line of the rendered text.
     *
     * @param rendered rendered text, lines separated by {@code \n}
     * @return the formatted text, lines separated by {@code \n}
     */
    public String format(String rendered) {
        StringBuilder out = new StringBuilder();
        String[] lines = rendered.split("\n", -1);

        for (int i = 0; i < lines.length; i++) {
            if (i > 0) {
                out.append('\n');
            }
            out.append(formatLine(lines[i]));
        }
        return out.toString();
    }

    /**
     * Formats a single line.
     *
     * @param line line without line terminator
     * @return padded line with the boundary column marked
     */
    String formatLine(String line) {
        List<String> columns = Graphemes.split(line);
        StringBuilder out = new StringBuilder();

        for (int i = 0; i < width; i++) {
            out.append(i < columns.size() ? columns.get(i) : " ");
        }

        boolean overflow = columns.size() > width;
        String boundary = overflow ? columns.get(width) : " ";

        if (useColors) {
            out.append(ANSI_RED_BACKGROUND).append(boundary).append(ANSI_RESET);
        } else if (overflow) {
            out.append(marker).append(boundary).append(marker);
        } else {
            out.append(marker);
        }

        for (int i = width + 1; i < columns.size(); i++) {
            out.append(columns.get(i));
        }
        return out.toString();
    }
}
