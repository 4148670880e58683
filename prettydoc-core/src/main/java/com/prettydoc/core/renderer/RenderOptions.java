package com.prettydoc.core.renderer;

import java.util.Objects;

/**
 * Settings for a single render.
 *
 * @param maxWidth column budget; {@code 0} wraps every group
 * @param indentUnit text emitted once per indentation level after a line break
 */
public record RenderOptions(int maxWidth, String indentUnit) {

    /** Default column budget */
    public static final int DEFAULT_WIDTH = 80;

    /** Default indentation unit: two spaces */
    public static final String DEFAULT_INDENT = "  ";

    /**
     * Compact constructor with validation.
     */
    public RenderOptions {
        if (maxWidth < 0) {
            throw new IllegalArgumentException("maxWidth must not be negative: " + maxWidth);
        }
        Objects.requireNonNull(indentUnit, "indentUnit must not be null");
        if (indentUnit.indexOf('\n') >= 0) {
            throw new IllegalArgumentException("indentUnit must not contain line breaks");
        }
    }

    /**
     * Creates options with the default width and indentation.
     *
     * @return default options
     */
    public static RenderOptions defaults() {
        return new RenderOptions(DEFAULT_WIDTH, DEFAULT_INDENT);
    }

    /**
     * Creates options with the given width and the default indentation.
     *
     * @param maxWidth column budget
     * @return options
     */
    public static RenderOptions ofWidth(int maxWidth) {
        return new RenderOptions(maxWidth, DEFAULT_INDENT);
    }

    /**
     * Returns a copy with a different column budget.
     *
     * @param newWidth column budget
     * @return options with the new width
     */
    public RenderOptions withWidth(int newWidth) {
        return new RenderOptions(newWidth, indentUnit);
    }

    /**
     * Returns a copy with a different indentation unit.
     *
     * @param newIndentUnit indentation unit
     * @return options with the new indentation unit
     */
    public RenderOptions withIndentUnit(String newIndentUnit) {
        return new RenderOptions(maxWidth, newIndentUnit);
    }
}
