package com.prettydoc.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.prettydoc.core.renderer.RenderOptions;

/**
 * Root configuration for PrettyDoc.
 *
 * <p>Loaded from {@code prettydoc.yaml}. Missing sections and values fall back to the
 * defaults of {@link #defaults()}.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * render:
 *   width: 100
 *   indent: "    "
 *
 * display:
 *   colors: false
 *   marker: "|"
 * }</pre>
 *
 * @param render render settings
 * @param display console display settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PrettyDocConfig(
    @JsonProperty("render") RenderSettings render,
    @JsonProperty("display") DisplaySettings display
) {
    /** Default boundary marker used when colors are off */
    public static final String DEFAULT_MARKER = "|";

    /**
     * Creates the default configuration: 80 columns, two-space indentation, colored display.
     *
     * @return default configuration
     */
    public static PrettyDocConfig defaults() {
        return new PrettyDocConfig(
            new RenderSettings(RenderOptions.DEFAULT_WIDTH, RenderOptions.DEFAULT_INDENT),
            new DisplaySettings(true, DEFAULT_MARKER)
        );
    }

    /**
     * Resolves render options, substituting defaults for anything not configured.
     *
     * <p>A negative configured width is ignored in favour of the default.
     *
     * @return render options
     */
    public RenderOptions renderOptions() {
        int width = RenderOptions.DEFAULT_WIDTH;
        String indent = RenderOptions.DEFAULT_INDENT;

        if (render != null) {
            if (render.width() != null && render.width() >= 0) {
                width = render.width();
            }
            if (render.indent() != null) {
                indent = render.indent();
            }
        }
        return new RenderOptions(width, indent);
    }

    /**
     * Returns whether colored display output is enabled.
     *
     * @return true unless disabled in configuration
     */
    public boolean colorsEnabled() {
        return display == null || display.colors() == null || display.colors();
    }

    /**
     * Returns the boundary marker used when colors are off.
     *
     * @return configured marker or {@link #DEFAULT_MARKER}
     */
    public String marker() {
        if (display == null || display.marker() == null || display.marker().isEmpty()) {
            return DEFAULT_MARKER;
        }
        return display.marker();
    }

    /**
     * Render settings.
     *
     * @param width column budget
     * @param indent indentation unit
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record RenderSettings(
        @JsonProperty("width") Integer width,
        @JsonProperty("indent") String indent
    ) {}

    /**
     * Console display settings.
     *
     * @param colors whether to use ANSI colors
     * @param marker boundary marker used without colors
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record DisplaySettings(
        @JsonProperty("colors") Boolean colors,
        @JsonProperty("marker") String marker
    ) {}
}
