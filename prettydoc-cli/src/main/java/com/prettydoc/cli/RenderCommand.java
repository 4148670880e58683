package com.prettydoc.cli;

import com.prettydoc.core.builder.DocumentBuilder;
import com.prettydoc.core.config.ConfigLoader;
import com.prettydoc.core.config.PrettyDocConfig;
import com.prettydoc.core.model.Node;
import com.prettydoc.core.renderer.DocumentRenderer;
import com.prettydoc.core.renderer.RenderOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.Callable;

/**
 * Command to render the sample document at a given width.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Render at 80 columns
 * prettydoc render
 *
 * # Render at 40 columns with four-space indentation and no colors
 * prettydoc render 40 --indent 4 --no-color
 * }</pre>
 *
 * <p>The width argument takes precedence over {@code render.width} in the configuration
 * file. An unparseable or negative width falls back to the configured width, which is 80
 * columns when the file does not set one.
 */
@Command(
    name = "render",
    description = "Render the sample document and show the column boundary",
    mixinStandardHelpOptions = true
)
public class RenderCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RenderCommand.class);

    @Parameters(
        index = "0",
        arity = "0..1",
        paramLabel = "WIDTH",
        description = "Column budget (default: 80)"
    )
    private String width;

    @Option(names = {"--indent"}, paramLabel = "SPACES", description = "Spaces per indentation level")
    private Integer indent;

    @Option(names = {"--no-color"}, description = "Mark the boundary with a marker instead of ANSI colors")
    private boolean noColor;

    @Option(names = {"-c", "--config"}, description = "Configuration file")
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    public RenderCommand() {
    }

    /**
     * Creates a command for the given width with default options.
     *
     * @param width raw width argument, may be null
     */
    public RenderCommand(String width) {
        this.width = width;
    }

    @Override
    public Integer call() {
        PrettyDocConfig config = ConfigLoader.load(configPath);

        RenderOptions options;
        try {
            options = resolveOptions(config);
        } catch (IllegalArgumentException e) {
            log.error("Invalid render options: {}", e.getMessage());
            return 1;
        }

        Node document = SampleDocument.create(new DocumentBuilder());
        String rendered = DocumentRenderer.render(document, options);

        boolean useColors = !noColor && config.colorsEnabled();
        if (options.maxWidth() > BoundaryView.MAX_MARKED_WIDTH) {
            log.warn("Width {} is too wide to mark the boundary; printing without it", options.maxWidth());
            System.out.println(rendered);
        } else {
            BoundaryView view = new BoundaryView(options.maxWidth(), useColors, config.marker());
            System.out.println(view.format(rendered));
        }

        log.info("Rendered sample document at width {}", options.maxWidth());
        return 0;
    }

    private RenderOptions resolveOptions(PrettyDocConfig config) {
        RenderOptions options = config.renderOptions();
        if (width != null) {
            options = options.withWidth(WidthArgument.parse(width, options.maxWidth()));
        }
        if (indent != null) {
            if (indent < 0) {
                throw new IllegalArgumentException("--indent must not be negative: " + indent);
            }
            options = options.withIndentUnit(" ".repeat(indent));
        }
        return options;
    }
}
