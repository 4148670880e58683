package com.prettydoc;

import ch.qos.logback.classic.Level;
import com.prettydoc.cli.RenderCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * Main CLI entry point for PrettyDoc.
 *
 * <p>PrettyDoc lays out tree-structured documents under a column budget, keeping groups on
 * one line when they fit and wrapping them with indentation when they do not.
 *
 * <p>Without a subcommand the sample document is rendered at the optional {@code WIDTH}
 * (the configured width, 80 columns by default, when missing, unparseable or negative).
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code render} - Render the sample document with display options</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all log output except errors</li>
 *   <li>{@code --help} - Show help information</li>
 *   <li>{@code --version} - Show version information</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Render at the default 80 columns
 * prettydoc
 *
 * # Render at 40 columns, logging each group decision
 * prettydoc -v 40
 *
 * # Render at 40 columns without colors
 * prettydoc render 40 --no-color
 * }</pre>
 */
@Command(
    name = "prettydoc",
    mixinStandardHelpOptions = true,
    version = "PrettyDoc 1.0.0-SNAPSHOT",
    description = "Width-aware pretty printer for tree-structured documents",
    subcommands = {
        RenderCommand.class
    }
)
public class PrettyDocCLI implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(PrettyDocCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (TRACE level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all log output except errors")
    private boolean quiet;

    @Parameters(
        index = "0",
        arity = "0..1",
        paramLabel = "WIDTH",
        description = "Column budget (default: configured width, 80)"
    )
    private String width;

    @Override
    public Integer call() {
        return new RenderCommand(width).call();
    }

    /**
     * Configures logging level based on global options.
     */
    void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.TRACE);
        } else {
            root.setLevel(Level.INFO);
        }
        log.debug("Logging configured (verbose: {}, quiet: {})", verbose, quiet);
    }

    /**
     * Returns whether verbose mode is enabled.
     *
     * @return true if verbose mode is enabled
     */
    public boolean isVerbose() {
        return verbose;
    }

    /**
     * Returns whether quiet mode is enabled.
     *
     * @return true if quiet mode is enabled
     */
    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Creates the command line with logging configured before any command runs.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        PrettyDocCLI cli = new PrettyDocCLI();
        CommandLine commandLine = new CommandLine(cli);
        // "render -5" must reach WidthArgument instead of failing as an unknown option
        commandLine.setUnmatchedOptionsArePositionalParams(true);
        commandLine.setExecutionStrategy(parseResult -> {
            cli.configureLogging();
            return new CommandLine.RunLast().execute(parseResult);
        });
        return commandLine;
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
