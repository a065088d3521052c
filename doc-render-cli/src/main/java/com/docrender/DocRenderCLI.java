package com.docrender;

import com.docrender.cli.ListCommand;
import com.docrender.cli.RenderCommand;
import com.docrender.cli.ValidateCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ch.qos.logback.classic.Level;

/**
 * Main CLI entry point for DocRender.
 *
 * <p>DocRender renders structured documents (tables, text, sections, charts, graphs, diagrams)
 * to several output formats at once, applying table operations on the way.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code render} - Render a document file to the configured formats</li>
 *   <li>{@code list} - List available formats</li>
 *   <li>{@code validate} - Validate a configuration file</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Render to markdown and json
 * docrender render report.yaml -f markdown -f json -o build/docs
 *
 * # Sort tables and keep the top 10 rows
 * docrender render report.yaml --sort amount:desc --limit 10 --console
 * }</pre>
 */
@Command(
    name = "docrender",
    mixinStandardHelpOptions = true,
    version = "DocRender 1.0.0-SNAPSHOT",
    description = "Renders structured documents to multiple output formats",
    subcommands = {
        RenderCommand.class,
        ListCommand.class,
        ValidateCommand.class
    }
)
public class DocRenderCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(DocRenderCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }
        System.out.println("DocRender - Multi-format document renderer");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'docrender --help' to see available commands");
        System.out.println("Use 'docrender <command> --help' for command-specific help");
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
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
        log.debug("Log level set to {}", root.getLevel());
    }

    /**
     * Creates the command line with logging configured before any subcommand runs.
     *
     * @return command line
     */
    public static CommandLine commandLine() {
        DocRenderCLI cli = new DocRenderCLI();
        CommandLine commandLine = new CommandLine(cli);
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
