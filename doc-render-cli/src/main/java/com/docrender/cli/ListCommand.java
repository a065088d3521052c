package com.docrender.cli;

import com.docrender.core.render.Renderer;
import com.docrender.core.render.RendererRegistry;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

/**
 * Command to list available output formats.
 *
 * <p>Discovers renderers via Java Service Provider Interface (SPI).
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * docrender list formats
 * }</pre>
 */
@Command(
    name = "list",
    description = "List available formats",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Type to list: formats", defaultValue = "formats")
    private String type;

    @Override
    public Integer call() {
        return switch (type.toLowerCase()) {
            case "formats", "format", "renderers", "renderer" -> listFormats();
            default -> {
                log.error("Unknown type: {}. Use: formats", type);
                yield 1;
            }
        };
    }

    private int listFormats() {
        PrintWriter out = spec.commandLine().getOut();
        out.println("Available Formats:");
        out.println();

        RendererRegistry registry = RendererRegistry.load();
        if (registry.formats().isEmpty()) {
            out.println("  No formats found.");
            return 0;
        }
        for (String format : registry.formats()) {
            Renderer renderer = registry.find(format).orElseThrow();
            out.printf("  • %s (%s)%n", format, renderer.getClass().getSimpleName());
            out.printf("    Streaming: %s%n", renderer.supportsStreaming());
            out.println();
        }
        out.flush();
        return 0;
    }
}
