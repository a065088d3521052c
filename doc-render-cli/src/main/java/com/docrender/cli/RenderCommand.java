package com.docrender.cli;

import com.docrender.core.cancel.CancellationToken;
import com.docrender.core.config.ConfigLoader;
import com.docrender.core.config.RenderConfig;
import com.docrender.core.error.DocRenderException;
import com.docrender.core.error.MultiRenderException;
import com.docrender.core.io.DocumentLoader;
import com.docrender.core.model.Document;
import com.docrender.core.model.TableContent;
import com.docrender.core.operation.SortKey;
import com.docrender.core.pipeline.DocumentPipeline;
import com.docrender.core.render.LoggingProgress;
import com.docrender.core.render.OutputWriter;
import com.docrender.core.render.RenderOrchestrator;
import com.docrender.core.render.RendererRegistry;
import com.docrender.core.render.writer.ConsoleWriter;
import com.docrender.core.render.writer.FileSystemWriter;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to render a document file to one or more formats.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * docrender render report.yaml -f markdown -f json -o build/docs
 * docrender render report.yaml --sort region --sort amount:desc --limit 5 --console
 * }</pre>
 */
@Command(
    name = "render",
    description = "Render a YAML or JSON document to the configured formats",
    mixinStandardHelpOptions = true
)
public class RenderCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RenderCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Document file (YAML or JSON)")
    private Path document;

    @Option(names = {"-c", "--config"}, description = "Configuration file")
    private Path configFile = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Option(names = {"-f", "--format"}, description = "Output format, repeatable (overrides config)")
    private List<String> formats = new ArrayList<>();

    @Option(names = {"-o", "--output"}, description = "Output directory (overrides config)")
    private Path outputDir;

    @Option(names = "--console", description = "Also print output to the console")
    private boolean console;

    @Option(names = "--sort", description = "Sort tables by column[:asc|desc], repeatable")
    private List<String> sortKeys = new ArrayList<>();

    @Option(names = "--limit", description = "Keep the first N rows of every table")
    private Integer limit;

    @Option(names = "--timeout", description = "Render time budget, ISO-8601 (e.g. PT10S)")
    private Duration timeout;

    @Override
    public Integer call() {
        List<SortKey> parsedSortKeys = parseSortKeys();
        try {
            RenderConfig config = ConfigLoader.load(configFile);
            Document loaded = new DocumentLoader().load(document);
            Document prepared = applyTableOptions(loaded, config, parsedSortKeys);

            List<String> selected = formats.isEmpty() ? config.formats() : formats;
            Path directory = outputDir != null ? outputDir : Paths.get(config.output().directory());
            List<OutputWriter> writers = new ArrayList<>();
            writers.add(new FileSystemWriter(directory, config.output().baseName()));
            if (console || config.output().consoleEnabled()) {
                writers.add(new ConsoleWriter(new PrintStream(System.out, true, StandardCharsets.UTF_8), true));
            }

            try (RenderOrchestrator orchestrator = RenderOrchestrator.builder()
                    .formats(RendererRegistry.load().resolve(selected))
                    .writers(writers)
                    .progress(new LoggingProgress())
                    .build()) {
                orchestrator.render(token(config), prepared);
            }
            spec.commandLine().getOut().printf("Rendered %s to %s%n", String.join(", ", selected), directory);
            return 0;
        } catch (MultiRenderException e) {
            log.error("Render failed with {} error(s)", e.errors().size());
            e.sources().forEach(source -> log.error("  [{}] {}", source.component(), source.error().getMessage()));
            return 1;
        } catch (DocRenderException | UncheckedIOException e) {
            log.error("Render failed: {}", e.getMessage());
            return 1;
        }
    }

    private List<SortKey> parseSortKeys() {
        List<SortKey> parsed = new ArrayList<>(sortKeys.size());
        for (String key : sortKeys) {
            try {
                parsed.add(SortKey.parse(key));
            } catch (IllegalArgumentException e) {
                throw new ParameterException(spec.commandLine(),
                    "Invalid value for option '--sort': " + e.getMessage());
            }
        }
        return parsed;
    }

    private Document applyTableOptions(Document loaded, RenderConfig config, List<SortKey> parsedSortKeys) {
        if (parsedSortKeys.isEmpty() && limit == null) {
            return loaded;
        }
        if (loaded.contents().stream().noneMatch(TableContent.class::isInstance)) {
            log.warn("--sort/--limit ignored: document has no tables");
            return loaded;
        }
        DocumentPipeline pipeline = new DocumentPipeline(loaded).withOptions(config.pipeline().toOptions());
        if (!parsedSortKeys.isEmpty()) {
            pipeline.sort(parsedSortKeys.toArray(new SortKey[0]));
        }
        if (limit != null) {
            pipeline.limit(limit);
        }
        return pipeline.execute(CancellationToken.create());
    }

    private CancellationToken token(RenderConfig config) {
        Duration budget = timeout != null ? timeout : config.render().timeoutDuration();
        CancellationToken token = CancellationToken.create();
        return budget == null ? token : token.withTimeout(budget);
    }
}
