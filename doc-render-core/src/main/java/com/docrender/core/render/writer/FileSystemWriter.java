package com.docrender.core.render.writer;

import com.docrender.core.cancel.CancellationToken;
import com.docrender.core.render.OutputWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * Writer that stores each format as {@code <baseName>.<extension>} in an output directory.
 *
 * <p>Creates the directory automatically and overwrites existing files. Safe to share across
 * formats since every format writes its own file.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * FileSystemWriter writer = new FileSystemWriter(Path.of("./docs"), "report");
 * writer.write(token, "markdown", bytes);
 * // Creates: ./docs/report.md
 * }</pre>
 */
public class FileSystemWriter implements OutputWriter {

    private static final Logger log = LoggerFactory.getLogger(FileSystemWriter.class);

    private static final Map<String, String> EXTENSIONS = Map.of(
        "markdown", "md",
        "yaml", "yaml",
        "json", "json",
        "html", "html",
        "text", "txt"
    );

    private final Path directory;
    private final String baseName;

    public FileSystemWriter(Path directory, String baseName) {
        this.directory = Objects.requireNonNull(directory, "directory must not be null");
        this.baseName = Objects.requireNonNull(baseName, "baseName must not be null");
        if (baseName.isBlank()) {
            throw new IllegalArgumentException("baseName must not be blank");
        }
    }

    @Override
    public String name() {
        return "filesystem";
    }

    @Override
    public void write(CancellationToken token, String format, byte[] data) {
        Path target = target(format);
        try {
            Files.createDirectories(directory);
            Files.write(target, data);
            log.info("Wrote {} bytes of {} to {}", data.length, format, target);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + format + " output to " + target, e);
        }
    }

    /**
     * Returns the file a format is written to.
     *
     * @param format format name
     * @return target path
     */
    public Path target(String format) {
        String extension = EXTENSIONS.getOrDefault(format.toLowerCase(), format.toLowerCase());
        return directory.resolve(baseName + "." + extension);
    }
}
