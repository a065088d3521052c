package com.docrender.core.render.writer;

import com.docrender.core.cancel.CancellationToken;
import com.docrender.core.render.OutputWriter;

import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Writer that prints rendered output to a console stream, one block per format.
 *
 * <p>Writes are serialized so blocks from concurrently rendered formats never interleave.
 */
public class ConsoleWriter implements OutputWriter {

    // ANSI color codes
    private static final String ANSI_RESET = "\u001B[0m";
    private static final String ANSI_BOLD = "\u001B[1m";
    private static final String ANSI_CYAN = "\u001B[36m";
    private static final String ANSI_YELLOW = "\u001B[33m";

    private static final String SEPARATOR = "---";

    private final PrintStream out;
    private final boolean useColors;

    public ConsoleWriter() {
        this(System.out, true);
    }

    public ConsoleWriter(PrintStream out, boolean useColors) {
        this.out = Objects.requireNonNull(out, "out must not be null");
        this.useColors = useColors;
    }

    @Override
    public String name() {
        return "console";
    }

    @Override
    public void write(CancellationToken token, String format, byte[] data) {
        String header = useColors ? ANSI_BOLD + ANSI_CYAN : "";
        String meta = useColors ? ANSI_YELLOW : "";
        String reset = useColors ? ANSI_RESET : "";

        synchronized (out) {
            out.println(header + "Format: " + format + reset);
            out.println(meta + "Size: " + data.length + " bytes" + reset);
            out.println();
            out.println(new String(data, StandardCharsets.UTF_8));
            out.println(meta + SEPARATOR.repeat(80 / SEPARATOR.length()) + reset);
            out.flush();
        }
    }
}
