package com.docrender.core.error;

/**
 * A writer failed to persist or transmit rendered output.
 */
public class WriterException extends DocRenderException {

    private static final long serialVersionUID = 1L;

    private final String writer;
    private final String format;
    private final int dataSize;

    public WriterException(String writer, String format, int dataSize, Throwable cause) {
        super(String.format("write error for %s writer (format: %s, %d bytes): %s",
                writer, format, dataSize, cause.getMessage()), cause);
        this.writer = writer;
        this.format = format;
        this.dataSize = dataSize;
    }

    public String writer() {
        return writer;
    }

    public String format() {
        return format;
    }

    public int dataSize() {
        return dataSize;
    }
}
