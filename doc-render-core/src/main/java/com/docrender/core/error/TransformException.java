package com.docrender.core.error;

/**
 * A byte transformer failed while post-processing rendered output.
 */
public class TransformException extends DocRenderException {

    private static final long serialVersionUID = 1L;

    private final String transformer;
    private final String format;
    private final int inputSize;

    public TransformException(String transformer, String format, int inputSize, Throwable cause) {
        super(String.format("transformer %s failed for format %s (input %d bytes): %s",
                transformer, format, inputSize, cause.getMessage()), cause);
        this.transformer = transformer;
        this.format = format;
        this.inputSize = inputSize;
    }

    public String transformer() {
        return transformer;
    }

    public String format() {
        return format;
    }

    public int inputSize() {
        return inputSize;
    }
}
