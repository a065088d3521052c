package com.docrender.core.error;

/**
 * A renderer failed to serialize a document for one format.
 */
public class RenderException extends DocRenderException {

    private static final long serialVersionUID = 1L;

    private final String format;
    private final String rendererType;
    private final int outputSize;

    public RenderException(String format, String rendererType, int outputSize, Throwable cause) {
        super(String.format("render failed; format=%s; renderer=%s; output_size=%d; cause: %s",
                format, rendererType, outputSize, cause.getMessage()), cause);
        this.format = format;
        this.rendererType = rendererType;
        this.outputSize = outputSize;
    }

    public String format() {
        return format;
    }

    /** Simple class name of the renderer implementation. */
    public String rendererType() {
        return rendererType;
    }

    /** Bytes produced before the failure, {@code 0} when unknown. */
    public int outputSize() {
        return outputSize;
    }
}
