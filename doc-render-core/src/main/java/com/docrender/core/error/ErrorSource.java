package com.docrender.core.error;

import java.util.Map;
import java.util.Objects;

/**
 * Classification of one failure inside a {@link MultiRenderException}.
 *
 * @param component originating component
 * @param error the failure itself
 * @param details structured diagnostics (format, component identity, byte counts)
 */
public record ErrorSource(
    ErrorComponent component,
    DocRenderException error,
    Map<String, Object> details
) {
    /**
     * Compact constructor with validation.
     */
    public ErrorSource {
        Objects.requireNonNull(component, "component must not be null");
        Objects.requireNonNull(error, "error must not be null");
        details = details == null ? Map.of() : Map.copyOf(details);
    }

    /**
     * Classifies a failure raised by the render orchestrator.
     *
     * @param error render, transform, writer or cancellation failure
     * @return classified source
     */
    public static ErrorSource classify(DocRenderException error) {
        if (error instanceof RenderException render) {
            return new ErrorSource(ErrorComponent.RENDERER, render, Map.of(
                "format", render.format(),
                "renderer", render.rendererType(),
                "output_size", render.outputSize()));
        }
        if (error instanceof TransformException transform) {
            return new ErrorSource(ErrorComponent.TRANSFORMER, transform, Map.of(
                "format", transform.format(),
                "transformer", transform.transformer(),
                "input_size", transform.inputSize()));
        }
        if (error instanceof WriterException writer) {
            return new ErrorSource(ErrorComponent.WRITER, writer, Map.of(
                "format", writer.format(),
                "writer", writer.writer(),
                "data_size", writer.dataSize()));
        }
        if (error instanceof CancelledException cancelled) {
            return new ErrorSource(ErrorComponent.CANCELLATION, cancelled, Map.of(
                "scope", cancelled.scope().name().toLowerCase(),
                "name", cancelled.name()));
        }
        throw new IllegalArgumentException("Unclassifiable render failure: " + error.getClass().getName());
    }
}
