package com.docrender.core.error;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Aggregate result of one render call in which one or more formats or writers failed.
 *
 * <p>Each failure is kept with its {@link ErrorSource} classification so callers can tell renderer,
 * transformer, writer and cancellation failures apart without parsing messages. The first failure
 * is also exposed as {@link #getCause()}; all of them are attached as suppressed exceptions so
 * stack traces stay complete in logs.
 */
public class MultiRenderException extends DocRenderException {

    private static final long serialVersionUID = 1L;

    private final transient List<ErrorSource> sources;

    public MultiRenderException(List<ErrorSource> sources) {
        super(formatMessage(sources), sources.isEmpty() ? null : sources.get(0).error());
        this.sources = List.copyOf(sources);
        for (int i = 1; i < this.sources.size(); i++) {
            addSuppressed(this.sources.get(i).error());
        }
    }

    /** Classified failures, in the order they were collected. */
    public List<ErrorSource> sources() {
        return sources;
    }

    /** The failures themselves. */
    public List<DocRenderException> errors() {
        return sources.stream().map(ErrorSource::error).toList();
    }

    /**
     * Returns the failures that originated in the given component.
     *
     * @param component originating component
     * @return matching failures, possibly empty
     */
    public List<DocRenderException> errorsFrom(ErrorComponent component) {
        Objects.requireNonNull(component, "component must not be null");
        return sources.stream()
            .filter(source -> source.component() == component)
            .map(ErrorSource::error)
            .toList();
    }

    private static String formatMessage(List<ErrorSource> sources) {
        if (sources.isEmpty()) {
            throw new IllegalArgumentException("MultiRenderException requires at least one failure");
        }
        if (sources.size() == 1) {
            ErrorSource only = sources.get(0);
            return "render failed [" + only.component() + "]: " + only.error().getMessage();
        }
        return sources.size() + " render failures:\n" + sources.stream()
            .map(source -> "  - [" + source.component() + "] " + source.error().getMessage())
            .collect(Collectors.joining("\n"));
    }
}
