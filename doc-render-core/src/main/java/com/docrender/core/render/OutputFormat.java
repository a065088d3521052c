package com.docrender.core.render;

import java.util.Objects;

/**
 * A named output format and the renderer that produces it.
 *
 * @param name format name used in diagnostics and by writers
 * @param renderer the renderer
 */
public record OutputFormat(String name, Renderer renderer) {

    /**
     * Compact constructor with validation.
     */
    public OutputFormat {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(renderer, "renderer must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("format name must not be blank");
        }
    }

    /**
     * Creates a format named after the renderer's own format.
     *
     * @param renderer the renderer
     * @return output format
     */
    public static OutputFormat of(Renderer renderer) {
        return new OutputFormat(renderer.format(), renderer);
    }
}
