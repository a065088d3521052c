package com.docrender.core.model;

import com.docrender.core.util.IdGenerator;

import java.util.Objects;

/**
 * Diagram source written in a diagram language.
 *
 * @param id stable identifier; generated when null
 * @param title diagram title
 * @param language diagram language, e.g. "mermaid" or "drawio"
 * @param source diagram source text
 */
public record DiagramContent(String id, String title, String language, String source) implements Content {

    /**
     * Compact constructor with validation.
     */
    public DiagramContent {
        if (id == null) {
            id = IdGenerator.randomContentId();
        }
        Objects.requireNonNull(language, "language must not be null");
        Objects.requireNonNull(source, "source must not be null");
    }

    @Override
    public ContentType type() {
        return ContentType.DIAGRAM;
    }
}
