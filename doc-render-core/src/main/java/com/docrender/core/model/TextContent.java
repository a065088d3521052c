package com.docrender.core.model;

import com.docrender.core.util.IdGenerator;

import java.util.Objects;

/**
 * Unstructured text.
 *
 * @param id stable identifier; generated when null
 * @param text the text
 * @param header whether renderers should present the text as a heading
 */
public record TextContent(String id, String text, boolean header) implements Content {

    /**
     * Compact constructor with validation.
     */
    public TextContent {
        if (id == null) {
            id = IdGenerator.randomContentId();
        }
        Objects.requireNonNull(text, "text must not be null");
    }

    public static TextContent of(String text) {
        return new TextContent(null, text, false);
    }

    public static TextContent header(String text) {
        return new TextContent(null, text, true);
    }

    @Override
    public ContentType type() {
        return ContentType.TEXT;
    }
}
