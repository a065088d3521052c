package com.docrender.core.model;

import com.docrender.core.util.IdGenerator;

import java.util.List;
import java.util.Objects;

/**
 * Titled group of nested content.
 *
 * @param id stable identifier; generated when null
 * @param title section heading
 * @param level heading level, 0 for top level
 * @param contents nested content in order
 */
public record SectionContent(String id, String title, int level, List<Content> contents) implements Content {

    /**
     * Compact constructor with validation.
     */
    public SectionContent {
        if (id == null) {
            id = IdGenerator.randomContentId();
        }
        Objects.requireNonNull(title, "title must not be null");
        if (level < 0) {
            throw new IllegalArgumentException("level must not be negative: " + level);
        }
        contents = contents == null ? List.of() : List.copyOf(contents);
    }

    public static SectionContent of(String title, Content... contents) {
        return new SectionContent(null, title, 0, List.of(contents));
    }

    @Override
    public ContentType type() {
        return ContentType.SECTION;
    }
}
