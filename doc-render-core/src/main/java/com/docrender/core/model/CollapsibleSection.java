package com.docrender.core.model;

import com.docrender.core.util.IdGenerator;

import java.util.List;
import java.util.Objects;

/**
 * Section that renderers supporting it display collapsed until expanded.
 *
 * @param id stable identifier; generated when null
 * @param title summary line
 * @param contents nested content in order
 * @param expanded whether the section starts expanded
 */
public record CollapsibleSection(String id, String title, List<Content> contents, boolean expanded) implements Content {

    /**
     * Compact constructor with validation.
     */
    public CollapsibleSection {
        if (id == null) {
            id = IdGenerator.randomContentId();
        }
        Objects.requireNonNull(title, "title must not be null");
        contents = contents == null ? List.of() : List.copyOf(contents);
    }

    @Override
    public ContentType type() {
        return ContentType.COLLAPSIBLE_SECTION;
    }
}
