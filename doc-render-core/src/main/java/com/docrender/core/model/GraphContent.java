package com.docrender.core.model;

import com.docrender.core.util.IdGenerator;

import java.util.List;

/**
 * Directed graph described by its edges.
 *
 * @param id stable identifier; generated when null
 * @param title graph title
 * @param edges edges in declaration order
 */
public record GraphContent(String id, String title, List<Edge> edges) implements Content {

    /**
     * Compact constructor with validation.
     */
    public GraphContent {
        if (id == null) {
            id = IdGenerator.randomContentId();
        }
        edges = edges == null ? List.of() : List.copyOf(edges);
    }

    @Override
    public ContentType type() {
        return ContentType.GRAPH;
    }
}
