package com.docrender.core.model;

import java.util.Objects;

/**
 * Directed edge of a {@link GraphContent}.
 *
 * @param from source node
 * @param to target node
 * @param label optional edge label
 */
public record Edge(String from, String to, String label) {

    /**
     * Compact constructor with validation.
     */
    public Edge {
        Objects.requireNonNull(from, "from must not be null");
        Objects.requireNonNull(to, "to must not be null");
    }
}
