package com.docrender.core.model;

/**
 * Kinds of content a document can hold.
 */
public enum ContentType {
    /** Tabular data with an ordered schema */
    TABLE,

    /** Unstructured text */
    TEXT,

    /** Format-specific bytes passed through as-is */
    RAW,

    /** Titled group of nested content */
    SECTION,

    /** Chart data (pie, gantt, bar) */
    CHART,

    /** Directed graph of labelled edges */
    GRAPH,

    /** Diagram source in a diagram language (mermaid, drawio) */
    DIAGRAM,

    /** Section that renderers may display collapsed */
    COLLAPSIBLE_SECTION;

    /**
     * Returns the lowercase name used in diagnostics and serialized output.
     *
     * @return display name, e.g. {@code "table"}
     */
    public String displayName() {
        return name().toLowerCase();
    }
}
