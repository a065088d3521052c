package com.docrender.core.model;

import com.docrender.core.operation.Operation;

import java.util.List;

/**
 * One addressable unit of a {@link Document}.
 *
 * <p>The set of variants is closed. Every variant is an immutable record with a stable identifier
 * and an ordered, read-only list of attached {@link Operation}s. Only {@link TableContent} accepts
 * operations; the other variants always report an empty list and pass through the transformation
 * pipeline unchanged.
 */
public sealed interface Content
    permits TableContent, TextContent, RawContent, SectionContent, ChartContent,
            GraphContent, DiagramContent, CollapsibleSection {

    /**
     * Returns the stable identifier used in diagnostics.
     *
     * @return content id
     */
    String id();

    /**
     * Returns the variant of this content.
     *
     * @return content type
     */
    ContentType type();

    /**
     * Returns the operations to run on this content before it is serialized.
     *
     * @return read-only operation list in execution order
     */
    default List<Operation> operations() {
        return List.of();
    }
}
