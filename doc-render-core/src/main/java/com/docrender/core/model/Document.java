package com.docrender.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * An ordered, immutable collection of {@link Content} plus key/value metadata.
 *
 * <p>Rendering never mutates a document; transformation produces new documents.
 *
 * @param contents content in display order
 * @param metadata document metadata, insertion ordered
 */
public record Document(List<Content> contents, Map<String, Object> metadata) {

    /**
     * Compact constructor with validation.
     */
    public Document {
        contents = contents == null ? List.of() : List.copyOf(contents);
        metadata = metadata == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /**
     * Creates a document without metadata.
     *
     * @param contents content in display order
     * @return document
     */
    public static Document of(Content... contents) {
        return new Document(List.of(contents), Map.of());
    }

    /**
     * Returns a copy with one metadata entry added or replaced.
     *
     * @param key metadata key
     * @param value metadata value
     * @return new document
     */
    public Document withMetadata(String key, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(metadata);
        copy.put(key, value);
        return new Document(contents, copy);
    }
}
