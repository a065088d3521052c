package com.docrender.core.model;

import java.util.Objects;
import java.util.function.Function;

/**
 * A column of a {@link Schema}.
 *
 * @param name column name, used as row key
 * @param type optional type hint (e.g. "string", "number")
 * @param formatter optional display formatter applied by renderers
 * @param hidden whether renderers should omit the column
 */
public record Field(
    String name,
    String type,
    Function<Object, String> formatter,
    boolean hidden
) {
    /**
     * Compact constructor with validation.
     */
    public Field {
        Objects.requireNonNull(name, "name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("field name must not be blank");
        }
    }

    /**
     * Creates a visible, untyped field without formatter.
     *
     * @param name column name
     * @return field
     */
    public static Field of(String name) {
        return new Field(name, null, null, false);
    }
}
