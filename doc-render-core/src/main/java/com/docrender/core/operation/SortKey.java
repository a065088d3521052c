package com.docrender.core.operation;

import java.util.Objects;

/**
 * One column of a multi-key sort.
 *
 * @param column column name
 * @param direction sort direction
 */
public record SortKey(String column, SortDirection direction) {

    /**
     * Compact constructor with validation.
     */
    public SortKey {
        Objects.requireNonNull(direction, "direction must not be null");
    }

    public static SortKey ascending(String column) {
        return new SortKey(column, SortDirection.ASCENDING);
    }

    public static SortKey descending(String column) {
        return new SortKey(column, SortDirection.DESCENDING);
    }

    /**
     * Parses {@code column} or {@code column:asc|desc}.
     *
     * @param text key text
     * @return sort key, ascending when no direction is given
     */
    public static SortKey parse(String text) {
        int separator = text.lastIndexOf(':');
        if (separator < 0) {
            return ascending(text.trim());
        }
        return new SortKey(text.substring(0, separator).trim(), SortDirection.parse(text.substring(separator + 1)));
    }
}
