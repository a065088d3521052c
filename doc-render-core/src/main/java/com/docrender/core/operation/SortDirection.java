package com.docrender.core.operation;

/**
 * Sort direction of a {@link SortKey}.
 */
public enum SortDirection {
    ASCENDING,
    DESCENDING;

    /**
     * Parses {@code asc}, {@code ascending}, {@code desc} or {@code descending}, ignoring case.
     *
     * @param value direction text
     * @return direction
     */
    public static SortDirection parse(String value) {
        String normalized = value.trim().toLowerCase();
        return switch (normalized) {
            case "asc", "ascending" -> ASCENDING;
            case "desc", "descending" -> DESCENDING;
            default -> throw new IllegalArgumentException("Unknown sort direction: " + value);
        };
    }
}
