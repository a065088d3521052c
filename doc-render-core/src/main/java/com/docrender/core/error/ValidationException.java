package com.docrender.core.error;

/**
 * Thrown by {@code Operation.validate()} when an operation is structurally invalid, for example a
 * missing predicate, a negative limit or empty group columns. Always raised before any data is
 * touched and never retried.
 */
public class ValidationException extends DocRenderException {

    private static final long serialVersionUID = 1L;

    private final String field;
    private final transient Object value;

    public ValidationException(String field, Object value, String message) {
        super(formatMessage(field, value, message));
        this.field = field;
        this.value = value;
    }

    /** The configuration field that failed validation. */
    public String field() {
        return field;
    }

    /** The rejected value, may be {@code null}. */
    public Object value() {
        return value;
    }

    private static String formatMessage(String field, Object value, String message) {
        return "field \"" + field + "\": value " + value + ": " + message;
    }
}
