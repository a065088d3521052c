package com.docrender.core.render.impl;

/**
 * A field formatter that threw during rendering. The raw value was rendered instead.
 *
 * @param contentId table id
 * @param field field name
 * @param value string form of the raw value
 * @param error the formatter's exception
 */
public record FormatterFailure(String contentId, String field, String value, Throwable error) {
}
