package com.docrender.core.render.impl;

import com.docrender.core.cancel.CancellationToken;
import com.docrender.core.model.Field;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-render state shared by {@link AbstractContentRenderer} and its subclasses.
 *
 * <p>Field formatters are invoked through {@link #format}, which never lets a formatter failure
 * escape: the failure is logged and recorded, and the raw value is rendered instead.
 */
public final class RenderContext {

    private static final Logger log = LoggerFactory.getLogger(RenderContext.class);

    private final CancellationToken token;
    private final String format;
    private final List<FormatterFailure> failures = new ArrayList<>();

    RenderContext(CancellationToken token, String format) {
        this.token = token;
        this.format = format;
    }

    public CancellationToken token() {
        return token;
    }

    public String format() {
        return format;
    }

    /**
     * Formats a cell value for display.
     *
     * @param contentId table id, for diagnostics
     * @param field column definition
     * @param value raw value, may be null
     * @return display text; empty for null values without formatter
     */
    public String format(String contentId, Field field, Object value) {
        if (field.formatter() == null) {
            return value == null ? "" : String.valueOf(value);
        }
        try {
            return field.formatter().apply(value);
        } catch (RuntimeException e) {
            log.warn("Formatter for field '{}' of content '{}' failed on value {}: {}",
                field.name(), contentId, value, e.toString());
            failures.add(new FormatterFailure(contentId, field.name(), String.valueOf(value), e));
            return String.valueOf(value);
        }
    }

    List<FormatterFailure> failures() {
        return List.copyOf(failures);
    }
}
