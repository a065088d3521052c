package com.docrender.core.model;

import com.docrender.core.util.IdGenerator;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Chart data. The shape of {@link #data()} depends on {@link #chartType()}.
 *
 * @param id stable identifier; generated when null
 * @param title chart title
 * @param chartType chart kind, e.g. "pie" or "gantt"
 * @param data chart values
 */
public record ChartContent(String id, String title, String chartType, Map<String, Object> data) implements Content {

    /**
     * Compact constructor with validation.
     */
    public ChartContent {
        if (id == null) {
            id = IdGenerator.randomContentId();
        }
        Objects.requireNonNull(chartType, "chartType must not be null");
        data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    @Override
    public ContentType type() {
        return ContentType.CHART;
    }
}
