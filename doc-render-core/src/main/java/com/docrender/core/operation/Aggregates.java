package com.docrender.core.operation;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Built-in aggregate functions for {@link GroupByOperation}.
 *
 * <p>Numeric aggregates consider only {@link Number} values. {@code null}, non-numeric values and
 * {@code NaN} are skipped. Results are {@link Double}; an empty numeric set yields {@code 0.0}.
 * {@link #min} and {@link #max} keep the first value seen on ties.
 */
public final class Aggregates {

    private Aggregates() {
    }

    /**
     * Number of rows in the group.
     *
     * @return aggregate returning an {@link Integer}
     */
    public static AggregateFunction count() {
        return List::size;
    }

    public static AggregateFunction sum(String field) {
        Objects.requireNonNull(field, "field must not be null");
        return rows -> numbers(rows, field).stream().mapToDouble(Double::doubleValue).sum();
    }

    public static AggregateFunction average(String field) {
        Objects.requireNonNull(field, "field must not be null");
        return rows -> {
            List<Double> values = numbers(rows, field);
            return values.isEmpty() ? 0.0 : values.stream().mapToDouble(Double::doubleValue).sum() / values.size();
        };
    }

    public static AggregateFunction min(String field) {
        Objects.requireNonNull(field, "field must not be null");
        return rows -> {
            Double best = null;
            for (Double value : numbers(rows, field)) {
                if (best == null || value < best) {
                    best = value;
                }
            }
            return best == null ? 0.0 : best;
        };
    }

    public static AggregateFunction max(String field) {
        Objects.requireNonNull(field, "field must not be null");
        return rows -> {
            Double best = null;
            for (Double value : numbers(rows, field)) {
                if (best == null || value > best) {
                    best = value;
                }
            }
            return best == null ? 0.0 : best;
        };
    }

    private static List<Double> numbers(List<Map<String, Object>> rows, String field) {
        return rows.stream()
            .map(row -> row.get(field))
            .filter(Number.class::isInstance)
            .map(value -> ((Number) value).doubleValue())
            .filter(value -> !value.isNaN())
            .toList();
    }
}
