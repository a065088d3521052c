package com.docrender.core.operation;

import com.docrender.core.cancel.CancellationToken;
import com.docrender.core.error.ValidationException;
import com.docrender.core.model.Field;
import com.docrender.core.model.Schema;
import com.docrender.core.model.TableContent;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Groups rows by the values of one or more columns and computes aggregates per group.
 *
 * <p>Groups are emitted in the order their key first appears. Each output row holds the group
 * columns followed by the aggregates in registration order; the output schema has the same shape.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * GroupByOperation byRegion = GroupByOperation.by("region")
 *     .aggregate("count", Aggregates.count())
 *     .aggregate("revenue", Aggregates.sum("amount"));
 * }</pre>
 */
public final class GroupByOperation extends AbstractTableOperation {

    public static final String NAME = "groupBy";

    private final List<String> columns;
    private final Map<String, AggregateFunction> aggregates;

    /**
     * Creates a group-by. The iteration order of {@code aggregates} is the output column order.
     *
     * @param columns group columns
     * @param aggregates aggregate name to function
     */
    public GroupByOperation(List<String> columns, Map<String, AggregateFunction> aggregates) {
        this.columns = columns == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(columns));
        this.aggregates = aggregates == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(aggregates));
    }

    /**
     * Starts a group-by on the given columns without aggregates.
     *
     * @param columns group columns
     * @return group-by operation
     */
    public static GroupByOperation by(String... columns) {
        return new GroupByOperation(Arrays.asList(columns), Map.of());
    }

    /**
     * Returns a copy with one more aggregate appended.
     *
     * @param name output column name
     * @param function aggregate function
     * @return new group-by operation
     */
    public GroupByOperation aggregate(String name, AggregateFunction function) {
        Map<String, AggregateFunction> copy = new LinkedHashMap<>(aggregates);
        copy.put(name, function);
        return new GroupByOperation(columns, copy);
    }

    public List<String> columns() {
        return columns;
    }

    public Map<String, AggregateFunction> aggregates() {
        return aggregates;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void validate() {
        if (columns.isEmpty()) {
            throw new ValidationException("columns", columns, "groupBy operation requires at least one grouping column");
        }
        for (String column : columns) {
            if (column == null || column.isBlank()) {
                throw new ValidationException("columns", columns, "grouping column cannot be empty");
            }
        }
        if (aggregates.isEmpty()) {
            throw new ValidationException("aggregates", aggregates.keySet(), "groupBy operation requires at least one aggregate function");
        }
        for (Map.Entry<String, AggregateFunction> entry : aggregates.entrySet()) {
            if (entry.getKey() == null || entry.getKey().isBlank()) {
                throw new ValidationException("aggregates", entry.getKey(), "aggregate name cannot be empty");
            }
            if (entry.getValue() == null) {
                throw new ValidationException("aggregates", entry.getKey(), "aggregate function cannot be null");
            }
            if (columns.contains(entry.getKey())) {
                throw new ValidationException("aggregates", entry.getKey(), "aggregate name collides with a grouping column");
            }
        }
    }

    @Override
    protected TableContent applyToTable(TableContent table, CancellationToken token) {
        columns.forEach(column -> requireColumn(table, column));

        Map<List<Object>, List<Map<String, Object>>> groups = new LinkedHashMap<>();
        for (Map<String, Object> row : table.rows()) {
            checkCancelled(token, table);
            List<Object> key = new ArrayList<>(columns.size());
            for (String column : columns) {
                key.add(row.get(column));
            }
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(row);
        }

        List<Map<String, Object>> output = new ArrayList<>(groups.size());
        for (Map.Entry<List<Object>, List<Map<String, Object>>> group : groups.entrySet()) {
            checkCancelled(token, table);
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 0; i < columns.size(); i++) {
                row.put(columns.get(i), group.getKey().get(i));
            }
            List<Map<String, Object>> members = Collections.unmodifiableList(group.getValue());
            aggregates.forEach((name, function) ->
                row.put(name, Callbacks.invoke(NAME, "aggregate '" + name + "'", () -> function.apply(members))));
            output.add(row);
        }
        return table.withSchemaAndRows(outputSchema(table.schema()), output);
    }

    private Schema outputSchema(Schema input) {
        List<Field> fields = new ArrayList<>();
        for (String column : columns) {
            fields.add(input.findField(column).orElseGet(() -> Field.of(column)));
        }
        aggregates.keySet().forEach(name -> fields.add(Field.of(name)));
        return new Schema(fields);
    }
}
