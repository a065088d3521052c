package com.docrender.core.model;

import com.docrender.core.operation.Operation;
import com.docrender.core.util.IdGenerator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Tabular content: an ordered {@link Schema} and an ordered list of rows.
 *
 * <p>Rows map field names to dynamically typed values; {@code null} values are allowed. Every row
 * key must be a field of the schema. Rows are copied into unmodifiable insertion-ordered maps on
 * construction, so a table never aliases the caller's collections.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * TableContent users = TableContent.of("Users", Schema.ofKeys("name", "age"), List.of(
 *         Map.of("name", "Alice", "age", 30),
 *         Map.of("name", "Bob", "age", 25)))
 *     .withOperations(new SortOperation(SortKey.descending("age")), new LimitOperation(1));
 * }</pre>
 *
 * @param id stable identifier; generated when null
 * @param title optional title
 * @param schema column definition
 * @param rows rows in display order
 * @param operations operations to run before serialization
 */
public record TableContent(
    String id,
    String title,
    Schema schema,
    List<Map<String, Object>> rows,
    List<Operation> operations
) implements Content {

    /**
     * Compact constructor with validation.
     */
    public TableContent {
        if (id == null) {
            id = IdGenerator.randomContentId();
        }
        Objects.requireNonNull(schema, "schema must not be null");
        rows = copyRows(rows == null ? List.of() : rows, schema);
        operations = operations == null ? List.of() : List.copyOf(operations);
    }

    /**
     * Creates a table with a generated id and no operations.
     *
     * @param title table title
     * @param schema column definition
     * @param rows rows
     * @return table
     */
    public static TableContent of(String title, Schema schema, List<? extends Map<String, ?>> rows) {
        return new TableContent(null, title, schema, widen(rows), List.of());
    }

    @Override
    public ContentType type() {
        return ContentType.TABLE;
    }

    /**
     * Returns a copy with the same id, title and schema but different rows.
     *
     * @param newRows replacement rows
     * @return new table
     */
    public TableContent withRows(List<? extends Map<String, ?>> newRows) {
        return new TableContent(id, title, schema, widen(newRows), operations);
    }

    /**
     * Returns a copy with the same id and title but a different schema and rows.
     *
     * @param newSchema replacement schema
     * @param newRows replacement rows
     * @return new table
     */
    public TableContent withSchemaAndRows(Schema newSchema, List<? extends Map<String, ?>> newRows) {
        return new TableContent(id, title, newSchema, widen(newRows), operations);
    }

    /**
     * Returns a copy with the given operations attached in place of the current ones.
     *
     * @param newOperations operations in execution order
     * @return new table with the same id
     */
    public TableContent withOperations(Operation... newOperations) {
        return new TableContent(id, title, schema, rows, List.of(newOperations));
    }

    private static List<Map<String, Object>> copyRows(List<? extends Map<String, ?>> source, Schema schema) {
        List<String> names = schema.fieldNames();
        List<Map<String, Object>> copy = new ArrayList<>(source.size());
        for (int i = 0; i < source.size(); i++) {
            Map<String, ?> row = Objects.requireNonNull(source.get(i), "row " + i + " must not be null");
            for (String key : row.keySet()) {
                if (!names.contains(key)) {
                    throw new IllegalArgumentException("row " + i + " has key '" + key + "' not in schema " + names);
                }
            }
            copy.add(Collections.unmodifiableMap(new LinkedHashMap<>(row)));
        }
        return Collections.unmodifiableList(copy);
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> widen(List<? extends Map<String, ?>> rows) {
        return (List<Map<String, Object>>) (List<?>) rows;
    }
}
