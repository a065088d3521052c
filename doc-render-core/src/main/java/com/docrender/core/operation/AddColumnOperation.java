package com.docrender.core.operation;

import com.docrender.core.cancel.CancellationToken;
import com.docrender.core.error.OperationException;
import com.docrender.core.error.ValidationException;
import com.docrender.core.model.Field;
import com.docrender.core.model.Schema;
import com.docrender.core.model.TableContent;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Adds a derived column computed from each row.
 *
 * <p>The column is inserted at {@code position} (0 is first). A {@code null} position or one past
 * the last column appends.
 */
public final class AddColumnOperation extends AbstractTableOperation {

    public static final String NAME = "addColumn";

    private final String column;
    private final Function<Map<String, Object>, Object> function;
    private final Integer position;

    public AddColumnOperation(String column, Function<Map<String, Object>, Object> function) {
        this(column, function, null);
    }

    public AddColumnOperation(String column, Function<Map<String, Object>, Object> function, Integer position) {
        this.column = column;
        this.function = function;
        this.position = position;
    }

    public String column() {
        return column;
    }

    public Integer position() {
        return position;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void validate() {
        if (column == null || column.isBlank()) {
            throw new ValidationException("column", column, "column name cannot be empty");
        }
        if (function == null) {
            throw new ValidationException("function", null, "column function cannot be null");
        }
        if (position != null && position < 0) {
            throw new ValidationException("position", position, "column position must be non-negative");
        }
    }

    @Override
    protected TableContent applyToTable(TableContent table, CancellationToken token) {
        if (table.schema().hasField(column)) {
            throw new OperationException(NAME, NAME + ": column '" + column + "' already exists");
        }
        Schema schema = table.schema().withField(position, Field.of(column));
        List<String> order = schema.fieldNames();
        Function<Map<String, Object>, Object> guarded = Callbacks.guard(NAME, "function for '" + column + "'", function);

        List<Map<String, Object>> output = new ArrayList<>(table.rows().size());
        for (Map<String, Object> row : table.rows()) {
            checkCancelled(token, table);
            Object value = guarded.apply(row);
            Map<String, Object> extended = new LinkedHashMap<>();
            for (String name : order) {
                if (name.equals(column)) {
                    extended.put(name, value);
                } else if (row.containsKey(name)) {
                    extended.put(name, row.get(name));
                }
            }
            output.add(extended);
        }
        return table.withSchemaAndRows(schema, output);
    }
}
