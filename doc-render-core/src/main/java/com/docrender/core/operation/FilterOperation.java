package com.docrender.core.operation;

import com.docrender.core.cancel.CancellationToken;
import com.docrender.core.error.ValidationException;
import com.docrender.core.model.TableContent;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Keeps the rows for which a predicate holds. Schema and key order are unchanged.
 */
public final class FilterOperation extends AbstractTableOperation {

    public static final String NAME = "filter";

    private final Predicate<Map<String, Object>> predicate;

    public FilterOperation(Predicate<Map<String, Object>> predicate) {
        this.predicate = predicate;
    }

    public Predicate<Map<String, Object>> predicate() {
        return predicate;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void validate() {
        if (predicate == null) {
            throw new ValidationException("predicate", null, "filter predicate cannot be null");
        }
    }

    @Override
    protected TableContent applyToTable(TableContent table, CancellationToken token) {
        Predicate<Map<String, Object>> guarded = Callbacks.guard(NAME, predicate);
        List<Map<String, Object>> kept = new ArrayList<>();
        for (Map<String, Object> row : table.rows()) {
            checkCancelled(token, table);
            if (guarded.test(row)) {
                kept.add(row);
            }
        }
        return table.withRows(kept);
    }

    @Override
    public boolean canOptimize(Operation other) {
        return other instanceof FilterOperation;
    }
}
