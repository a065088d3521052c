package com.docrender.core.operation;

import com.docrender.core.cancel.CancellationToken;
import com.docrender.core.error.ValidationException;
import com.docrender.core.model.TableContent;

/**
 * Keeps the first {@code count} rows.
 */
public final class LimitOperation extends AbstractTableOperation {

    public static final String NAME = "limit";

    private final int count;

    public LimitOperation(int count) {
        this.count = count;
    }

    public int count() {
        return count;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void validate() {
        if (count < 0) {
            throw new ValidationException("count", count, "limit count must be non-negative");
        }
    }

    @Override
    protected TableContent applyToTable(TableContent table, CancellationToken token) {
        checkCancelled(token, table);
        int end = Math.min(count, table.rows().size());
        return table.withRows(table.rows().subList(0, end));
    }
}
