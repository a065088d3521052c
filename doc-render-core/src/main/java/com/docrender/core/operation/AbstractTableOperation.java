package com.docrender.core.operation;

import com.docrender.core.cancel.CancellationToken;
import com.docrender.core.error.CancelledException;
import com.docrender.core.error.OperationException;
import com.docrender.core.model.Content;
import com.docrender.core.model.TableContent;

/**
 * Base class for operations that only work on {@link TableContent}.
 *
 * <p>Subclasses implement {@link #applyToTable}; non-table content is rejected with an
 * {@link OperationException}.
 */
public abstract class AbstractTableOperation implements Operation {

    @Override
    public final Content apply(Content content, CancellationToken token) {
        if (!(content instanceof TableContent table)) {
            throw new OperationException(name(), name() + " requires table content, got " + content.type().displayName());
        }
        return applyToTable(table, token);
    }

    /**
     * Applies this operation to a table.
     *
     * @param table input table, left untouched
     * @param token cancellation token
     * @return new table
     */
    protected abstract TableContent applyToTable(TableContent table, CancellationToken token);

    /**
     * Throws {@link CancelledException} if the token has fired.
     *
     * @param token cancellation token
     * @param table table being processed
     */
    protected static void checkCancelled(CancellationToken token, TableContent table) {
        if (token.isCancelled()) {
            throw CancelledException.forContent(table.id(), token.cause());
        }
    }

    /**
     * Throws {@link OperationException} if the column is not part of the table schema.
     *
     * @param table table being processed
     * @param column required column
     */
    protected void requireColumn(TableContent table, String column) {
        if (!table.schema().hasField(column)) {
            throw new OperationException(name(),
                name() + ": column '" + column + "' not found in schema " + table.schema().fieldNames());
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + name() + "]";
    }
}
