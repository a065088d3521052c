package com.docrender.core.operation;

import com.docrender.core.cancel.CancellationToken;
import com.docrender.core.error.ValidationException;
import com.docrender.core.model.TableContent;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Stable multi-key sort.
 *
 * <p>Either sorts by {@link SortKey}s using {@link ValueComparator}, or by a custom row comparator.
 * Rows that compare equal keep their input order.
 */
public final class SortOperation extends AbstractTableOperation {

    public static final String NAME = "sort";

    private final List<SortKey> keys;
    private final Comparator<Map<String, Object>> comparator;

    public SortOperation(SortKey... keys) {
        this(keys == null ? List.of() : List.of(keys));
    }

    public SortOperation(List<SortKey> keys) {
        this.keys = keys == null ? List.of() : List.copyOf(keys);
        this.comparator = null;
    }

    private SortOperation(Comparator<Map<String, Object>> comparator) {
        this.keys = List.of();
        this.comparator = comparator;
    }

    /**
     * Creates a sort that orders rows with a custom comparator.
     *
     * @param comparator row comparator
     * @return sort operation
     */
    public static SortOperation comparing(Comparator<Map<String, Object>> comparator) {
        return new SortOperation(comparator);
    }

    public List<SortKey> keys() {
        return keys;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void validate() {
        if (comparator != null) {
            return;
        }
        if (keys.isEmpty()) {
            throw new ValidationException("keys", keys, "sort operation requires at least one sort key");
        }
        for (SortKey key : keys) {
            if (key.column() == null || key.column().isBlank()) {
                throw new ValidationException("keys", key, "sort column cannot be empty");
            }
        }
    }

    @Override
    protected TableContent applyToTable(TableContent table, CancellationToken token) {
        Comparator<Map<String, Object>> order;
        if (comparator != null) {
            order = Callbacks.guard(NAME, comparator);
        } else {
            keys.forEach(key -> requireColumn(table, key.column()));
            order = keyComparator();
        }
        checkCancelled(token, table);
        List<Map<String, Object>> sorted = new ArrayList<>(table.rows());
        sorted.sort(order);
        checkCancelled(token, table);
        return table.withRows(sorted);
    }

    private Comparator<Map<String, Object>> keyComparator() {
        Comparator<Map<String, Object>> result = null;
        for (SortKey key : keys) {
            Comparator<Map<String, Object>> single =
                (left, right) -> ValueComparator.INSTANCE.compare(left.get(key.column()), right.get(key.column()));
            if (key.direction() == SortDirection.DESCENDING) {
                single = single.reversed();
            }
            result = result == null ? single : result.thenComparing(single);
        }
        return result;
    }
}
